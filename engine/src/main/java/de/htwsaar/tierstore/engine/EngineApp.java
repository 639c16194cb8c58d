package de.htwsaar.tierstore.engine;

import de.htwsaar.tierstore.common.auth.SecurityConfig;
import de.htwsaar.tierstore.common.logging.LoggingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@Import({LoggingConfig.class, SecurityConfig.class})
@Profile("engine")
public class EngineApp {
    public static void main(String[] args) {
        SpringApplication.run(EngineApp.class, args);
    }
}
