package de.htwsaar.tierstore.common.auth;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Schützt die Admin-Routen der Engine mit einem gemeinsamen Token aus {@code tierstore.admin.token}.
 */
@Configuration
public class SecurityConfig {

    private final String adminToken;

    public SecurityConfig(@Value("${tierstore.admin.token:secret-token}") String adminToken) {
        if (adminToken == null || adminToken.isBlank()) {
            throw new IllegalStateException("tierstore.admin.token must not be blank");
        }
        this.adminToken = adminToken.trim();
    }

    @Bean
    public AdminAuthFilter adminAuthFilter() {
        return new AdminAuthFilter(adminToken);
    }
}
