package de.htwsaar.tierstore.engine;

import de.htwsaar.tierstore.engine.adapter.AdapterInvoker;
import de.htwsaar.tierstore.engine.adapter.BackendRegistry;
import de.htwsaar.tierstore.engine.adapter.fs.LocalFsBackendAdapter;
import de.htwsaar.tierstore.engine.adapter.memory.InMemoryBackendAdapter;
import de.htwsaar.tierstore.engine.cache.CacheMetricsService;
import de.htwsaar.tierstore.engine.cache.CacheTier;
import de.htwsaar.tierstore.engine.cache.TieredCacheManager;
import de.htwsaar.tierstore.engine.config.EngineProperties;
import de.htwsaar.tierstore.engine.config.EngineProperties.BackendProperties;
import de.htwsaar.tierstore.engine.domain.Backend;
import de.htwsaar.tierstore.engine.domain.BackendAdapter;
import de.htwsaar.tierstore.engine.persistence.EngineStateRepository;
import de.htwsaar.tierstore.engine.policy.CachePolicy;
import de.htwsaar.tierstore.engine.policy.PolicyStore;
import de.htwsaar.tierstore.engine.policy.PolicyTemplates;
import de.htwsaar.tierstore.engine.policy.TrafficQuotaPolicy;
import de.htwsaar.tierstore.engine.quota.QuotaEnforcer;
import de.htwsaar.tierstore.engine.replication.ReplicationCoordinator;
import de.htwsaar.tierstore.engine.replication.RetryPolicy;
import de.htwsaar.tierstore.engine.service.MaintenanceScheduler;
import de.htwsaar.tierstore.engine.service.StateRecovery;
import de.htwsaar.tierstore.engine.service.StorageEngine;
import de.htwsaar.tierstore.engine.usage.ResourceTracker;
import de.htwsaar.tierstore.engine.violation.ViolationReporter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Zentrale Spring-Verdrahtung der Engine-Komponenten.
 *
 * <p>Schichtung: Controller → StorageEngine → Policy/Usage/Quota/Cache/Replikation → Adapter</p>
 */
@Configuration
@Profile("engine")
@EnableConfigurationProperties(EngineProperties.class)
public class EngineBeans {

    /**
     * Systemuhr für den gesamten Engine-Kontext.
     *
     * @return UTC-Clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Registriert die konfigurierten Backends mit ihren Referenz-Adaptern.
     */
    @Bean
    public BackendRegistry backendRegistry(EngineProperties props) {
        BackendRegistry registry = new BackendRegistry();
        for (BackendProperties b : props.getBackends()) {
            Backend backend = new Backend(
                    b.getId(), b.getRegion(), b.isSupportsReplication(), b.isSupportsStreaming(), b.getCostTier());
            registry.register(backend, adapterFor(b));
        }
        return registry;
    }

    @Bean
    public PolicyStore policyStore() {
        return new PolicyStore();
    }

    @Bean
    public EngineStateRepository engineStateRepository(EngineProperties props, Clock clock) {
        createParentDirectory(props.getJdbcUrl());
        return EngineStateRepository.open(props.getJdbcUrl(), clock);
    }

    @Bean
    public ViolationReporter violationReporter(Clock clock, EngineStateRepository repository) {
        return new ViolationReporter(clock, repository);
    }

    /**
     * Nutzungszähler; die Fensterlänge kommt aus der jeweils aktiven Traffic-Quota.
     */
    @Bean
    public ResourceTracker resourceTracker(Clock clock, PolicyStore policies) {
        return new ResourceTracker(clock, backendId -> policies.trafficQuota(backendId)
                .map(TrafficQuotaPolicy::window)
                .orElse(null));
    }

    @Bean
    public QuotaEnforcer quotaEnforcer(PolicyStore policies, ResourceTracker tracker, ViolationReporter violations) {
        return new QuotaEnforcer(policies, tracker, violations);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService adapterExecutor(EngineProperties props) {
        return Executors.newFixedThreadPool(
                Math.max(1, props.getThreads().getAdapter()), new CustomizableThreadFactory("tierstore-adapter-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService copyExecutor(EngineProperties props) {
        return Executors.newFixedThreadPool(
                Math.max(1, props.getThreads().getCopy()), new CustomizableThreadFactory("tierstore-copy-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService demotionExecutor(EngineProperties props) {
        return Executors.newFixedThreadPool(
                Math.max(1, props.getThreads().getDemotion()), new CustomizableThreadFactory("tierstore-demote-"));
    }

    @Bean
    public AdapterInvoker adapterInvoker(@Qualifier("adapterExecutor") ExecutorService adapterExecutor) {
        return new AdapterInvoker(adapterExecutor);
    }

    @Bean
    public CacheMetricsService cacheMetricsService(Clock clock) {
        return new CacheMetricsService(clock);
    }

    /**
     * Baut die Cache-Hierarchie. Startwerte kommen aus der Vorgabe der Kostenklasse; gespeicherte
     * Cache-Policies werden bei der Wiederherstellung übernommen.
     */
    @Bean
    public TieredCacheManager tieredCacheManager(
            EngineProperties props,
            BackendRegistry registry,
            Clock clock,
            @Qualifier("demotionExecutor") ExecutorService demotionExecutor,
            CacheMetricsService metrics) {

        List<String> tierIds = new ArrayList<>(props.getCache().getTiers());
        if (tierIds.isEmpty()) {
            registry.all().stream()
                    .sorted(Comparator.comparing(Backend::costTier))
                    .forEach(b -> tierIds.add(b.id()));
        }
        List<CacheTier> tiers = new ArrayList<>();
        for (String id : tierIds) {
            Backend backend = registry.backend(id);
            CachePolicy initial = PolicyTemplates.forCostTier(backend.costTier()).stream()
                    .filter(CachePolicy.class::isInstance)
                    .map(CachePolicy.class::cast)
                    .findFirst()
                    .orElseThrow();
            tiers.add(CacheTier.from(id, initial));
        }
        return new TieredCacheManager(tiers, props.getCache().getStrategy(), clock, demotionExecutor, metrics);
    }

    @Bean
    public ReplicationCoordinator replicationCoordinator(
            EngineProperties props,
            BackendRegistry registry,
            PolicyStore policies,
            QuotaEnforcer quota,
            ResourceTracker tracker,
            ViolationReporter violations,
            AdapterInvoker invoker,
            @Qualifier("copyExecutor") ExecutorService copyExecutor,
            Clock clock) {
        RetryPolicy retry = new RetryPolicy(
                props.getRetry().getMaxAttempts(),
                Duration.ofMillis(props.getRetry().getBaseDelayMs()),
                props.getRetry().getMultiplier());
        return new ReplicationCoordinator(
                registry, policies, quota, tracker, violations, invoker, retry, copyExecutor, clock);
    }

    @Bean
    public StorageEngine storageEngine(
            BackendRegistry registry,
            PolicyStore policies,
            ResourceTracker tracker,
            QuotaEnforcer quota,
            TieredCacheManager cache,
            ReplicationCoordinator replication,
            ViolationReporter violations,
            AdapterInvoker invoker,
            EngineStateRepository repository,
            Clock clock) {
        return new StorageEngine(
                registry, policies, tracker, quota, cache, replication, violations, invoker, repository, clock);
    }

    /**
     * Stellt den gespeicherten Zustand wieder her, bevor die Engine Anfragen bedient.
     */
    @Bean
    public StateRecovery stateRecovery(
            EngineProperties props,
            EngineStateRepository repository,
            PolicyStore policies,
            ViolationReporter violations,
            ResourceTracker tracker,
            ReplicationCoordinator replication,
            StorageEngine engine,
            BackendRegistry registry,
            AdapterInvoker invoker) {
        StateRecovery recovery = new StateRecovery(repository, policies, violations, tracker, replication, engine,
                registry, invoker, Duration.ofMillis(props.getOperationTimeoutMs()));
        recovery.recover();
        if (props.isSeedTemplates()) {
            recovery.seedTemplates();
        }
        return recovery;
    }

    @Bean
    public MaintenanceScheduler maintenanceScheduler(
            EngineProperties props,
            StorageEngine engine,
            TieredCacheManager cache,
            ReplicationCoordinator replication,
            PolicyStore policies,
            StateRecovery recovered) {
        return new MaintenanceScheduler(
                engine, cache, replication, policies, Duration.ofMillis(props.getOperationTimeoutMs()));
    }

    private static BackendAdapter adapterFor(BackendProperties b) {
        String type = b.getType() == null ? "memory" : b.getType().trim().toLowerCase();
        switch (type) {
            case "memory":
                return new InMemoryBackendAdapter();
            case "fs":
                if (b.getRoot() == null || b.getRoot().isBlank()) {
                    throw new IllegalArgumentException("backend " + b.getId() + " of type fs needs a root");
                }
                return new LocalFsBackendAdapter(b.getId(), Path.of(b.getRoot()));
            default:
                throw new IllegalArgumentException("unknown backend type " + b.getType() + " for " + b.getId());
        }
    }

    private static void createParentDirectory(String jdbcUrl) {
        String prefix = "jdbc:sqlite:";
        if (!jdbcUrl.startsWith(prefix) || jdbcUrl.contains(":memory:")) {
            return;
        }
        Path parent = Path.of(jdbcUrl.substring(prefix.length())).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create database directory " + parent, e);
        }
    }
}
