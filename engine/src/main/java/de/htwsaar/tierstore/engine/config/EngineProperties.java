package de.htwsaar.tierstore.engine.config;

import de.htwsaar.tierstore.engine.cache.ReplacementStrategy;
import de.htwsaar.tierstore.engine.domain.CostTier;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Konfiguration der Engine unter {@code tierstore.*}.
 *
 * <p>Standardwerte sind klein und für lokale Entwicklung gedacht.</p>
 */
@ConfigurationProperties(prefix = "tierstore")
public class EngineProperties {

    /** Registrierte Backends in Reihenfolge. */
    private List<BackendProperties> backends = new ArrayList<>();

    private CacheProperties cache = new CacheProperties();

    private RetryProperties retry = new RetryProperties();

    private ThreadProperties threads = new ThreadProperties();

    /** Zeitschranke für Engine-Operationen über die API und Wartung. */
    private long operationTimeoutMs = 5_000;

    /** SQLite-Datei für Policies, Verstöße und Warmstart-Zustand. */
    private String jdbcUrl = "jdbc:sqlite:data/tierstore.db";

    /** Backends ohne Policy bekommen die Vorgaben ihrer Kostenklasse. */
    private boolean seedTemplates = true;

    public List<BackendProperties> getBackends() {
        return backends;
    }

    public void setBackends(List<BackendProperties> backends) {
        this.backends = backends;
    }

    public CacheProperties getCache() {
        return cache;
    }

    public void setCache(CacheProperties cache) {
        this.cache = cache;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    public ThreadProperties getThreads() {
        return threads;
    }

    public void setThreads(ThreadProperties threads) {
        this.threads = threads;
    }

    public long getOperationTimeoutMs() {
        return operationTimeoutMs;
    }

    public void setOperationTimeoutMs(long operationTimeoutMs) {
        this.operationTimeoutMs = operationTimeoutMs;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public void setJdbcUrl(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    public boolean isSeedTemplates() {
        return seedTemplates;
    }

    public void setSeedTemplates(boolean seedTemplates) {
        this.seedTemplates = seedTemplates;
    }

    /**
     * Ein Backend samt Adapter-Art.
     */
    public static class BackendProperties {

        private String id;

        /** "memory" oder "fs". */
        private String type = "memory";

        /** Wurzelverzeichnis bei type=fs. */
        private String root;

        private String region = "default";

        private CostTier costTier = CostTier.HOT;

        private boolean supportsReplication = true;

        private boolean supportsStreaming = false;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public CostTier getCostTier() {
            return costTier;
        }

        public void setCostTier(CostTier costTier) {
            this.costTier = costTier;
        }

        public boolean isSupportsReplication() {
            return supportsReplication;
        }

        public void setSupportsReplication(boolean supportsReplication) {
            this.supportsReplication = supportsReplication;
        }

        public boolean isSupportsStreaming() {
            return supportsStreaming;
        }

        public void setSupportsStreaming(boolean supportsStreaming) {
            this.supportsStreaming = supportsStreaming;
        }
    }

    /**
     * Cache-Hierarchie.
     */
    public static class CacheProperties {

        /** Backend-IDs der Tiers, schnellste zuerst. Leer = alle Backends nach Kostenklasse. */
        private List<String> tiers = new ArrayList<>();

        private ReplacementStrategy strategy = ReplacementStrategy.LRU;

        public List<String> getTiers() {
            return tiers;
        }

        public void setTiers(List<String> tiers) {
            this.tiers = tiers;
        }

        public ReplacementStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(ReplacementStrategy strategy) {
            this.strategy = strategy;
        }
    }

    /**
     * Wiederholung von Kopierversuchen.
     */
    public static class RetryProperties {

        private int maxAttempts = 3;

        private long baseDelayMs = 100;

        private double multiplier = 2.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }
    }

    /**
     * Größen der Thread-Pools.
     */
    public static class ThreadProperties {

        /** Pool für Adapter-Aufrufe. */
        private int adapter = 8;

        /** Pool für parallele Kopien. */
        private int copy = 4;

        /** Pool für Herabstufungen im Cache. */
        private int demotion = 1;

        public int getAdapter() {
            return adapter;
        }

        public void setAdapter(int adapter) {
            this.adapter = adapter;
        }

        public int getCopy() {
            return copy;
        }

        public void setCopy(int copy) {
            this.copy = copy;
        }

        public int getDemotion() {
            return demotion;
        }

        public void setDemotion(int demotion) {
            this.demotion = demotion;
        }
    }
}
