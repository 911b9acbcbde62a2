package com.klinevault.data.config;

import com.klinevault.core.model.MarketType;
import com.klinevault.data.resilience.CircuitBreakerPolicy;
import com.klinevault.data.resilience.RetryPolicy;
import com.klinevault.data.transport.SelectionStrategy;
import com.klinevault.data.transport.TransportSettings;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Configuration for a data source manager.
 */
public class VaultConfig {
    private static final String DEFAULT_CACHE_DIR = System.getProperty("user.home") + "/.klinevault/cache";

    private final Path cacheDir;
    private final boolean cacheEnabled;
    private final MarketType marketType;
    private final Duration freshnessThreshold;
    private final Duration maxStaleness;
    private final Duration consolidationDelay;
    private final RetryPolicy retryPolicy;
    private final CircuitBreakerPolicy circuitBreakerPolicy;
    private final SelectionStrategy transportStrategy;
    private final List<String> transportBackends;
    private final Duration requestTimeout;
    private final boolean verifyChecksums;

    private VaultConfig(Builder b) {
        this.cacheDir = b.cacheDir;
        this.cacheEnabled = b.cacheEnabled;
        this.marketType = b.marketType;
        this.freshnessThreshold = b.freshnessThreshold;
        this.maxStaleness = b.maxStaleness;
        this.consolidationDelay = b.consolidationDelay;
        this.retryPolicy = b.retryPolicy;
        this.circuitBreakerPolicy = b.circuitBreakerPolicy;
        this.transportStrategy = b.transportStrategy;
        this.transportBackends = List.copyOf(b.transportBackends);
        this.requestTimeout = b.requestTimeout;
        this.verifyChecksums = b.verifyChecksums;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static VaultConfig defaults() {
        return builder().build();
    }

    /**
     * Load from system properties ({@code klinevault.*}) with environment fallbacks ({@code KLINEVAULT_*}).
     */
    public static VaultConfig load() {
        return load(System.getenv());
    }

    static VaultConfig load(Map<String, String> env) {
        Builder b = builder();
        Settings s = new Settings(env);

        b.cacheDir(Paths.get(s.get("cache.dir", DEFAULT_CACHE_DIR)));
        b.cacheEnabled(Boolean.parseBoolean(s.get("cache.enabled", "true")));
        b.marketType(MarketType.fromConfigKey(s.get("market", "spot")));
        b.freshnessThreshold(s.duration("cache.freshness", Duration.ofHours(24)));
        b.maxStaleness(s.duration("cache.max_staleness", Duration.ofDays(7)));
        b.consolidationDelay(s.duration("archive.consolidation_delay", Duration.ofHours(48)));

        RetryPolicy retry = RetryPolicy.defaults();
        b.retryPolicy(new RetryPolicy(
            Integer.parseInt(s.get("retry.max_attempts", String.valueOf(retry.maxAttempts()))),
            s.duration("retry.base_delay", retry.baseDelay()),
            s.duration("retry.max_delay", retry.maxDelay()),
            Double.parseDouble(s.get("retry.jitter", String.valueOf(retry.jitter())))));

        CircuitBreakerPolicy circuit = CircuitBreakerPolicy.defaults();
        b.circuitBreakerPolicy(new CircuitBreakerPolicy(
            Integer.parseInt(s.get("circuit.failure_threshold", String.valueOf(circuit.failureThreshold()))),
            s.duration("circuit.recovery_timeout", circuit.recoveryTimeout()),
            Integer.parseInt(s.get("circuit.half_open_max_calls", String.valueOf(circuit.halfOpenMaxCalls())))));

        b.transportStrategy(SelectionStrategy.fromConfig(s.get("transport.strategy", "failover")));
        b.transportBackends(Arrays.stream(s.get("transport.backends", "okhttp,jdk").split(","))
            .map(String::trim)
            .filter(id -> !id.isEmpty())
            .toList());
        b.requestTimeout(s.duration("transport.request_timeout", Duration.ofSeconds(30)));
        b.verifyChecksums(Boolean.parseBoolean(s.get("archive.verify_checksums", "true")));
        return b.build();
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public MarketType getMarketType() {
        return marketType;
    }

    /**
     * Cache entries younger than this are served without a network call.
     */
    public Duration getFreshnessThreshold() {
        return freshnessThreshold;
    }

    /**
     * Oldest stale entry still served when a refetch fails.
     */
    public Duration getMaxStaleness() {
        return maxStaleness;
    }

    /**
     * How long after a day ends the archive is expected to have it.
     */
    public Duration getConsolidationDelay() {
        return consolidationDelay;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public CircuitBreakerPolicy getCircuitBreakerPolicy() {
        return circuitBreakerPolicy;
    }

    public SelectionStrategy getTransportStrategy() {
        return transportStrategy;
    }

    public List<String> getTransportBackends() {
        return transportBackends;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public boolean isVerifyChecksums() {
        return verifyChecksums;
    }

    public TransportSettings getTransportSettings() {
        return new TransportSettings(TransportSettings.defaults().connectTimeout(), requestTimeout,
            TransportSettings.defaults().maxIdleConnections());
    }

    /**
     * Property lookup: system property first, then the matching environment variable.
     */
    private static final class Settings {
        private final Map<String, String> env;

        Settings(Map<String, String> env) {
            this.env = env;
        }

        String get(String key, String defaultValue) {
            String envName = "KLINEVAULT_" + key.toUpperCase().replace('.', '_');
            return System.getProperty("klinevault." + key, env.getOrDefault(envName, defaultValue));
        }

        /**
         * ISO-8601 ("PT30S") or plain seconds.
         */
        Duration duration(String key, Duration defaultValue) {
            String value = get(key, null);
            if (value == null || value.isBlank()) {
                return defaultValue;
            }
            value = value.trim();
            if (value.startsWith("P") || value.startsWith("p")) {
                return Duration.parse(value);
            }
            return Duration.ofSeconds(Long.parseLong(value));
        }
    }

    public static final class Builder {
        private Path cacheDir = Paths.get(DEFAULT_CACHE_DIR);
        private boolean cacheEnabled = true;
        private MarketType marketType = MarketType.SPOT;
        private Duration freshnessThreshold = Duration.ofHours(24);
        private Duration maxStaleness = Duration.ofDays(7);
        private Duration consolidationDelay = Duration.ofHours(48);
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private CircuitBreakerPolicy circuitBreakerPolicy = CircuitBreakerPolicy.defaults();
        private SelectionStrategy transportStrategy = SelectionStrategy.FAILOVER;
        private List<String> transportBackends = List.of("okhttp", "jdk");
        private Duration requestTimeout = Duration.ofSeconds(30);
        private boolean verifyChecksums = true;

        private Builder() {
        }

        public Builder cacheDir(Path cacheDir) {
            this.cacheDir = cacheDir;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder marketType(MarketType marketType) {
            this.marketType = marketType;
            return this;
        }

        public Builder freshnessThreshold(Duration freshnessThreshold) {
            this.freshnessThreshold = freshnessThreshold;
            return this;
        }

        public Builder maxStaleness(Duration maxStaleness) {
            this.maxStaleness = maxStaleness;
            return this;
        }

        public Builder consolidationDelay(Duration consolidationDelay) {
            this.consolidationDelay = consolidationDelay;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder circuitBreakerPolicy(CircuitBreakerPolicy circuitBreakerPolicy) {
            this.circuitBreakerPolicy = circuitBreakerPolicy;
            return this;
        }

        public Builder transportStrategy(SelectionStrategy transportStrategy) {
            this.transportStrategy = transportStrategy;
            return this;
        }

        public Builder transportBackends(List<String> transportBackends) {
            this.transportBackends = transportBackends;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder verifyChecksums(boolean verifyChecksums) {
            this.verifyChecksums = verifyChecksums;
            return this;
        }

        public VaultConfig build() {
            if (transportBackends == null || transportBackends.isEmpty()) {
                throw new IllegalArgumentException("At least one transport backend is required");
            }
            if (maxStaleness.compareTo(freshnessThreshold) < 0) {
                throw new IllegalArgumentException("maxStaleness must not be shorter than freshnessThreshold");
            }
            return new VaultConfig(this);
        }
    }
}
