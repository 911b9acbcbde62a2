package com.klinevault.data.config;

import com.klinevault.core.model.MarketType;
import com.klinevault.data.resilience.CircuitBreakerPolicy;
import com.klinevault.data.resilience.RetryPolicy;
import com.klinevault.data.transport.SelectionStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VaultConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("klinevault.market");
        System.clearProperty("klinevault.retry.max_attempts");
    }

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Empty environment gives the documented defaults")
        void defaults() {
            VaultConfig config = VaultConfig.load(Map.of());

            assertTrue(config.isCacheEnabled());
            assertEquals(MarketType.SPOT, config.getMarketType());
            assertEquals(Duration.ofHours(24), config.getFreshnessThreshold());
            assertEquals(Duration.ofDays(7), config.getMaxStaleness());
            assertEquals(Duration.ofHours(48), config.getConsolidationDelay());
            assertEquals(RetryPolicy.defaults(), config.getRetryPolicy());
            assertEquals(CircuitBreakerPolicy.defaults(), config.getCircuitBreakerPolicy());
            assertEquals(SelectionStrategy.FAILOVER, config.getTransportStrategy());
            assertEquals(List.of("okhttp", "jdk"), config.getTransportBackends());
            assertEquals(Duration.ofSeconds(30), config.getRequestTimeout());
            assertTrue(config.isVerifyChecksums());
            assertTrue(config.getCacheDir().endsWith(Paths.get(".klinevault", "cache")));
        }

        @Test
        @DisplayName("Builder defaults match loaded defaults")
        void builderMatchesLoad() {
            VaultConfig built = VaultConfig.defaults();
            VaultConfig loaded = VaultConfig.load(Map.of());

            assertEquals(loaded.getCacheDir(), built.getCacheDir());
            assertEquals(loaded.getRetryPolicy(), built.getRetryPolicy());
            assertEquals(loaded.getTransportBackends(), built.getTransportBackends());
        }
    }

    @Nested
    @DisplayName("Environment")
    class EnvironmentTests {

        @Test
        @DisplayName("Should read every setting from KLINEVAULT_ variables")
        void readsEnvironment() {
            Map<String, String> env = Map.ofEntries(
                Map.entry("KLINEVAULT_CACHE_DIR", "/tmp/vault"),
                Map.entry("KLINEVAULT_CACHE_ENABLED", "false"),
                Map.entry("KLINEVAULT_MARKET", "um"),
                Map.entry("KLINEVAULT_CACHE_FRESHNESS", "PT1H"),
                Map.entry("KLINEVAULT_CACHE_MAX_STALENESS", "7200"),
                Map.entry("KLINEVAULT_ARCHIVE_CONSOLIDATION_DELAY", "P1D"),
                Map.entry("KLINEVAULT_RETRY_MAX_ATTEMPTS", "4"),
                Map.entry("KLINEVAULT_RETRY_BASE_DELAY", "PT0.5S"),
                Map.entry("KLINEVAULT_CIRCUIT_FAILURE_THRESHOLD", "3"),
                Map.entry("KLINEVAULT_CIRCUIT_RECOVERY_TIMEOUT", "120"),
                Map.entry("KLINEVAULT_TRANSPORT_STRATEGY", "round-robin"),
                Map.entry("KLINEVAULT_TRANSPORT_BACKENDS", " jdk , okhttp ,"),
                Map.entry("KLINEVAULT_TRANSPORT_REQUEST_TIMEOUT", "15"),
                Map.entry("KLINEVAULT_ARCHIVE_VERIFY_CHECKSUMS", "false"));

            VaultConfig config = VaultConfig.load(env);

            assertEquals(Paths.get("/tmp/vault"), config.getCacheDir());
            assertFalse(config.isCacheEnabled());
            assertEquals(MarketType.FUTURES_USDT, config.getMarketType());
            assertEquals(Duration.ofHours(1), config.getFreshnessThreshold());
            assertEquals(Duration.ofHours(2), config.getMaxStaleness());
            assertEquals(Duration.ofDays(1), config.getConsolidationDelay());
            assertEquals(4, config.getRetryPolicy().maxAttempts());
            assertEquals(Duration.ofMillis(500), config.getRetryPolicy().baseDelay());
            assertEquals(3, config.getCircuitBreakerPolicy().failureThreshold());
            assertEquals(Duration.ofMinutes(2), config.getCircuitBreakerPolicy().recoveryTimeout());
            assertEquals(SelectionStrategy.ROUND_ROBIN, config.getTransportStrategy());
            assertEquals(List.of("jdk", "okhttp"), config.getTransportBackends());
            assertEquals(Duration.ofSeconds(15), config.getRequestTimeout());
            assertEquals(Duration.ofSeconds(15), config.getTransportSettings().requestTimeout());
            assertFalse(config.isVerifyChecksums());
        }

        @Test
        @DisplayName("System properties win over the environment")
        void propertiesWin() {
            System.setProperty("klinevault.market", "cm");
            System.setProperty("klinevault.retry.max_attempts", "9");

            VaultConfig config = VaultConfig.load(Map.of(
                "KLINEVAULT_MARKET", "um",
                "KLINEVAULT_RETRY_MAX_ATTEMPTS", "2"));

            assertEquals(MarketType.FUTURES_COIN, config.getMarketType());
            assertEquals(9, config.getRetryPolicy().maxAttempts());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Should reject an empty backend list")
        void emptyBackends() {
            assertThrows(IllegalArgumentException.class,
                () -> VaultConfig.builder().transportBackends(List.of()).build());
            assertThrows(IllegalArgumentException.class,
                () -> VaultConfig.load(Map.of("KLINEVAULT_TRANSPORT_BACKENDS", " , ")));
        }

        @Test
        @DisplayName("Should reject a staleness limit below the freshness threshold")
        void stalenessBelowFreshness() {
            assertThrows(IllegalArgumentException.class, () -> VaultConfig.builder()
                .freshnessThreshold(Duration.ofDays(2))
                .maxStaleness(Duration.ofDays(1))
                .build());
        }

        @Test
        @DisplayName("Should reject an unknown market and a bad retry count")
        void badValues() {
            assertThrows(IllegalArgumentException.class,
                () -> VaultConfig.load(Map.of("KLINEVAULT_MARKET", "options")));
            assertThrows(IllegalArgumentException.class,
                () -> VaultConfig.load(Map.of("KLINEVAULT_RETRY_MAX_ATTEMPTS", "0")));
        }
    }
}
