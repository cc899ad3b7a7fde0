package com.paydispatch.config;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

public record DispatcherConfig(
        Mode mode,
        int httpPort,
        URI workerUrl,
        URI defaultProcessorUrl,
        URI fallbackProcessorUrl,
        int queueSize,
        int dispatchWorkers,
        int settlementThreads,
        int settlementQueueSize,
        Duration healthCheckInterval,
        Duration healthCheckTimeout,
        Duration paymentTimeout,
        Duration forwardTimeout,
        StoreType storeType,
        String databaseUrl,
        String databaseUser,
        String databasePassword,
        String valkeyHost,
        int valkeyPort,
        boolean complianceLogEnabled
) {

    public enum Mode {
        GATEWAY,
        WORKER
    }

    public enum StoreType {
        POSTGRES,
        REDIS
    }

    public DispatcherConfig {
        requirePositive("queueSize", queueSize);
        requirePositive("settlementThreads", settlementThreads);
        requirePositive("settlementQueueSize", settlementQueueSize);
        if (dispatchWorkers < 0) {
            throw new IllegalArgumentException("dispatchWorkers must be >= 0");
        }
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("httpPort out of range: " + httpPort);
        }
    }

    public static DispatcherConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static DispatcherConfig fromEnvironment(Map<String, String> env) {
        Mode mode = parseEnum(Mode.class, env.getOrDefault("MODE", "gateway"));
        int defaultPort = mode == Mode.GATEWAY ? 8080 : 8081;

        return new DispatcherConfig(
                mode,
                parseInt(env, "HTTP_PORT", defaultPort),
                URI.create(env.getOrDefault("WORKER_URL", "http://worker:8081")),
                URI.create(env.getOrDefault("PAYMENT_PROCESSOR_URL_DEFAULT", "http://localhost:8001")),
                URI.create(env.getOrDefault("PAYMENT_PROCESSOR_URL_FALLBACK", "http://localhost:8002")),
                parseInt(env, "QUEUE_SIZE", 10_000),
                parseInt(env, "NUM_WORKERS", 100),
                parseInt(env, "SETTLEMENT_THREADS", 64),
                parseInt(env, "SETTLEMENT_QUEUE_SIZE", 10_000),
                parseMillis(env, "HEALTH_CHECK_INTERVAL_MS", 5_000),
                parseMillis(env, "HEALTH_CHECK_TIMEOUT_MS", 3_000),
                parseMillis(env, "PAYMENT_TIMEOUT_MS", 3_000),
                parseMillis(env, "FORWARD_TIMEOUT_MS", 1_000),
                parseEnum(StoreType.class, env.getOrDefault("STORE_TYPE", "postgres")),
                env.getOrDefault("DATABASE_URL", "jdbc:postgresql://localhost:5432/rinha"),
                env.getOrDefault("DATABASE_USER", "postgres"),
                env.getOrDefault("DATABASE_PASSWORD", "postgres"),
                env.getOrDefault("VALKEY_HOST", "localhost"),
                parseInt(env, "VALKEY_PORT", 6379),
                Boolean.parseBoolean(env.getOrDefault("COMPLIANCE_LOG_ENABLED", "true"))
        );
    }

    private static int parseInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + value, e);
        }
    }

    private static Duration parseMillis(Map<String, String> env, String key, int defaultMillis) {
        int millis = parseInt(env, key, defaultMillis);
        if (millis <= 0) {
            throw new IllegalArgumentException(key + " must be > 0");
        }
        return Duration.ofMillis(millis);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported " + type.getSimpleName() + ": " + value, e);
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}
