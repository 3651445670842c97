package com.watchtower.flink;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable configuration of the Watchtower Flink job.
 *
 * <p>
 * Values are resolved from environment variables with defaults suitable for
 * a local docker-compose setup. Use {@link #fromEnvironment()} in production
 * and the {@link Builder} in tests; the builder validates at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaResultTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // State stores
    // ---------------------------------------------------------------
    private final String redisAddress;
    private final String jdbcUrl;
    private final String jdbcUser;
    private final String jdbcPassword;
    private final int jdbcPoolSize;

    // ---------------------------------------------------------------
    // Detectors
    // ---------------------------------------------------------------
    private final String detectorsConfigPath;
    private final long conditionCacheMaxSize;
    private final long conditionCacheTtlSeconds;

    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaResultTopic = b.kafkaResultTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.redisAddress = b.redisAddress;
        this.jdbcUrl = b.jdbcUrl;
        this.jdbcUser = b.jdbcUser;
        this.jdbcPassword = b.jdbcPassword;
        this.jdbcPoolSize = b.jdbcPoolSize;
        this.detectorsConfigPath = b.detectorsConfigPath;
        this.conditionCacheMaxSize = b.conditionCacheMaxSize;
        this.conditionCacheTtlSeconds = b.conditionCacheTtlSeconds;
        this.healthPort = b.healthPort;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "data-packets"))
                    .kafkaResultTopic(env("KAFKA_RESULT_TOPIC", "detector-results"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "watchtower"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .redisAddress(env("REDIS_ADDRESS", "redis://localhost:6379"))
                    .jdbcUrl(env("JDBC_URL", "jdbc:mysql://localhost:3306/watchtower"))
                    .jdbcUser(env("JDBC_USER", "watchtower"))
                    .jdbcPassword(env("JDBC_PASSWORD", ""))
                    .jdbcPoolSize(parseIntEnv("JDBC_POOL_SIZE", "4"))
                    .detectorsConfigPath(env("DETECTORS_CONFIG_PATH", ""))
                    .conditionCacheMaxSize(parseLongEnv("CONDITION_CACHE_MAX_SIZE", "10000"))
                    .conditionCacheTtlSeconds(parseLongEnv("CONDITION_CACHE_TTL_SECONDS", "1800"))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaResultTopic() {
        return kafkaResultTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public String getRedisAddress() {
        return redisAddress;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getJdbcUser() {
        return jdbcUser;
    }

    public String getJdbcPassword() {
        return jdbcPassword;
    }

    public int getJdbcPoolSize() {
        return jdbcPoolSize;
    }

    public String getDetectorsConfigPath() {
        return detectorsConfigPath;
    }

    public long getConditionCacheMaxSize() {
        return conditionCacheMaxSize;
    }

    public Duration getConditionCacheTtl() {
        return Duration.ofSeconds(conditionCacheTtlSeconds);
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "data-packets";
        private String kafkaResultTopic = "detector-results";
        private String kafkaGroupId = "watchtower";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String redisAddress = "redis://localhost:6379";
        private String jdbcUrl = "jdbc:mysql://localhost:3306/watchtower";
        private String jdbcUser = "watchtower";
        private String jdbcPassword = "";
        private int jdbcPoolSize = 4;
        private String detectorsConfigPath = "";
        private long conditionCacheMaxSize = 10_000;
        private long conditionCacheTtlSeconds = 1_800;
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaResultTopic(String v) {
            this.kafkaResultTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder redisAddress(String v) {
            this.redisAddress = v;
            return this;
        }

        public Builder jdbcUrl(String v) {
            this.jdbcUrl = v;
            return this;
        }

        public Builder jdbcUser(String v) {
            this.jdbcUser = v;
            return this;
        }

        public Builder jdbcPassword(String v) {
            this.jdbcPassword = v;
            return this;
        }

        public Builder jdbcPoolSize(int v) {
            this.jdbcPoolSize = v;
            return this;
        }

        public Builder detectorsConfigPath(String v) {
            this.detectorsConfigPath = v;
            return this;
        }

        public Builder conditionCacheMaxSize(long v) {
            this.conditionCacheMaxSize = v;
            return this;
        }

        public Builder conditionCacheTtlSeconds(long v) {
            this.conditionCacheTtlSeconds = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            Objects.requireNonNull(jdbcPassword, "jdbcPassword required");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaResultTopic, "kafkaResultTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(redisAddress, "redisAddress");
            requireNonBlank(jdbcUrl, "jdbcUrl");
            requireNonBlank(jdbcUser, "jdbcUser");

            if (!redisAddress.startsWith("redis://") && !redisAddress.startsWith("rediss://")) {
                throw new IllegalArgumentException(
                        "redisAddress must start with redis:// or rediss://, got: " + redisAddress);
            }
            if (!jdbcUrl.startsWith("jdbc:")) {
                throw new IllegalArgumentException("jdbcUrl must start with jdbc:, got: " + jdbcUrl);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (jdbcPoolSize < 1) {
                throw new IllegalArgumentException("jdbcPoolSize must be >= 1, got: " + jdbcPoolSize);
            }
            if (conditionCacheMaxSize < 1) {
                throw new IllegalArgumentException(
                        "conditionCacheMaxSize must be >= 1, got: " + conditionCacheMaxSize);
            }
            if (conditionCacheTtlSeconds < 1) {
                throw new IllegalArgumentException(
                        "conditionCacheTtlSeconds must be >= 1, got: " + conditionCacheTtlSeconds);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    /**
     * Omits the JDBC password.
     */
    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaResultTopic='" + kafkaResultTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", redisAddress='" + redisAddress + '\'' +
                ", jdbcUrl='" + jdbcUrl + '\'' +
                ", jdbcUser='" + jdbcUser + '\'' +
                ", jdbcPoolSize=" + jdbcPoolSize +
                ", conditionCacheMaxSize=" + conditionCacheMaxSize +
                ", conditionCacheTtlSeconds=" + conditionCacheTtlSeconds +
                ", healthPort=" + healthPort +
                '}';
    }
}
