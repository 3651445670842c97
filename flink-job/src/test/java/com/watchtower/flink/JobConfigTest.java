package com.watchtower.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should build with defaults")
    void shouldBuildWithDefaults() {
        JobConfig config = JobConfig.builder().build();

        assertThat(config.getKafkaInputTopic()).isEqualTo("data-packets");
        assertThat(config.getKafkaResultTopic()).isEqualTo("detector-results");
        assertThat(config.getRedisAddress()).isEqualTo("redis://localhost:6379");
        assertThat(config.getJdbcUrl()).startsWith("jdbc:mysql:");
        assertThat(config.getJdbcPoolSize()).isEqualTo(4);
        assertThat(config.getConditionCacheTtl()).isEqualTo(Duration.ofMinutes(30));
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Should reject a Redis address without a redis scheme")
    void shouldRejectBadRedisAddress() {
        assertThatThrownBy(() -> JobConfig.builder().redisAddress("localhost:6379").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("redisAddress");
    }

    @Test
    @DisplayName("Should accept a TLS Redis address")
    void shouldAcceptTlsRedisAddress() {
        assertThat(JobConfig.builder().redisAddress("rediss://cache:6380").build().getRedisAddress())
                .isEqualTo("rediss://cache:6380");
    }

    @Test
    @DisplayName("Should reject a non-JDBC url")
    void shouldRejectBadJdbcUrl() {
        assertThatThrownBy(() -> JobConfig.builder().jdbcUrl("mysql://localhost/db").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jdbcUrl");
    }

    @Test
    @DisplayName("Should reject out-of-range numeric settings")
    void shouldRejectOutOfRangeNumbers() {
        assertThatThrownBy(() -> JobConfig.builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JobConfig.builder().jdbcPoolSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JobConfig.builder().conditionCacheTtlSeconds(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JobConfig.builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
    }

    @Test
    @DisplayName("Should reject blank topics")
    void shouldRejectBlankTopics() {
        assertThatThrownBy(() -> JobConfig.builder().kafkaInputTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaInputTopic");
    }

    @Test
    @DisplayName("Should keep the JDBC password out of toString")
    void shouldHidePassword() {
        JobConfig config = JobConfig.builder().jdbcPassword("s3cret").build();

        assertThat(config.getJdbcPassword()).isEqualTo("s3cret");
        assertThat(config.toString()).doesNotContain("s3cret");
    }
}
