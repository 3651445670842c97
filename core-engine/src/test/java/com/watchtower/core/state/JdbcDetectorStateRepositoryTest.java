package com.watchtower.core.state;

import com.watchtower.core.model.DetectorPriorityLevel;
import com.watchtower.core.model.DetectorState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for {@link JdbcDetectorStateRepository} against MySQL.
 * Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcDetectorStateRepositoryTest {

    @Container
    private static final MySQLContainer<?> MYSQL = new MySQLContainer<>(DockerImageName.parse("mysql:8.0"))
            .withDatabaseName("watchtower")
            .withInitScript("detector_state_schema.sql");

    private JdbcTemplate jdbcTemplate;
    private JdbcDetectorStateRepository repository;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                MYSQL.getJdbcUrl(), MYSQL.getUsername(), MYSQL.getPassword());
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.update("DELETE FROM detector_state");
        repository = new JdbcDetectorStateRepository(jdbcTemplate);
    }

    @Test
    @DisplayName("Should insert rows and find them by group key")
    void shouldCreateAndFind() {
        repository.bulkCreate(List.of(
                DetectorState.newRow(1, "g1", true, DetectorPriorityLevel.WARNING),
                DetectorState.newRow(1, "g2", false, DetectorPriorityLevel.OK)));

        Map<String, DetectorState> found = repository.findByGroupKeys(1, List.of("g1", "g2", "g3"));

        assertThat(found).containsOnlyKeys("g1", "g2");
        assertThat(found.get("g1").getId()).isNotNull();
        assertThat(found.get("g1").isActive()).isTrue();
        assertThat(found.get("g1").getState()).isEqualTo(DetectorPriorityLevel.WARNING);
    }

    @Test
    @DisplayName("Should find the no-group row alongside named group keys")
    void shouldFindNullGroupKey() {
        repository.bulkCreate(List.of(
                DetectorState.newRow(1, null, true, DetectorPriorityLevel.HIGH),
                DetectorState.newRow(1, "g1", true, DetectorPriorityLevel.LOW)));

        Map<String, DetectorState> onlyNull = repository.findByGroupKeys(1, Arrays.asList((String) null));
        Map<String, DetectorState> both = repository.findByGroupKeys(1, Arrays.asList(null, "g1"));

        assertThat(onlyNull).containsOnlyKeys((String) null);
        assertThat(onlyNull.get(null).getState()).isEqualTo(DetectorPriorityLevel.HIGH);
        assertThat(both).hasSize(2);
    }

    @Test
    @DisplayName("Should scope lookups to one detector")
    void shouldScopeToDetector() {
        repository.bulkCreate(List.of(DetectorState.newRow(2, "g1", true, DetectorPriorityLevel.HIGH)));

        assertThat(repository.findByGroupKeys(1, List.of("g1"))).isEmpty();
    }

    @Test
    @DisplayName("Should update active and state of existing rows")
    void shouldUpdateRows() {
        repository.bulkCreate(List.of(DetectorState.newRow(1, "g1", false, DetectorPriorityLevel.OK)));
        DetectorState row = repository.findByGroupKeys(1, List.of("g1")).get("g1");
        row.setActive(true);
        row.setState(DetectorPriorityLevel.CRITICAL);

        repository.bulkUpdate(List.of(row));

        DetectorState reloaded = repository.findByGroupKeys(1, List.of("g1")).get("g1");
        assertThat(reloaded.isActive()).isTrue();
        assertThat(reloaded.getState()).isEqualTo(DetectorPriorityLevel.CRITICAL);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM detector_state", Integer.class)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject updates of rows that were never inserted")
    void shouldRejectUpdateWithoutId() {
        assertThatThrownBy(() -> repository.bulkUpdate(List.of(
                DetectorState.newRow(1, "g1", true, DetectorPriorityLevel.LOW))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should translate constraint violations into StateStoreException")
    void shouldTranslateDataAccessFailures() {
        repository.bulkCreate(List.of(DetectorState.newRow(1, "g1", true, DetectorPriorityLevel.LOW)));

        assertThatThrownBy(() -> repository.bulkCreate(List.of(
                DetectorState.newRow(1, "g1", true, DetectorPriorityLevel.HIGH))))
                .isInstanceOf(StateStoreException.class);
    }
}
