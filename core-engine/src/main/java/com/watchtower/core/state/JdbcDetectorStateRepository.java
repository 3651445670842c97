package com.watchtower.core.state;

import com.watchtower.core.model.DetectorPriorityLevel;
import com.watchtower.core.model.DetectorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link DetectorStateRepository} on a relational database via Spring's
 * {@link JdbcTemplate}.
 *
 * <p>
 * Expected table (MySQL dialect):
 * </p>
 *
 * <pre>
 * CREATE TABLE detector_state (
 *     id                 BIGINT AUTO_INCREMENT PRIMARY KEY,
 *     detector_id        BIGINT       NOT NULL,
 *     detector_group_key VARCHAR(200) NULL,
 *     active             BOOLEAN      NOT NULL,
 *     state              INT          NOT NULL,
 *     date_added         TIMESTAMP    NOT NULL,
 *     date_updated       TIMESTAMP    NOT NULL,
 *     UNIQUE KEY uq_detector_state (detector_id, detector_group_key)
 * );
 * </pre>
 *
 * <p>
 * Inserts and updates use {@link JdbcTemplate#batchUpdate(String,
 * BatchPreparedStatementSetter)} so each bulk call is one JDBC batch.
 * Transaction boundaries are owned by the caller's DataSource setup.
 * </p>
 *
 * @since 1.0.0
 */
public class JdbcDetectorStateRepository implements DetectorStateRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcDetectorStateRepository.class);

    static final String SELECT_SQL = "SELECT id, detector_id, detector_group_key, active, state "
            + "FROM detector_state WHERE detector_id = ?";

    static final String INSERT_SQL = "INSERT INTO detector_state "
            + "(detector_id, detector_group_key, active, state, date_added, date_updated) "
            + "VALUES (?, ?, ?, ?, ?, ?)";

    static final String UPDATE_SQL = "UPDATE detector_state "
            + "SET active = ?, state = ?, date_updated = ? WHERE id = ?";

    private static final RowMapper<DetectorState> ROW_MAPPER = (rs, rowNum) -> new DetectorState(
            rs.getLong("id"),
            rs.getLong("detector_id"),
            rs.getString("detector_group_key"),
            rs.getBoolean("active"),
            DetectorPriorityLevel.fromLevel(rs.getInt("state")));

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcDetectorStateRepository(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, Clock.systemUTC());
    }

    public JdbcDetectorStateRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "JdbcTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    @Override
    public Map<String, DetectorState> findByGroupKeys(long detectorId, Collection<String> groupKeys) {
        Objects.requireNonNull(groupKeys, "groupKeys must not be null");
        Map<String, DetectorState> lookup = new LinkedHashMap<>();
        if (groupKeys.isEmpty()) {
            return lookup;
        }

        Set<String> namedKeys = new LinkedHashSet<>();
        boolean includeNoGroup = false;
        for (String groupKey : groupKeys) {
            if (groupKey == null) {
                includeNoGroup = true;
            } else {
                namedKeys.add(groupKey);
            }
        }

        List<Object> args = new ArrayList<>();
        args.add(detectorId);
        List<String> filters = new ArrayList<>(2);
        if (!namedKeys.isEmpty()) {
            filters.add("detector_group_key IN ("
                    + String.join(", ", Collections.nCopies(namedKeys.size(), "?")) + ")");
            args.addAll(namedKeys);
        }
        if (includeNoGroup) {
            filters.add("detector_group_key IS NULL");
        }
        String sql = SELECT_SQL + " AND (" + String.join(" OR ", filters) + ")";

        List<DetectorState> rows;
        try {
            rows = jdbcTemplate.query(sql, ROW_MAPPER, args.toArray());
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to load detector state for detector " + detectorId, e);
        }

        for (DetectorState row : rows) {
            lookup.put(row.getGroupKey(), row);
        }
        return lookup;
    }

    @Override
    public void bulkCreate(List<DetectorState> states) {
        Objects.requireNonNull(states, "states must not be null");
        if (states.isEmpty()) {
            return;
        }
        Timestamp now = Timestamp.from(clock.instant());
        try {
            jdbcTemplate.batchUpdate(INSERT_SQL, new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    DetectorState state = states.get(i);
                    ps.setLong(1, state.getDetectorId());
                    if (state.getGroupKey() != null) {
                        ps.setString(2, state.getGroupKey());
                    } else {
                        ps.setNull(2, Types.VARCHAR);
                    }
                    ps.setBoolean(3, state.isActive());
                    ps.setInt(4, state.getState().getLevel());
                    ps.setTimestamp(5, now);
                    ps.setTimestamp(6, now);
                }

                @Override
                public int getBatchSize() {
                    return states.size();
                }
            });
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to insert " + states.size() + " detector state row(s)", e);
        }
        LOG.debug("Inserted {} detector state row(s)", states.size());
    }

    @Override
    public void bulkUpdate(List<DetectorState> states) {
        Objects.requireNonNull(states, "states must not be null");
        if (states.isEmpty()) {
            return;
        }
        for (DetectorState state : states) {
            if (state.getId() == null) {
                throw new IllegalArgumentException("Cannot update a detector state row without id: " + state);
            }
        }
        Timestamp now = Timestamp.from(clock.instant());
        try {
            jdbcTemplate.batchUpdate(UPDATE_SQL, new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    DetectorState state = states.get(i);
                    ps.setBoolean(1, state.isActive());
                    ps.setInt(2, state.getState().getLevel());
                    ps.setTimestamp(3, now);
                    ps.setLong(4, state.getId());
                }

                @Override
                public int getBatchSize() {
                    return states.size();
                }
            });
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to update " + states.size() + " detector state row(s)", e);
        }
        LOG.debug("Updated {} detector state row(s)", states.size());
    }
}
