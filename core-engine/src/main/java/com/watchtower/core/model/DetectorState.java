package com.watchtower.core.model;

import java.util.Objects;

/**
 * Durable state row for one {@code (detector, group key)} pair.
 *
 * <p>
 * Created the first time a group key transitions away from the defaults and
 * updated in place afterwards. {@link #getId() id} is {@code null} until the
 * row has been inserted. A {@code null} group key is the "no group" row.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorState {

    private Long id;
    private final long detectorId;
    private final String groupKey;
    private boolean active;
    private DetectorPriorityLevel state;

    public DetectorState(Long id, long detectorId, String groupKey,
            boolean active, DetectorPriorityLevel state) {
        this.id = id;
        this.detectorId = detectorId;
        this.groupKey = groupKey;
        this.active = active;
        this.state = Objects.requireNonNull(state, "state must not be null");
    }

    /**
     * Create a row that has not been persisted yet.
     */
    public static DetectorState newRow(long detectorId, String groupKey,
            boolean active, DetectorPriorityLevel state) {
        return new DetectorState(null, detectorId, groupKey, active, state);
    }

    /**
     * @return {@code true} if {@code active} or {@code state} differ from the given values
     */
    public boolean differsFrom(boolean otherActive, DetectorPriorityLevel otherState) {
        return active != otherActive || state != otherState;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public long getDetectorId() {
        return detectorId;
    }

    public String getGroupKey() {
        return groupKey;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public DetectorPriorityLevel getState() {
        return state;
    }

    public void setState(DetectorPriorityLevel state) {
        this.state = Objects.requireNonNull(state, "state must not be null");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorState that))
            return false;
        return detectorId == that.detectorId
                && active == that.active
                && Objects.equals(id, that.id)
                && Objects.equals(groupKey, that.groupKey)
                && state == that.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, detectorId, groupKey, active, state);
    }

    @Override
    public String toString() {
        return "DetectorState{" +
                "id=" + id +
                ", detectorId=" + detectorId +
                ", groupKey='" + groupKey + '\'' +
                ", active=" + active +
                ", state=" + state +
                '}';
    }
}
