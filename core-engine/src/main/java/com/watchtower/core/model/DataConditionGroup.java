package com.watchtower.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Ordered collection of {@link DataCondition}s attached to a detector.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * conditionGroups:
 *   - id: 1
 *     logicType: any
 *     conditions:
 *       - id: 11
 *         type: gt
 *         comparison: 10
 *         result: warning
 * </pre>
 *
 * <p>
 * A group's evaluated priority is the worst case (maximum) across every
 * condition that fires, {@link DetectorPriorityLevel#OK} when none do.
 * </p>
 *
 * @since 1.0.0
 */
public class DataConditionGroup implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String LOGIC_ANY = "any";

    private long id;

    /** How condition outcomes are combined. Only "any" is supported. */
    private String logicType = LOGIC_ANY;

    private List<DataCondition> conditions = new ArrayList<>();

    public DataConditionGroup() {
    }

    public DataConditionGroup(long id) {
        this.id = id;
    }

    /**
     * Validate the group and every condition it holds.
     *
     * @throws IllegalStateException if the group or any condition is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (id <= 0) {
            errors.add("Condition group 'id' must be > 0, got: " + id);
        }
        if (logicType == null || !LOGIC_ANY.equals(logicType.toLowerCase(Locale.ROOT))) {
            errors.add("Condition group " + id + " has unsupported logicType '" + logicType
                    + "'. Supported: any");
        }
        for (DataCondition condition : conditions) {
            try {
                condition.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DataConditionGroup: " + String.join("; ", errors));
        }
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public String getLogicType() {
        return logicType;
    }

    public void setLogicType(String logicType) {
        this.logicType = logicType;
    }

    /**
     * @return unmodifiable list of conditions, in evaluation order
     */
    public List<DataCondition> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    public void setConditions(List<DataCondition> conditions) {
        this.conditions = conditions != null ? new ArrayList<>(conditions) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataConditionGroup that))
            return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "DataConditionGroup{id=" + id + ", logicType='" + logicType
                + "', conditions=" + conditions.size() + '}';
    }
}
