package com.watchtower.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single predicate over an observation value.
 *
 * <p>
 * When the comparison {@code value <type> comparison} holds, the condition
 * "fires" and yields its configured {@link #getResult() result} priority.
 * Conditions belong to exactly one {@link DataConditionGroup}.
 * </p>
 *
 * <p>
 * Loaded from YAML as a bean; call {@link #validate()} after deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class DataCondition implements Serializable {

    private static final long serialVersionUID = 1L;

    private long id;

    /** Owning group; assigned when the group is registered. */
    private long conditionGroupId;

    /** Comparison operator key: gt, gte, lt, lte, eq, ne. */
    private String type;

    /** Right-hand operand of the comparison. */
    private double comparison;

    /** Priority name emitted when the condition fires. */
    private String result;

    public DataCondition() {
    }

    public DataCondition(long id, ConditionType type, double comparison, DetectorPriorityLevel result) {
        this.id = id;
        this.type = Objects.requireNonNull(type, "Condition type must not be null").getKey();
        this.comparison = comparison;
        this.result = Objects.requireNonNull(result, "Condition result must not be null").name();
    }

    /**
     * Evaluate the observation against this condition.
     *
     * @param value the observed value
     * @return the result priority if the condition fires, empty otherwise
     */
    public Optional<DetectorPriorityLevel> evaluateValue(double value) {
        if (getConditionType().test(value, comparison)) {
            return Optional.of(getResultLevel());
        }
        return Optional.empty();
    }

    /**
     * Validate the operator and result names.
     *
     * @throws IllegalStateException if either is missing or unknown
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        try {
            ConditionType.fromKey(type);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        try {
            DetectorPriorityLevel.fromName(result);
        } catch (IllegalArgumentException e) {
            errors.add("Condition " + id + " has invalid result '" + result + "'");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DataCondition: " + String.join("; ", errors));
        }
    }

    public ConditionType getConditionType() {
        return ConditionType.fromKey(type);
    }

    public DetectorPriorityLevel getResultLevel() {
        return DetectorPriorityLevel.fromName(result);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public long getConditionGroupId() {
        return conditionGroupId;
    }

    public void setConditionGroupId(long conditionGroupId) {
        this.conditionGroupId = conditionGroupId;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public double getComparison() {
        return comparison;
    }

    public void setComparison(double comparison) {
        this.comparison = comparison;
    }

    public String getResult() {
        return result;
    }

    public void setResult(String result) {
        this.result = result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataCondition that))
            return false;
        return id == that.id
                && conditionGroupId == that.conditionGroupId
                && Double.compare(comparison, that.comparison) == 0
                && Objects.equals(type, that.type)
                && Objects.equals(result, that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, conditionGroupId, type, comparison, result);
    }

    @Override
    public String toString() {
        return "DataCondition{" +
                "id=" + id +
                ", conditionGroupId=" + conditionGroupId +
                ", type='" + type + '\'' +
                ", comparison=" + comparison +
                ", result='" + result + '\'' +
                '}';
    }
}
