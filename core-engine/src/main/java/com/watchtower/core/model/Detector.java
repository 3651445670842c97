package com.watchtower.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A configured monitoring rule.
 *
 * <p>
 * The detector {@link #getType() type} selects the handler that evaluates
 * it (see {@code DetectorHandlerRegistry}); the optional
 * {@link #getConditionGroupId() condition group} supplies the predicates.
 * A detector without a condition group can never become active.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization. Instances
 * are treated as immutable for the duration of an evaluation run.
 * </p>
 *
 * @since 1.0.0
 */
public class Detector implements Serializable {

    private static final long serialVersionUID = 1L;

    private long id;

    /** Human-readable name used in logs and result messages. */
    private String name;

    /** Handler kind, e.g. "metric" or "threshold". */
    private String type;

    /** Condition group evaluated by this detector; {@code null} if none. */
    private Long conditionGroupId;

    /** Named counters tracked per group key in the ephemeral store. */
    private List<String> counterNames = new ArrayList<>();

    public Detector() {
    }

    public Detector(long id, String name, String type, Long conditionGroupId) {
        this.id = id;
        this.name = name;
        setType(type);
        this.conditionGroupId = conditionGroupId;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that the required fields are present.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (id <= 0) {
            errors.add("Detector 'id' must be > 0, got: " + id);
        }
        if (name == null || name.isBlank()) {
            errors.add("Detector " + id + " requires 'name'");
        }
        if (type == null || type.isBlank()) {
            errors.add("Detector " + id + " requires 'type'");
        }
        for (String counterName : counterNames) {
            if (counterName == null || counterName.isBlank() || counterName.contains(":")) {
                errors.add("Detector " + id + " has invalid counter name '" + counterName + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid Detector: " + String.join("; ", errors));
        }
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

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the handler type, normalised to lowercase.
     *
     * @param type handler type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public Long getConditionGroupId() {
        return conditionGroupId;
    }

    public void setConditionGroupId(Long conditionGroupId) {
        this.conditionGroupId = conditionGroupId;
    }

    /**
     * @return unmodifiable list of counter names
     */
    public List<String> getCounterNames() {
        return Collections.unmodifiableList(counterNames);
    }

    public void setCounterNames(List<String> counterNames) {
        this.counterNames = counterNames != null ? new ArrayList<>(counterNames) : new ArrayList<>();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Detector that))
            return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Detector{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", conditionGroupId=" + conditionGroupId +
                ", counterNames=" + counterNames +
                '}';
    }
}
