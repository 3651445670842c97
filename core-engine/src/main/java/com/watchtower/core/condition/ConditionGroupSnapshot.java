package com.watchtower.core.condition;

import com.watchtower.core.model.DataCondition;
import com.watchtower.core.model.DataConditionGroup;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A condition group together with its ordered conditions, as cached.
 *
 * @since 1.0.0
 */
public final class ConditionGroupSnapshot {

    /** No group configured, or the group does not exist. */
    public static final ConditionGroupSnapshot EMPTY = new ConditionGroupSnapshot(null, List.of());

    private final DataConditionGroup group;
    private final List<DataCondition> conditions;

    public ConditionGroupSnapshot(DataConditionGroup group, List<DataCondition> conditions) {
        this.group = group;
        this.conditions = List.copyOf(Objects.requireNonNull(conditions, "conditions must not be null"));
    }

    public Optional<DataConditionGroup> getGroup() {
        return Optional.ofNullable(group);
    }

    public List<DataCondition> getConditions() {
        return conditions;
    }

    @Override
    public String toString() {
        return "ConditionGroupSnapshot{group=" + group + ", conditions=" + conditions.size() + '}';
    }
}
