package com.watchtower.core.condition;

import com.watchtower.core.model.DataCondition;
import com.watchtower.core.model.DataConditionGroup;

import java.util.List;
import java.util.Optional;
import java.util.function.LongConsumer;

/**
 * Source of condition groups and their conditions.
 *
 * <p>
 * Implementations must notify registered listeners with the affected group
 * id whenever a group or one of its conditions is written, so that caches
 * can drop stale entries.
 * </p>
 *
 * @since 1.0.0
 */
public interface ConditionGroupRepository {

    Optional<DataConditionGroup> findGroup(long groupId);

    /**
     * @return conditions of the group in evaluation order; empty if none
     */
    List<DataCondition> findConditions(long groupId);

    /**
     * Register a listener called with a group id after every write touching
     * that group.
     */
    void addChangeListener(LongConsumer listener);
}
