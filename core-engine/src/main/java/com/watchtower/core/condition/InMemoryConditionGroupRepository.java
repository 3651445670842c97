package com.watchtower.core.condition;

import com.watchtower.core.model.DataCondition;
import com.watchtower.core.model.DataConditionGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongConsumer;

/**
 * {@link ConditionGroupRepository} holding groups in memory, populated from
 * the detectors YAML configuration.
 *
 * <p>
 * Thread-safe. Conditions are stored per group in insertion order; a
 * condition saved with an id that already exists in its group replaces the
 * previous one in place.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryConditionGroupRepository implements ConditionGroupRepository {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryConditionGroupRepository.class);

    private final Map<Long, DataConditionGroup> groups = new ConcurrentHashMap<>();
    private final Map<Long, List<DataCondition>> conditionsByGroup = new ConcurrentHashMap<>();
    private final List<LongConsumer> listeners = new CopyOnWriteArrayList<>();

    @Override
    public Optional<DataConditionGroup> findGroup(long groupId) {
        return Optional.ofNullable(groups.get(groupId));
    }

    @Override
    public List<DataCondition> findConditions(long groupId) {
        List<DataCondition> conditions = conditionsByGroup.get(groupId);
        if (conditions == null) {
            return List.of();
        }
        synchronized (conditions) {
            return List.copyOf(conditions);
        }
    }

    @Override
    public void addChangeListener(LongConsumer listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Store a group and replace its conditions with the ones it carries.
     *
     * @param group the group; must not be {@code null}
     */
    public void saveGroup(DataConditionGroup group) {
        Objects.requireNonNull(group, "group must not be null");
        List<DataCondition> conditions = new ArrayList<>();
        for (DataCondition condition : group.getConditions()) {
            condition.setConditionGroupId(group.getId());
            conditions.add(condition);
        }
        groups.put(group.getId(), group);
        conditionsByGroup.put(group.getId(), conditions);
        notifyChanged(group.getId());
    }

    /**
     * Add or replace a condition in its group.
     *
     * @param condition the condition; its group must already exist
     * @throws IllegalArgumentException if the owning group is unknown
     */
    public void saveCondition(DataCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");
        long groupId = condition.getConditionGroupId();
        if (!groups.containsKey(groupId)) {
            throw new IllegalArgumentException("Unknown condition group: " + groupId);
        }
        List<DataCondition> conditions = conditionsByGroup.computeIfAbsent(groupId, id -> new ArrayList<>());
        synchronized (conditions) {
            boolean replaced = false;
            for (int i = 0; i < conditions.size() && !replaced; i++) {
                if (conditions.get(i).getId() == condition.getId()) {
                    conditions.set(i, condition);
                    replaced = true;
                }
            }
            if (!replaced) {
                conditions.add(condition);
            }
        }
        notifyChanged(groupId);
    }

    /**
     * Remove a group and its conditions. Unknown ids are ignored.
     */
    public void deleteGroup(long groupId) {
        groups.remove(groupId);
        conditionsByGroup.remove(groupId);
        notifyChanged(groupId);
    }

    private void notifyChanged(long groupId) {
        LOG.debug("Condition group {} changed, notifying {} listener(s)", groupId, listeners.size());
        for (LongConsumer listener : listeners) {
            listener.accept(groupId);
        }
    }
}
