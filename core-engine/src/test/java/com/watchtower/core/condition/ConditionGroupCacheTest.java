package com.watchtower.core.condition;

import com.watchtower.core.model.ConditionType;
import com.watchtower.core.model.DataCondition;
import com.watchtower.core.model.DataConditionGroup;
import com.watchtower.core.model.DetectorPriorityLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConditionGroupCache}.
 */
class ConditionGroupCacheTest {

    private InMemoryConditionGroupRepository repository;
    private ConditionGroupCache cache;

    @BeforeEach
    void setUp() {
        repository = new InMemoryConditionGroupRepository();
        repository.saveGroup(group(1, new DataCondition(11, ConditionType.GT, 10, DetectorPriorityLevel.WARNING)));
        cache = new ConditionGroupCache(repository);
    }

    @Test
    @DisplayName("Should load a group once and serve later reads from the cache")
    void shouldMemoiseLoads() {
        ConditionGroupSnapshot first = cache.get(1);
        ConditionGroupSnapshot second = cache.get(1);

        assertThat(first.getGroup()).isPresent();
        assertThat(first.getConditions()).hasSize(1);
        assertThat(second).isSameAs(first);
        assertThat(cache.loadCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should cache unknown groups as empty")
    void shouldReturnEmptyForUnknownGroup() {
        ConditionGroupSnapshot snapshot = cache.get(99);

        assertThat(snapshot).isSameAs(ConditionGroupSnapshot.EMPTY);
        assertThat(snapshot.getGroup()).isEmpty();
        assertThat(snapshot.getConditions()).isEmpty();
    }

    @Test
    @DisplayName("Should reload a group after one of its conditions is written")
    void shouldInvalidateOnConditionWrite() {
        cache.get(1);

        DataCondition added = new DataCondition(12, ConditionType.GT, 50, DetectorPriorityLevel.HIGH);
        added.setConditionGroupId(1);
        repository.saveCondition(added);

        assertThat(cache.get(1).getConditions()).extracting(DataCondition::getId).containsExactly(11L, 12L);
        assertThat(cache.loadCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should replace a condition with the same id in place")
    void shouldReplaceConditionInPlace() {
        DataCondition replacement = new DataCondition(11, ConditionType.GT, 20, DetectorPriorityLevel.HIGH);
        replacement.setConditionGroupId(1);
        repository.saveCondition(replacement);

        List<DataCondition> conditions = cache.get(1).getConditions();
        assertThat(conditions).hasSize(1);
        assertThat(conditions.get(0).getComparison()).isEqualTo(20);
    }

    @Test
    @DisplayName("Should reload after the group is deleted")
    void shouldInvalidateOnDelete() {
        cache.get(1);

        repository.deleteGroup(1);

        assertThat(cache.get(1).getGroup()).isEmpty();
    }

    @Test
    @DisplayName("Should notify invalidation listeners with the group id")
    void shouldNotifyInvalidationListeners() {
        List<Long> invalidated = new ArrayList<>();
        cache.addInvalidationListener(invalidated::add);

        repository.saveGroup(group(2));
        cache.invalidate(1);

        assertThat(invalidated).containsExactly(2L, 1L);
    }

    @Test
    @DisplayName("Should reject conditions for unknown groups")
    void shouldRejectOrphanCondition() {
        DataCondition orphan = new DataCondition(31, ConditionType.LT, 1, DetectorPriorityLevel.LOW);
        orphan.setConditionGroupId(3);

        assertThatThrownBy(() -> repository.saveCondition(orphan))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown condition group");
    }

    @Test
    @DisplayName("Should reject a non-positive maximum size")
    void shouldRejectInvalidSize() {
        assertThatThrownBy(() -> new ConditionGroupCache(repository, 0, Duration.ofMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DataConditionGroup group(long id, DataCondition... conditions) {
        DataConditionGroup group = new DataConditionGroup(id);
        group.setConditions(List.of(conditions));
        return group;
    }
}
