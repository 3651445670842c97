package com.watchtower.core.condition;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.watchtower.core.model.DataCondition;
import com.watchtower.core.model.DataConditionGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongConsumer;

/**
 * Process-wide cache of condition groups keyed by group id.
 *
 * <p>
 * Entries are computed lazily on first access and dropped whenever the
 * backing {@link ConditionGroupRepository} reports a write to the group or
 * one of its conditions; the next access re-reads the repository. A group
 * that does not exist is cached as {@link ConditionGroupSnapshot#EMPTY}.
 * </p>
 *
 * @since 1.0.0
 */
public class ConditionGroupCache {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionGroupCache.class);

    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;
    public static final Duration DEFAULT_EXPIRE_AFTER_WRITE = Duration.ofMinutes(30);

    private final ConditionGroupRepository repository;
    private final Cache<Long, ConditionGroupSnapshot> cache;
    private final List<LongConsumer> invalidationListeners = new CopyOnWriteArrayList<>();

    public ConditionGroupCache(ConditionGroupRepository repository) {
        this(repository, DEFAULT_MAXIMUM_SIZE, DEFAULT_EXPIRE_AFTER_WRITE);
    }

    /**
     * @param repository        source of truth; invalidations are subscribed to
     * @param maximumSize       maximum number of cached groups
     * @param expireAfterWrite  safety expiry for entries
     */
    public ConditionGroupCache(ConditionGroupRepository repository, long maximumSize, Duration expireAfterWrite) {
        this.repository = Objects.requireNonNull(repository, "ConditionGroupRepository must not be null");
        Objects.requireNonNull(expireAfterWrite, "expireAfterWrite must not be null");
        if (maximumSize < 1) {
            throw new IllegalArgumentException("maximumSize must be >= 1, got: " + maximumSize);
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(expireAfterWrite)
                .recordStats()
                .build();
        repository.addChangeListener(this::invalidate);
    }

    /**
     * Return the group and its conditions, loading them on a miss.
     *
     * @param groupId condition group id
     * @return the snapshot; {@link ConditionGroupSnapshot#EMPTY} if the group does not exist
     */
    public ConditionGroupSnapshot get(long groupId) {
        return cache.get(groupId, this::load);
    }

    /**
     * Drop the cached entry of a group and notify invalidation listeners.
     */
    public void invalidate(long groupId) {
        cache.invalidate(groupId);
        LOG.trace("Invalidated condition group {}", groupId);
        for (LongConsumer listener : invalidationListeners) {
            listener.accept(groupId);
        }
    }

    /**
     * Register a callback run with the group id after every
     * {@link #invalidate(long)}; used by holders of resolved snapshots.
     */
    public void addInvalidationListener(LongConsumer listener) {
        invalidationListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    /**
     * @return number of loads performed so far
     */
    public long loadCount() {
        return cache.stats().loadCount();
    }

    private ConditionGroupSnapshot load(long groupId) {
        Optional<DataConditionGroup> group = repository.findGroup(groupId);
        if (group.isEmpty()) {
            LOG.debug("Condition group {} not found", groupId);
            return ConditionGroupSnapshot.EMPTY;
        }
        List<DataCondition> conditions = repository.findConditions(groupId);
        return new ConditionGroupSnapshot(group.get(), conditions);
    }
}
