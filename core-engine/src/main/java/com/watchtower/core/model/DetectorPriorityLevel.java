package com.watchtower.core.model;

import java.util.Locale;

/**
 * Ordered severity scale produced by condition evaluation.
 *
 * <p>
 * {@link #OK} is the inactive baseline: a detector is active for a group key
 * only while its status is strictly above {@code OK}. The numeric
 * {@link #getLevel() level} is what the durable store persists in its
 * {@code state} column.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectorPriorityLevel {

    OK(0),
    LOW(25),
    WARNING(50),
    HIGH(75),
    CRITICAL(100);

    private final int level;

    DetectorPriorityLevel(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    /**
     * @return {@code true} if this level is above {@link #OK}
     */
    public boolean isActive() {
        return this != OK;
    }

    /**
     * Return the more severe of two levels.
     *
     * @param a first level; must not be {@code null}
     * @param b second level; must not be {@code null}
     * @return the level with the higher {@link #getLevel() level}
     */
    public static DetectorPriorityLevel max(DetectorPriorityLevel a, DetectorPriorityLevel b) {
        return a.level >= b.level ? a : b;
    }

    /**
     * Resolve a level from its persisted numeric value.
     *
     * @param level numeric level as stored in the durable store
     * @return the matching priority level
     * @throws IllegalArgumentException if no level has that value
     */
    public static DetectorPriorityLevel fromLevel(int level) {
        for (DetectorPriorityLevel candidate : values()) {
            if (candidate.level == level) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown priority level: " + level);
    }

    /**
     * Resolve a level from its (case-insensitive) name, as written in YAML.
     *
     * @param name level name, e.g. {@code "warning"}
     * @return the matching priority level
     * @throws IllegalArgumentException if the name is not a known level
     */
    public static DetectorPriorityLevel fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Priority level name must not be blank");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
