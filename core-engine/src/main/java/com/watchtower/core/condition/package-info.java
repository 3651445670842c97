/**
 * Condition groups and the cache handlers read them through.
 *
 * <p>
 * {@link com.watchtower.core.condition.ConditionGroupCache} memoises
 * {@link com.watchtower.core.condition.ConditionGroupRepository} lookups and
 * is invalidated by the repository on every write to a group or its
 * conditions.
 * </p>
 *
 * @since 1.0.0
 */
package com.watchtower.core.condition;
