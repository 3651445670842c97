/**
 * Domain model classes for Watchtower.
 *
 * <p>
 * This package contains the types shared between the detector engine and the
 * Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.watchtower.core.model.Detector}: configured rule, loaded
 * from YAML</li>
 * <li>{@link com.watchtower.core.model.DataConditionGroup} /
 * {@link com.watchtower.core.model.DataCondition}: predicates producing a
 * priority</li>
 * <li>{@link com.watchtower.core.model.DataPacket}: typed telemetry
 * packet</li>
 * <li>{@link com.watchtower.core.model.DetectorState}: durable per group key
 * row</li>
 * <li>{@link com.watchtower.core.model.DetectorStateData}: merged snapshot of
 * durable and ephemeral state</li>
 * <li>{@link com.watchtower.core.model.DetectorEvaluationResult}: emitted
 * state transition</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.watchtower.core.model;
