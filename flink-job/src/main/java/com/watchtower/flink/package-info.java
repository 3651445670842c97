/**
 * Apache Flink streaming job for Watchtower.
 *
 * <p>
 * Wires the core detector engine into a pipeline that consumes data packets
 * from Kafka, evaluates every configured detector per packet, and publishes
 * state transitions back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.watchtower.flink.WatchtowerJob}: main entry point</li>
 * <li>{@link com.watchtower.flink.DetectorProcessFunction}: keyed process
 * function owning the state store clients</li>
 * <li>{@link com.watchtower.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.watchtower.flink.HealthServer}: HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.watchtower.flink;
