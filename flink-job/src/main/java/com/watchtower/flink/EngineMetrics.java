package com.watchtower.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metrics of the detector operator, exposed through the cluster's
 * configured reporters.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code packets_processed_total}: data packets evaluated</li>
 * <li>{@code evaluation_results_total}: state transitions emitted</li>
 * <li>{@code processing_latency_ms}: evaluate + commit time per packet</li>
 * </ul>
 */
public class EngineMetrics {

    private final Counter packetsProcessed;
    private final Counter evaluationResults;
    private final Histogram processingLatency;

    public EngineMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("watchtower");

        this.packetsProcessed = group.counter("packets_processed_total");
        this.evaluationResults = group.counter("evaluation_results_total");
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(500));
    }

    public void incrementPacketsProcessed() {
        packetsProcessed.inc();
    }

    public void incrementEvaluationResults(int count) {
        evaluationResults.inc(count);
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
