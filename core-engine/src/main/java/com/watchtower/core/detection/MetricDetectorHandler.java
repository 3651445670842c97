package com.watchtower.core.detection;

import com.watchtower.core.model.DataPacket;
import com.watchtower.core.model.Detector;
import com.watchtower.core.model.MetricUpdate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stateful handler over {@link MetricUpdate} packets (detector type
 * {@value #TYPE}).
 * <p>
 * The update's {@code sequence} is the dedupe value. Grouped updates are
 * evaluated per group key; an ungrouped update is evaluated under the
 * {@code null} group key.
 * </p>
 */
public class MetricDetectorHandler extends StatefulDetectorHandler<MetricUpdate> {

    public static final String TYPE = "metric";

    public MetricDetectorHandler(Detector detector, DetectorHandlerContext context) {
        super(detector, context);
    }

    @Override
    protected long getDedupeValue(DataPacket<MetricUpdate> packet) {
        return packet.getPayload().getSequence();
    }

    @Override
    protected Map<String, Double> getGroupKeyValues(DataPacket<MetricUpdate> packet) {
        return extractGroupValues(packet.getPayload());
    }

    @Override
    protected List<String> getCounterNames() {
        return detector.getCounterNames();
    }

    /**
     * Observations of a metric update; entries with a {@code null} value are
     * dropped.
     */
    static Map<String, Double> extractGroupValues(MetricUpdate update) {
        Map<String, Double> values = new LinkedHashMap<>();
        if (!update.getGroupValues().isEmpty()) {
            update.getGroupValues().forEach((groupKey, value) -> {
                if (value != null) {
                    values.put(groupKey, value);
                }
            });
        } else if (update.getValue() != null) {
            values.put(null, update.getValue());
        }
        return values;
    }
}
