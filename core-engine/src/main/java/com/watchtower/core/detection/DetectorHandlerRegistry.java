package com.watchtower.core.detection;

import com.watchtower.core.model.Detector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the handler of a detector from its {@code type}.
 *
 * <p>
 * This is the single point of extension when adding new detector types:
 * register a {@link DetectorHandlerFactory} under the type string. Handlers
 * are built on first use and cached per detector id; a cached handler is
 * rebuilt when the detector's type, condition group or counter names change,
 * and dropped when the condition group it resolved is invalidated, or
 * explicitly through {@link #invalidate(long)}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorHandlerRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorHandlerRegistry.class);

    private final DetectorHandlerContext context;
    private final Map<String, DetectorHandlerFactory> factories = new ConcurrentHashMap<>();
    private final Map<Long, CachedHandler> handlers = new ConcurrentHashMap<>();

    public DetectorHandlerRegistry(DetectorHandlerContext context) {
        this.context = Objects.requireNonNull(context, "DetectorHandlerContext must not be null");
        context.getConditionGroupCache().addInvalidationListener(this::invalidateConditionGroup);
    }

    /**
     * Registry with the built-in {@value MetricDetectorHandler#TYPE} and
     * {@value ThresholdDetectorHandler#TYPE} handlers.
     */
    public static DetectorHandlerRegistry withDefaults(DetectorHandlerContext context) {
        DetectorHandlerRegistry registry = new DetectorHandlerRegistry(context);
        registry.register(MetricDetectorHandler.TYPE, MetricDetectorHandler::new);
        registry.register(ThresholdDetectorHandler.TYPE, ThresholdDetectorHandler::new);
        return registry;
    }

    /**
     * Register (or replace) the factory of a detector type. Type matching is
     * case-insensitive.
     */
    public DetectorHandlerRegistry register(String type, DetectorHandlerFactory factory) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(factory, "DetectorHandlerFactory must not be null");
        factories.put(type.toLowerCase(Locale.ROOT), factory);
        return this;
    }

    /**
     * Return the handler of a detector, building it on first use.
     *
     * @param detector the detector; must not be {@code null}
     * @return the handler, or empty if no factory is registered for its type
     */
    public Optional<DetectorHandler<?>> resolve(Detector detector) {
        Objects.requireNonNull(detector, "Detector must not be null");
        CachedHandler cached = handlers.get(detector.getId());
        if (cached != null) {
            if (cached.matches(detector)) {
                return Optional.of(cached.handler);
            }
            LOG.debug("Detector {} definition changed, rebuilding its handler", detector.getId());
            handlers.remove(detector.getId(), cached);
        }
        if (detector.getType() == null) {
            return Optional.empty();
        }
        DetectorHandlerFactory factory = factories.get(detector.getType().toLowerCase(Locale.ROOT));
        if (factory == null) {
            LOG.debug("No handler registered for detector {} of type '{}'", detector.getId(), detector.getType());
            return Optional.empty();
        }
        return Optional.of(handlers.computeIfAbsent(detector.getId(), id -> {
            LOG.debug("Creating {} handler for detector {}", detector.getType(), id);
            return new CachedHandler(detector, factory.create(detector, context));
        }).handler);
    }

    /**
     * Drop the cached handler of a detector, if any.
     */
    public void invalidate(long detectorId) {
        handlers.remove(detectorId);
    }

    /**
     * Drop every cached handler bound to a condition group.
     */
    public void invalidateConditionGroup(long conditionGroupId) {
        handlers.values().removeIf(cached ->
                cached.conditionGroupId != null && cached.conditionGroupId == conditionGroupId);
    }

    public Set<String> getRegisteredTypes() {
        return Set.copyOf(factories.keySet());
    }

    int cachedHandlerCount() {
        return handlers.size();
    }

    /**
     * A handler with a copy of the detector fields it was built from;
     * {@link Detector#equals} only compares ids and detectors are mutable.
     */
    private static final class CachedHandler {

        private final String type;
        private final Long conditionGroupId;
        private final List<String> counterNames;
        private final DetectorHandler<?> handler;

        CachedHandler(Detector detector, DetectorHandler<?> handler) {
            this.type = detector.getType();
            this.conditionGroupId = detector.getConditionGroupId();
            this.counterNames = new ArrayList<>(detector.getCounterNames());
            this.handler = handler;
        }

        boolean matches(Detector detector) {
            return Objects.equals(type, detector.getType())
                    && Objects.equals(conditionGroupId, detector.getConditionGroupId())
                    && counterNames.equals(detector.getCounterNames());
        }
    }
}
