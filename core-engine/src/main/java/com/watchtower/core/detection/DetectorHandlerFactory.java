package com.watchtower.core.detection;

import com.watchtower.core.model.Detector;

/**
 * Builds the handler of one detector kind.
 */
@FunctionalInterface
public interface DetectorHandlerFactory {

    DetectorHandler<?> create(Detector detector, DetectorHandlerContext context);
}
