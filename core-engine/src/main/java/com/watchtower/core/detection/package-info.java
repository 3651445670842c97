/**
 * Detector handlers and the batch processor that drives them.
 *
 * <p>
 * All handlers implement {@link com.watchtower.core.detection.DetectorHandler}.
 * To add a new detector type:
 * </p>
 * <ol>
 * <li>Implement {@code DetectorHandler}, usually by extending
 * {@link com.watchtower.core.detection.StatefulDetectorHandler}</li>
 * <li>Register a factory under the type string in
 * {@link com.watchtower.core.detection.DetectorHandlerRegistry}</li>
 * <li>Reference the type from the detectors YAML</li>
 * </ol>
 *
 * @since 1.0.0
 */
package com.watchtower.core.detection;
