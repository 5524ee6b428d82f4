package com.sandy.aiot.gateway.detection;

import com.sandy.aiot.gateway.vo.Pattern;

import java.util.Optional;

/**
 * One independent detection rule over a device's event window.
 * <p>
 * Implementations are stateless and may run concurrently with each other.
 * </p>
 */
public interface PatternAlgorithm {

    String name();

    /** Below this many events in the window the algorithm is not run. */
    int minimumEvents();

    Optional<Pattern> detect(DetectionWindow window);
}
