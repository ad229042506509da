package com.questrail.symbolic.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Verbose trace of a single decode stage.
 *
 * <p>For lazy realization policies the elapsed time covers building the lazy
 * container, not realizing its elements.</p>
 */
public record DecodeTraceEvent(
    Instant timestamp,
    DecodeStage stage,
    int depth,
    Duration elapsed
) {
}
