package com.questrail.symbolic.observability;

import java.time.Instant;

/**
 * Record representing a failed exchange or an engine-reported error.
 */
public record BridgeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
