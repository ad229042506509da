package com.questrail.symbolic.observability;

import com.questrail.symbolic.expression.Expression;

import java.time.Duration;
import java.time.Instant;

/**
 * One request/response round trip on an engine link.
 */
public record ExchangeEvent(
    Instant timestamp,
    long requestId,
    Expression request,
    Expression response,
    Duration elapsed
) {
}
