package com.questrail.symbolic.channel;

import com.questrail.symbolic.expression.Expression;

import java.util.Objects;

/**
 * ExpressionHandle
 * -----------------------------------------------------------------------------
 * Canonical wrapped reference to a foreign expression.
 *
 * <p>A handle marks a value as already normalized, so handing it back to the
 * normalizer is a no-op. {@code requestId} identifies the engine exchange that
 * produced the expression, or is {@link #NO_REQUEST} for expressions wrapped
 * locally.</p>
 */
public record ExpressionHandle(Expression expression, long requestId)
{
    public static final long NO_REQUEST = 0L;

    public ExpressionHandle {
        Objects.requireNonNull(expression, "expression");
        if (requestId < 0) {
            throw new IllegalArgumentException("requestId must be non-negative");
        }
    }

    public static ExpressionHandle of(Expression expression) {
        return new ExpressionHandle(expression, NO_REQUEST);
    }

    public boolean isResponse() {
        return requestId != NO_REQUEST;
    }
}
