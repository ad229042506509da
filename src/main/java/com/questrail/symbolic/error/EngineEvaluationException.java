package com.questrail.symbolic.error;

import com.questrail.symbolic.expression.Expression;

/**
 * The engine answered with an error result while strict mode was requested.
 * Outside strict mode the same response is decoded like any other value.
 */
public final class EngineEvaluationException extends BridgeException
{
    private final transient Expression response;

    public EngineEvaluationException(Expression request, Expression response) {
        super("Engine reported an evaluation error for " + request + ": " + response);
        this.response = response;
    }

    public Expression response() {
        return response;
    }
}
