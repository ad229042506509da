package com.questrail.symbolic.channel;

import com.questrail.symbolic.expression.Expression;

/**
 * Turns engine syntax into an unevaluated expression.
 */
@FunctionalInterface
public interface ExpressionParser
{
    /**
     * @throws com.questrail.symbolic.error.InvalidExpressionException if the
     *         text does not parse to exactly one expression
     */
    Expression parse(String text);
}
