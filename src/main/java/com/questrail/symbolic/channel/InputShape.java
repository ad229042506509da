package com.questrail.symbolic.channel;

import com.questrail.symbolic.error.UnsupportedInputTypeException;
import com.questrail.symbolic.expression.Expression;

/**
 * The runtime shapes a request may take before normalization.
 */
public enum InputShape
{
    /** Engine syntax, parsed but not evaluated. */
    TEXT,
    /** A foreign expression not yet wrapped. */
    EXPRESSION,
    /** Already normalized. */
    HANDLE,
    /** {@code null}; propagates unchanged. */
    ABSENT;

    /**
     * Classifies {@code input}.
     *
     * @throws UnsupportedInputTypeException for any other runtime type
     */
    public static InputShape of(Object input) {
        if (input == null) {
            return ABSENT;
        }
        if (input instanceof String) {
            return TEXT;
        }
        if (input instanceof ExpressionHandle) {
            return HANDLE;
        }
        if (input instanceof Expression) {
            return EXPRESSION;
        }
        throw new UnsupportedInputTypeException("Request normalization", input.getClass());
    }
}
