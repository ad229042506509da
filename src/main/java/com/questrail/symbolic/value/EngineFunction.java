package com.questrail.symbolic.value;

import com.questrail.symbolic.expression.Expression;

/**
 * Host-invocable closure decoded from an engine function template.
 *
 * <p>Each invocation issues exactly one engine request: the template applied to
 * the encoded arguments. The channel and translation settings used are the ones
 * captured when the function was decoded, never the caller's.</p>
 *
 * <p>Must not be invoked from inside a request that is holding the same
 * channel.</p>
 */
public interface EngineFunction
{
    Object invoke(Object... arguments);

    /**
     * The engine-side template this function applies, e.g. {@code Function[Plus[Slot[1], 1]]}.
     */
    Expression template();
}
