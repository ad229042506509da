package com.questrail.symbolic.error;

/**
 * A {@code HashMapObject} whose rule set is not a list of rules or a
 * {@code Dispatch} over one.
 */
public final class MalformedMapException extends BridgeException
{
    public MalformedMapException(String message) {
        super(message);
    }
}
