package com.questrail.symbolic.error;

/**
 * Root of every failure raised by the translation layer and the channel driver.
 *
 * Unchecked, like the rest of the codebase's exceptions: callers that care
 * about a specific failure catch the subclass, everything else propagates.
 */
public class BridgeException extends RuntimeException
{
    public BridgeException(String message) {
        super(message);
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
