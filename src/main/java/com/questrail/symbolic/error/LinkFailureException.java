package com.questrail.symbolic.error;

/**
 * I/O-level failure of the engine link (disconnect, timeout, interruption).
 *
 * <p>Never retried by the channel driver. The driver's exclusive hold on the
 * link has always been released by the time this is thrown.</p>
 */
public final class LinkFailureException extends BridgeException
{
    public LinkFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
