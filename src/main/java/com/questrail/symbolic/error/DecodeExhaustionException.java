package com.questrail.symbolic.error;

/**
 * Decoding descended past the configured depth limit.
 */
public final class DecodeExhaustionException extends BridgeException
{
    private final int depthLimit;

    public DecodeExhaustionException(int depthLimit) {
        super("Expression nesting exceeds the decode depth limit of " + depthLimit);
        this.depthLimit = depthLimit;
    }

    public int depthLimit() {
        return depthLimit;
    }
}
