package com.questrail.symbolic.observability;

/**
 * No-op implementation of BridgeObservabilitySink.
 */
public final class NullObservabilitySink implements BridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onExchange(ExchangeEvent event) {}

    @Override
    public void onDecodeTrace(DecodeTraceEvent event) {}

    @Override
    public void onError(BridgeErrorEvent event) {}
}
