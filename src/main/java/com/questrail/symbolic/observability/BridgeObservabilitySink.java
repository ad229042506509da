package com.questrail.symbolic.observability;

/**
 * Receives observability events from the channel driver and the decoder.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the thread that produced the event, after the channel
 * lock has been released. Implementations must not block.</p>
 */
public interface BridgeObservabilitySink {
    /**
     * Called after each completed request/response exchange on a link.
     * @param event the exchange details
     */
    void onExchange(ExchangeEvent event);

    /**
     * Called around vector, matrix, map and function decoding when verbose
     * tracing was requested.
     * @param event the decode stage and its duration
     */
    void onDecodeTrace(DecodeTraceEvent event);

    /**
     * Called when an exchange fails or the engine reports an error under
     * strict translation.
     * @param event the error event
     */
    void onError(BridgeErrorEvent event);
}
