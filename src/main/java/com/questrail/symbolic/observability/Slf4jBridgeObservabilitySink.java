package com.questrail.symbolic.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);

    @Override
    public void onExchange(ExchangeEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Exchange #{} ({} ms): {} -> {}",
                event.requestId(),
                event.elapsed().toMillis(),
                event.request(),
                event.response());
        }
    }

    @Override
    public void onDecodeTrace(DecodeTraceEvent event) {
        // Only emitted when verbose tracing was asked for, hence INFO.
        log.info("{} decode at depth {} took {} us",
            event.stage(),
            event.depth(),
            event.elapsed().toNanos() / 1_000);
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        log.error("Engine bridge error: {}", event.message(), event.cause());
    }
}
