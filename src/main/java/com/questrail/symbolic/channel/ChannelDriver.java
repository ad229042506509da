package com.questrail.symbolic.channel;

import com.questrail.symbolic.config.TranslationConfig;
import com.questrail.symbolic.error.EngineEvaluationException;
import com.questrail.symbolic.error.InvalidExpressionException;
import com.questrail.symbolic.error.LinkFailureException;
import com.questrail.symbolic.expression.Expression;
import com.questrail.symbolic.expression.ExpressionKind;
import com.questrail.symbolic.expression.Expressions;
import com.questrail.symbolic.link.EngineLink;
import com.questrail.symbolic.observability.BridgeErrorEvent;
import com.questrail.symbolic.observability.BridgeObservabilitySink;
import com.questrail.symbolic.observability.ExchangeEvent;
import com.questrail.symbolic.observability.NullObservabilitySink;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * ChannelDriver
 * =============================================================================
 * Sole owner of exclusive access to one {@link EngineLink}.
 *
 * <h2>Exchange protocol</h2>
 * <pre>
 *   request(input)
 *        → ExpressionNormalizer      (text parsed by its own exchange)
 *            → lock
 *                → link.submit(request)
 *                → link.awaitResponse()
 *            → unlock                (on every exit path)
 *        → ExpressionHandle(response, requestId)
 * </pre>
 *
 * <h2>Threading Model</h2>
 * The link has no request identifiers, so submit and await run under one fair
 * lock as a single atomic unit. Concurrent callers block in arrival order.
 * Drivers over different links share nothing and never contend.
 *
 * <p>A thread already inside an exchange on this driver may not start another
 * one (for example by invoking a decoded function from within a link callback).
 * That would deadlock a non-reentrant link, so it fails fast with
 * {@link IllegalStateException}.</p>
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>{@link IOException} from the link and interruption while waiting become
 *       {@link LinkFailureException}; the lock is already released.</li>
 *   <li>An engine error result ({@code $Failed}, {@code $Aborted},
 *       {@code Failure[...]}) is returned like any other response unless the
 *       config is strict, which raises {@link EngineEvaluationException}.</li>
 * </ul>
 */
public final class ChannelDriver
{
    private static final Set<String> ERROR_SYMBOLS = Set.of("$Failed", "$Aborted");

    private final EngineLink link;
    private final BridgeObservabilitySink observabilitySink;
    private final ExpressionNormalizer normalizer;

    private final ReentrantLock linkLock = new ReentrantLock(true);
    private final AtomicLong requestIds = new AtomicLong();

    public ChannelDriver(EngineLink link) {
        this(link, null);
    }

    public ChannelDriver(EngineLink link, BridgeObservabilitySink observabilitySink) {
        this.link = Objects.requireNonNull(link, "link");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.normalizer = new ExpressionNormalizer(this::parseText);
    }

    public ExpressionNormalizer normalizer() {
        return normalizer;
    }

    public ExpressionHandle request(Object input) {
        return request(input, TranslationConfig.defaults());
    }

    /**
     * Evaluates {@code input} on the engine and returns the wrapped response.
     *
     * @param input text, expression, handle or {@code null}
     * @param config consulted for strict handling of engine errors
     * @return the response handle, or {@code null} when {@code input} is {@code null}
     */
    public ExpressionHandle request(Object input, TranslationConfig config) {
        Objects.requireNonNull(config, "config");

        ExpressionHandle normalized = normalizer.normalize(input);
        if (normalized == null) {
            return null;
        }

        ExpressionHandle response = exchange(normalized.expression());

        if (config.strict() && isEngineError(response.expression())) {
            EngineEvaluationException error =
                    new EngineEvaluationException(normalized.expression(), response.expression());
            observabilitySink.onError(new BridgeErrorEvent(Instant.now(), error.getMessage(), error));
            throw error;
        }
        return response;
    }

    /**
     * Parses engine syntax without evaluating it, using one exchange of
     * {@code ToExpression[text, InputForm, HoldComplete]}.
     *
     * @throws InvalidExpressionException unless the engine answers with
     *         {@code HoldComplete} around exactly one expression
     */
    public Expression parseText(String text) {
        Objects.requireNonNull(text, "text");

        Expression held = exchange(Expressions.apply("ToExpression",
                Expressions.string(text),
                Expressions.symbol("InputForm"),
                Expressions.symbol("HoldComplete"))).expression();

        if (!"HoldComplete".equals(held.headName())) {
            throw new InvalidExpressionException(text, "engine answered " + held);
        }
        int units = held.arguments().size();
        if (units != 1) {
            throw new InvalidExpressionException(text,
                    units == 0 ? "no expression" : units + " top-level expressions");
        }
        return held.argument(1);
    }

    /**
     * One submit/await round trip under the link lock.
     */
    public ExpressionHandle exchange(Expression request) {
        Objects.requireNonNull(request, "request");

        if (linkLock.isHeldByCurrentThread()) {
            throw new IllegalStateException(
                    "Re-entrant request on an engine link already held by this thread: " + request);
        }

        try {
            linkLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw reportFailure("Interrupted while waiting for the engine link", e);
        }

        long requestId = 0;
        long startNanos = 0;
        Expression response = null;
        IOException failure = null;
        try {
            requestId = requestIds.incrementAndGet();
            startNanos = System.nanoTime();
            link.submit(request);
            response = link.awaitResponse();
        } catch (IOException e) {
            failure = e;
        } finally {
            linkLock.unlock();
        }

        if (failure != null) {
            throw reportFailure("Engine link failed during request " + request, failure);
        }
        if (response == null) {
            throw reportFailure("Engine link returned no response to " + request, null);
        }

        observabilitySink.onExchange(new ExchangeEvent(
                Instant.now(),
                requestId,
                request,
                response,
                Duration.ofNanos(System.nanoTime() - startNanos)));

        return new ExpressionHandle(response, requestId);
    }

    /**
     * Whether {@code response} is one of the engine's error results.
     */
    public static boolean isEngineError(Expression response) {
        if (response.kind() == ExpressionKind.SYMBOL) {
            return ERROR_SYMBOLS.contains(response.symbolName());
        }
        return response.kind() == ExpressionKind.NORMAL && "Failure".equals(response.headName());
    }

    private LinkFailureException reportFailure(String message, Throwable cause) {
        observabilitySink.onError(new BridgeErrorEvent(Instant.now(), message, cause));
        return new LinkFailureException(message, cause);
    }
}
