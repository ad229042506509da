package com.questrail.symbolic.link;

import com.questrail.symbolic.expression.Expression;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * ScriptedEngineLink
 * -----------------------------------------------------------------------------
 * Test-only {@link EngineLink} implementation.
 *
 * <p>Answers each submitted expression with a scripted responder and records
 * the order of submit/await calls per thread, so tests can assert that
 * exchanges never interleave. It contains no translation logic.</p>
 */
public final class ScriptedEngineLink implements EngineLink {

    public enum Step { SUBMIT, AWAIT }

    public record Call(Step step, String thread, Expression expression) {}

    private final Function<Expression, Expression> responder;
    private final List<Call> calls = new ArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private volatile Expression pending;
    private volatile IOException failNextAwait;
    private volatile long awaitDelayMillis;

    public ScriptedEngineLink(Function<Expression, Expression> responder) {
        this.responder = Objects.requireNonNull(responder, "responder");
    }

    @Override
    public void submit(Expression request) throws IOException {
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        record(Step.SUBMIT, request);
        pending = request;
    }

    @Override
    public Expression awaitResponse() throws IOException {
        try {
            if (awaitDelayMillis > 0) {
                Thread.sleep(awaitDelayMillis);
            }
            IOException failure = failNextAwait;
            if (failure != null) {
                failNextAwait = null;
                throw failure;
            }
            Expression request = pending;
            record(Step.AWAIT, request);
            return responder.apply(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted", e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void failNextAwait(IOException failure) {
        this.failNextAwait = failure;
    }

    public void setAwaitDelayMillis(long millis) {
        this.awaitDelayMillis = millis;
    }

    public synchronized List<Call> calls() {
        return Collections.unmodifiableList(new ArrayList<>(calls));
    }

    public synchronized List<Expression> submitted() {
        List<Expression> out = new ArrayList<>();
        for (Call call : calls) {
            if (call.step() == Step.SUBMIT) {
                out.add(call.expression());
            }
        }
        return out;
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }

    private synchronized void record(Step step, Expression expression) {
        calls.add(new Call(step, Thread.currentThread().getName(), expression));
    }
}
