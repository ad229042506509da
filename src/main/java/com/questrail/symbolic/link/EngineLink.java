package com.questrail.symbolic.link;

import com.questrail.symbolic.expression.Expression;

import java.io.IOException;

/**
 * EngineLink
 * -----------------------------------------------------------------------------
 * Minimal port for a live connection to a symbolic-computation engine.
 *
 * <p>The link is a single half-duplex pipe with no request identifiers: the
 * response read by {@link #awaitResponse()} belongs to whatever was submitted
 * last. Implementations are therefore not required to be thread-safe; the
 * {@code ChannelDriver} guarantees that exactly one submit/await pair is in
 * flight at a time.</p>
 *
 * <p>Implementations may be backed by a native engine library, a socket, or a
 * test double. Timeouts and cancellation belong here; a link that gives up
 * must report it as an {@link IOException} rather than block forever.</p>
 */
public interface EngineLink
{
    /**
     * Send an expression to the engine for evaluation.
     *
     * @param expression the complete request
     * @throws IOException if the link is closed or the write fails
     */
    void submit(Expression expression) throws IOException;

    /**
     * Block until the engine has produced the complete answer to the last
     * submitted expression and return it.
     *
     * @return the engine's result expression
     * @throws IOException on disconnect, timeout or a malformed answer
     */
    Expression awaitResponse() throws IOException;
}
