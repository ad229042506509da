package com.questrail.symbolic.channel;

import com.questrail.symbolic.expression.Expression;

/**
 * ExpressionNormalizer
 * =============================================================================
 * Converts any accepted request shape into one canonical {@link ExpressionHandle}.
 *
 * <h2>Dispatch</h2>
 * <ul>
 *   <li>{@link InputShape#TEXT}: parsed through the {@link ExpressionParser}
 *       (an engine round trip), held unevaluated</li>
 *   <li>{@link InputShape#EXPRESSION}: wrapped directly</li>
 *   <li>{@link InputShape#HANDLE}: returned unchanged</li>
 *   <li>{@link InputShape#ABSENT}: returns {@code null}</li>
 * </ul>
 *
 * Other runtime types are rejected by {@link InputShape#of(Object)}.
 */
public final class ExpressionNormalizer
{
    private final ExpressionParser parser;

    /**
     * @param parser parser for text input; {@code null} makes this an offline
     *               normalizer that rejects text
     */
    public ExpressionNormalizer(ExpressionParser parser) {
        this.parser = parser;
    }

    public static ExpressionNormalizer offline() {
        return new ExpressionNormalizer(null);
    }

    /**
     * @return the canonical handle, or {@code null} for {@code null} input
     * @throws com.questrail.symbolic.error.UnsupportedInputTypeException for unsupported input types
     * @throws com.questrail.symbolic.error.InvalidExpressionException for text that is not one expression
     * @throws IllegalStateException for text when no parser is available
     */
    public ExpressionHandle normalize(Object input) {
        return switch (InputShape.of(input)) {
            case TEXT -> ExpressionHandle.of(parseText((String) input));
            case EXPRESSION -> ExpressionHandle.of((Expression) input);
            case HANDLE -> (ExpressionHandle) input;
            case ABSENT -> null;
        };
    }

    private Expression parseText(String text) {
        if (parser == null) {
            throw new IllegalStateException("Text input requires an engine channel: " + text);
        }
        return parser.parse(text);
    }
}
