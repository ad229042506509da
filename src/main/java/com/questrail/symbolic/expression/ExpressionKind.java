package com.questrail.symbolic.expression;

/**
 * ExpressionKind
 * -----------------------------------------------------------------------------
 * Closed classification of a foreign expression node.
 *
 * <p>Every kind except {@link #NORMAL} is an atom. {@link #RATIONAL} is the one
 * atom that is structurally a head applied to two integer arguments
 * ({@code Rational[p, q]}); it still counts as an atom for decoding purposes.</p>
 */
public enum ExpressionKind
{
    INTEGER("Integer", true),
    BIG_INTEGER("Integer", true),
    RATIONAL("Rational", true),
    REAL("Real", true),
    BIG_DECIMAL("Real", true),
    STRING("String", false),
    SYMBOL("Symbol", false),
    NORMAL(null, false);

    private final String atomHead;
    private final boolean numeric;

    ExpressionKind(String atomHead, boolean numeric) {
        this.atomHead = atomHead;
        this.numeric = numeric;
    }

    /**
     * Name of the engine head reported by atoms of this kind, or {@code null}
     * for {@link #NORMAL} expressions whose head is explicit.
     */
    public String atomHead() {
        return atomHead;
    }

    /**
     * Whether arrays of this element kind may be coerced in bulk to doubles.
     */
    public boolean isBulkNumeric() {
        return numeric && this != RATIONAL;
    }

    public boolean isAtom() {
        return this != NORMAL;
    }
}
