package com.questrail.symbolic.expression;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Capability view of a foreign (engine-side) symbolic expression.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code Expression} is the only shape in which engine data crosses into the
 * translation layer. It exposes typed-atom predicates, head and argument access
 * and homogeneous-array probes; it deliberately exposes nothing about how the
 * tree was produced (wire bytes, loopback links, engine handles).
 * </p>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Instances are immutable.</li>
 *   <li>Every node has a head. Atoms report the head named by their
 *       {@link ExpressionKind} and have no arguments (rationals excepted, which
 *       expose numerator and denominator as arguments 1 and 2).</li>
 *   <li>Accessor methods for a kind other than {@link #kind()} throw
 *       {@link IllegalStateException}.</li>
 * </ul>
 *
 * <p>
 * {@link Expressions} provides the default in-memory implementation. Adapters
 * over a vendor expression type implement this interface directly.
 * </p>
 */
public interface Expression
{
    ExpressionKind kind();

    /**
     * Returns the head of this expression. For atoms this is the symbol named
     * by {@link ExpressionKind#atomHead()}.
     */
    Expression head();

    /**
     * Arguments in original order. Empty for atoms other than rationals.
     */
    List<Expression> arguments();

    /**
     * One-based argument access, mirroring the engine's {@code Part} numbering.
     *
     * @throws IndexOutOfBoundsException if {@code index} is outside {@code 1..n}
     */
    default Expression argument(int index) {
        List<Expression> args = arguments();
        if (index < 1 || index > args.size()) {
            throw new IndexOutOfBoundsException("argument " + index + " of " + args.size());
        }
        return args.get(index - 1);
    }

    /**
     * Name of the head when the head is a symbol, otherwise {@code null}.
     */
    default String headName() {
        Expression head = head();
        return head.kind() == ExpressionKind.SYMBOL ? head.symbolName() : null;
    }

    /**
     * Whether this expression is a {@code List[...]}.
     */
    default boolean isList() {
        return kind() == ExpressionKind.NORMAL && "List".equals(headName());
    }

    default boolean isAtom() {
        return kind().isAtom();
    }

    long asLong();

    BigInteger asBigInteger();

    double asDouble();

    BigDecimal asBigDecimal();

    String asString();

    /**
     * Full engine name of a symbol, including any namespace prefix
     * (e.g. {@code Global`x}).
     */
    String symbolName();

    /**
     * Element kind when this is a non-empty list whose elements are all atoms
     * of one supported kind.
     */
    Optional<ExpressionKind> vectorType();

    /**
     * Element kind when this is a non-empty rectangular list of non-empty
     * vectors sharing one supported element kind.
     */
    Optional<ExpressionKind> matrixType();

    /**
     * Bulk coercion of a numeric vector to doubles.
     *
     * @throws IllegalStateException if this is not a vector of a numeric kind
     */
    double[] asDoubleArray();
}
