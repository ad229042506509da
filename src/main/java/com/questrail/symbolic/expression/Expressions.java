package com.questrail.symbolic.expression;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Expressions
 * =============================================================================
 * Factory for the default immutable {@link Expression} implementation.
 *
 * <p>The encoders, the binding builder and in-process links build trees through
 * this class. Trees compare structurally: two expressions built from equal
 * parts are {@code equals}.</p>
 */
public final class Expressions
{
    public static final Expression TRUE = symbol("True");
    public static final Expression FALSE = symbol("False");
    public static final Expression NULL = symbol("Null");
    public static final Expression LIST = symbol("List");

    private Expressions() {}

    public static Expression integer(long value) {
        return new AtomExpression(ExpressionKind.INTEGER, value);
    }

    public static Expression bigInteger(BigInteger value) {
        return new AtomExpression(ExpressionKind.BIG_INTEGER, Objects.requireNonNull(value, "value"));
    }

    public static Expression real(double value) {
        return new AtomExpression(ExpressionKind.REAL, value);
    }

    public static Expression bigDecimal(BigDecimal value) {
        return new AtomExpression(ExpressionKind.BIG_DECIMAL, Objects.requireNonNull(value, "value"));
    }

    public static Expression string(String value) {
        return new AtomExpression(ExpressionKind.STRING, Objects.requireNonNull(value, "value"));
    }

    public static Expression symbol(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name must not be empty");
        }
        return new AtomExpression(ExpressionKind.SYMBOL, name);
    }

    public static Expression bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Builds {@code Rational[numerator, denominator]}. Each part becomes a
     * machine integer when it fits in a {@code long}.
     */
    public static Expression rational(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        if (denominator.signum() == 0) {
            throw new ArithmeticException("Rational with zero denominator");
        }
        return apply("Rational", integral(numerator), integral(denominator));
    }

    public static Expression rational(long numerator, long denominator) {
        return rational(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Expression apply(Expression head, List<? extends Expression> arguments) {
        return new NormalExpression(head, List.copyOf(arguments));
    }

    public static Expression apply(Expression head, Expression... arguments) {
        return new NormalExpression(head, List.of(arguments));
    }

    public static Expression apply(String head, List<? extends Expression> arguments) {
        return new NormalExpression(symbol(head), List.copyOf(arguments));
    }

    public static Expression apply(String head, Expression... arguments) {
        return new NormalExpression(symbol(head), List.of(arguments));
    }

    public static Expression list(List<? extends Expression> elements) {
        return new NormalExpression(LIST, List.copyOf(elements));
    }

    public static Expression list(Expression... elements) {
        return new NormalExpression(LIST, List.of(elements));
    }

    private static Expression integral(BigInteger value) {
        return value.bitLength() < Long.SIZE ? integer(value.longValue()) : bigInteger(value);
    }
}
