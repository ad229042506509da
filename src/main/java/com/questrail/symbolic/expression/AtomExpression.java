package com.questrail.symbolic.expression;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Default atom node. {@code value} holds a {@code Long}, {@code BigInteger},
 * {@code Double}, {@code BigDecimal} or {@code String} (strings and symbol
 * names alike) according to {@code kind}.
 */
record AtomExpression(ExpressionKind kind, Object value) implements Expression
{
    AtomExpression {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
        if (kind == ExpressionKind.NORMAL || kind == ExpressionKind.RATIONAL) {
            throw new IllegalArgumentException("Not an atom kind: " + kind);
        }
    }

    @Override
    public Expression head() {
        return kind == ExpressionKind.SYMBOL && "Symbol".equals(value)
                ? this
                : Expressions.symbol(kind.atomHead());
    }

    @Override
    public List<Expression> arguments() {
        return List.of();
    }

    @Override
    public long asLong() {
        return switch (kind) {
            case INTEGER -> (Long) value;
            case BIG_INTEGER -> ((BigInteger) value).longValue();
            case REAL -> (long) (double) (Double) value;
            case BIG_DECIMAL -> ((BigDecimal) value).longValue();
            default -> throw wrongKind("integer");
        };
    }

    @Override
    public BigInteger asBigInteger() {
        return switch (kind) {
            case INTEGER -> BigInteger.valueOf((Long) value);
            case BIG_INTEGER -> (BigInteger) value;
            default -> throw wrongKind("integer");
        };
    }

    @Override
    public double asDouble() {
        return switch (kind) {
            case INTEGER -> (double) (Long) value;
            case BIG_INTEGER -> ((BigInteger) value).doubleValue();
            case REAL -> (Double) value;
            case BIG_DECIMAL -> ((BigDecimal) value).doubleValue();
            default -> throw wrongKind("real");
        };
    }

    @Override
    public BigDecimal asBigDecimal() {
        return switch (kind) {
            case INTEGER -> BigDecimal.valueOf((Long) value);
            case BIG_INTEGER -> new BigDecimal((BigInteger) value);
            case REAL -> BigDecimal.valueOf((Double) value);
            case BIG_DECIMAL -> (BigDecimal) value;
            default -> throw wrongKind("real");
        };
    }

    @Override
    public String asString() {
        if (kind != ExpressionKind.STRING) {
            throw wrongKind("string");
        }
        return (String) value;
    }

    @Override
    public String symbolName() {
        if (kind != ExpressionKind.SYMBOL) {
            throw wrongKind("symbol");
        }
        return (String) value;
    }

    @Override
    public Optional<ExpressionKind> vectorType() {
        return Optional.empty();
    }

    @Override
    public Optional<ExpressionKind> matrixType() {
        return Optional.empty();
    }

    @Override
    public double[] asDoubleArray() {
        throw new IllegalStateException("Atom " + this + " is not a numeric vector");
    }

    private IllegalStateException wrongKind(String wanted) {
        return new IllegalStateException("Expected " + wanted + " atom but was " + kind + ": " + this);
    }

    @Override
    public String toString() {
        if (kind == ExpressionKind.STRING) {
            return '"' + ((String) value).replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
        return String.valueOf(value);
    }
}
