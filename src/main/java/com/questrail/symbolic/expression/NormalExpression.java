package com.questrail.symbolic.expression;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Default {@code head[arg1, arg2, ...]} node. A {@code Rational} head over two
 * integer arguments reports {@link ExpressionKind#RATIONAL}.
 */
record NormalExpression(Expression head, List<Expression> arguments) implements Expression
{
    NormalExpression {
        Objects.requireNonNull(head, "head");
        arguments = List.copyOf(arguments);
    }

    @Override
    public ExpressionKind kind() {
        if (arguments.size() == 2
                && "Rational".equals(headName())
                && isInteger(arguments.get(0))
                && isInteger(arguments.get(1))) {
            return ExpressionKind.RATIONAL;
        }
        return ExpressionKind.NORMAL;
    }

    @Override
    public long asLong() {
        throw wrongKind("integer");
    }

    @Override
    public BigInteger asBigInteger() {
        throw wrongKind("integer");
    }

    @Override
    public double asDouble() {
        if (kind() == ExpressionKind.RATIONAL) {
            return new BigDecimal(arguments.get(0).asBigInteger())
                    .divide(new BigDecimal(arguments.get(1).asBigInteger()), MathContext.DECIMAL64)
                    .doubleValue();
        }
        throw wrongKind("real");
    }

    @Override
    public BigDecimal asBigDecimal() {
        throw wrongKind("real");
    }

    @Override
    public String asString() {
        throw wrongKind("string");
    }

    @Override
    public String symbolName() {
        throw wrongKind("symbol");
    }

    @Override
    public Optional<ExpressionKind> vectorType() {
        if (!isList() || arguments.isEmpty()) {
            return Optional.empty();
        }
        ExpressionKind first = arguments.get(0).kind();
        if (!first.isAtom()) {
            return Optional.empty();
        }
        for (Expression element : arguments) {
            if (element.kind() != first) {
                return Optional.empty();
            }
        }
        return Optional.of(first);
    }

    @Override
    public Optional<ExpressionKind> matrixType() {
        if (!isList() || arguments.isEmpty()) {
            return Optional.empty();
        }
        Optional<ExpressionKind> rowType = arguments.get(0).vectorType();
        if (rowType.isEmpty()) {
            return Optional.empty();
        }
        int width = arguments.get(0).arguments().size();
        for (Expression row : arguments) {
            if (!row.vectorType().equals(rowType) || row.arguments().size() != width) {
                return Optional.empty();
            }
        }
        return rowType;
    }

    @Override
    public double[] asDoubleArray() {
        Optional<ExpressionKind> type = vectorType();
        if (type.isEmpty() || !type.get().isBulkNumeric()) {
            throw new IllegalStateException("Not a numeric vector: " + this);
        }
        double[] out = new double[arguments.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = arguments.get(i).asDouble();
        }
        return out;
    }

    private static boolean isInteger(Expression e) {
        return e.kind() == ExpressionKind.INTEGER || e.kind() == ExpressionKind.BIG_INTEGER;
    }

    private IllegalStateException wrongKind(String wanted) {
        return new IllegalStateException("Expected " + wanted + " atom but was " + kind() + ": " + this);
    }

    @Override
    public String toString() {
        return arguments.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", head + "[", "]"));
    }
}
