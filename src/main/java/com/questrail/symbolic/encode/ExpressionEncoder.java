package com.questrail.symbolic.encode;

import com.questrail.symbolic.channel.ExpressionHandle;
import com.questrail.symbolic.config.AliasTable;
import com.questrail.symbolic.config.TranslationConfig;
import com.questrail.symbolic.error.UnsupportedInputTypeException;
import com.questrail.symbolic.expression.Expression;
import com.questrail.symbolic.expression.Expressions;
import com.questrail.symbolic.value.EngineFunction;
import com.questrail.symbolic.value.GenericExpression;
import com.questrail.symbolic.value.Rational;
import com.questrail.symbolic.value.Symbol;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ExpressionEncoder
 * ============================================================================
 * Converts a native host value into a foreign {@link Expression}.
 *
 * <h2>Architectural Role</h2>
 * This class is the <strong>outbound boundary</strong> of the translation
 * layer and the inverse of the decoder: for every value the decoder can
 * produce under the default configuration, decoding the encoded form yields
 * an equal value.
 *
 * <h2>Mapping</h2>
 * <ul>
 *   <li>{@code null}, {@code Boolean} → {@code Null}, {@code True}, {@code False}</li>
 *   <li>{@code Byte}, {@code Short}, {@code Integer}, {@code Long} → integer;
 *       {@code BigInteger} → big integer</li>
 *   <li>{@link Rational} → {@code Rational[p, q]} (integer when integral)</li>
 *   <li>{@code Float}, {@code Double} → real; {@code BigDecimal} → big real</li>
 *   <li>{@code String}, {@code Character} → string</li>
 *   <li>{@link Symbol} → symbol, through the alias table when aliased</li>
 *   <li>{@code Map} → {@code HashMapObject[{k -> v, ...}]}</li>
 *   <li>{@code Iterable}, {@code Object[]}, {@code int[]}, {@code long[]} and
 *       {@code double[]} → {@code List[...]}; other primitive arrays are
 *       unsupported</li>
 *   <li>{@link GenericExpression} → {@code head[args...]}</li>
 *   <li>{@link Expression}, {@link ExpressionHandle}, {@link EngineFunction}
 *       → the carried expression, unchanged</li>
 * </ul>
 *
 * Stateless and thread-safe.
 */
public final class ExpressionEncoder
{
    public Expression encode(Object value) {
        return encode(value, TranslationConfig.defaults());
    }

    /**
     * @throws UnsupportedInputTypeException if {@code value} (or a nested
     *         element) has no foreign representation
     */
    public Expression encode(Object value, TranslationConfig config) {
        Objects.requireNonNull(config, "config");
        return encodeValue(value, config.aliases());
    }

    private Expression encodeValue(Object value, AliasTable aliases) {
        if (value == null) {
            return Expressions.NULL;
        }
        if (value instanceof Expression expression) {
            return expression;
        }
        if (value instanceof ExpressionHandle handle) {
            return handle.expression();
        }
        if (value instanceof EngineFunction function) {
            return function.template();
        }
        if (value instanceof Boolean b) {
            return Expressions.bool(b);
        }
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return Expressions.integer(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return Expressions.bigInteger(big);
        }
        if (value instanceof Rational rational) {
            return encodeRational(rational);
        }
        if (value instanceof Double || value instanceof Float) {
            return Expressions.real(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal decimal) {
            return Expressions.bigDecimal(decimal);
        }
        if (value instanceof String s) {
            return Expressions.string(s);
        }
        if (value instanceof Character c) {
            return Expressions.string(String.valueOf(c));
        }
        if (value instanceof Symbol symbol) {
            return encodeSymbol(symbol, aliases);
        }
        if (value instanceof GenericExpression generic) {
            return encodeGeneric(generic, aliases);
        }
        if (value instanceof Map<?, ?> map) {
            return encodeMap(map, aliases);
        }
        if (value instanceof Iterable<?> iterable) {
            List<Expression> elements = new ArrayList<>();
            for (Object element : iterable) {
                elements.add(encodeValue(element, aliases));
            }
            return Expressions.list(elements);
        }
        if (value instanceof Object[] array) {
            List<Expression> elements = new ArrayList<>(array.length);
            for (Object element : array) {
                elements.add(encodeValue(element, aliases));
            }
            return Expressions.list(elements);
        }
        if (value instanceof int[] ints) {
            List<Expression> elements = new ArrayList<>(ints.length);
            for (int element : ints) {
                elements.add(Expressions.integer(element));
            }
            return Expressions.list(elements);
        }
        if (value instanceof long[] longs) {
            List<Expression> elements = new ArrayList<>(longs.length);
            for (long element : longs) {
                elements.add(Expressions.integer(element));
            }
            return Expressions.list(elements);
        }
        if (value instanceof double[] doubles) {
            List<Expression> elements = new ArrayList<>(doubles.length);
            for (double element : doubles) {
                elements.add(Expressions.real(element));
            }
            return Expressions.list(elements);
        }
        throw new UnsupportedInputTypeException("Expression encoding", value.getClass());
    }

    private static Expression encodeRational(Rational rational) {
        if (rational.isIntegral()) {
            BigInteger n = rational.numerator();
            return n.bitLength() < Long.SIZE ? Expressions.integer(n.longValue()) : Expressions.bigInteger(n);
        }
        return Expressions.rational(rational.numerator(), rational.denominator());
    }

    private static Expression encodeSymbol(Symbol symbol, AliasTable aliases) {
        return Expressions.symbol(aliases.engineNameFor(symbol).orElseGet(symbol::engineName));
    }

    private Expression encodeGeneric(GenericExpression generic, AliasTable aliases) {
        List<Expression> args = new ArrayList<>(generic.arguments().size());
        for (Object argument : generic.arguments()) {
            args.add(encodeValue(argument, aliases));
        }
        return Expressions.apply(encodeValue(generic.head(), aliases), args);
    }

    private Expression encodeMap(Map<?, ?> map, AliasTable aliases) {
        List<Expression> rules = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            rules.add(Expressions.apply("Rule",
                    encodeValue(entry.getKey(), aliases),
                    encodeValue(entry.getValue(), aliases)));
        }
        return Expressions.apply("HashMapObject", Expressions.list(rules));
    }
}
