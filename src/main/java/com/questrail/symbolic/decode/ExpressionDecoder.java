package com.questrail.symbolic.decode;

import com.questrail.symbolic.channel.ChannelDriver;
import com.questrail.symbolic.channel.ExpressionHandle;
import com.questrail.symbolic.config.Flag;
import com.questrail.symbolic.config.TranslationConfig;
import com.questrail.symbolic.encode.ExpressionEncoder;
import com.questrail.symbolic.error.MalformedMapException;
import com.questrail.symbolic.expression.Expression;
import com.questrail.symbolic.expression.ExpressionKind;
import com.questrail.symbolic.expression.Expressions;
import com.questrail.symbolic.observability.BridgeObservabilitySink;
import com.questrail.symbolic.observability.DecodeStage;
import com.questrail.symbolic.observability.DecodeTraceEvent;
import com.questrail.symbolic.observability.NullObservabilitySink;
import com.questrail.symbolic.value.EngineFunction;
import com.questrail.symbolic.value.GenericExpression;
import com.questrail.symbolic.value.LazyList;
import com.questrail.symbolic.value.Rational;
import com.questrail.symbolic.value.Symbol;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * ExpressionDecoder
 * ============================================================================
 * Converts a foreign {@link Expression} into a native host value.
 *
 * <h2>Dispatch order</h2>
 * The first matching rule wins:
 * <ol>
 *   <li>{@code AS_FUNCTION}: the whole expression becomes an {@link EngineFunction}</li>
 *   <li>anything that is not a {@code List}, or any expression under
 *       {@code FULL_FORM}: complex atom decoding</li>
 *   <li>homogeneous vector of one atom kind: simple vector</li>
 *   <li>homogeneous rectangular matrix: simple matrix, row by row</li>
 *   <li>any other list: every element decoded recursively</li>
 * </ol>
 *
 * <h2>Complex atoms</h2>
 * Typed atoms decode to {@code BigInteger}, {@code BigDecimal},
 * {@code Integer}/{@code Long} (narrowed to {@code Integer} when the value fits
 * in 32 bits), {@code Double}, {@code String}, {@link Rational} or a symbol
 * value. {@code Function[...]} and {@code HashMapObject[...]} decode to a
 * function and a map when enabled; everything else to a
 * {@link GenericExpression}.
 *
 * <h2>Symbols</h2>
 * Alias table first, then {@code True}/{@code False}/{@code Null}, otherwise a
 * {@link Symbol} with the engine namespace separator replaced.
 *
 * <h2>Purity</h2>
 * Decoding depends only on the expression and the {@link TranslationContext}.
 * Independent subtrees may be decoded concurrently. The only side effects are
 * verbose trace events and, for decoded functions, engine requests made when
 * the function is later invoked.
 */
public final class ExpressionDecoder
{
    private final ExpressionEncoder encoder;
    private final BridgeObservabilitySink observabilitySink;

    public ExpressionDecoder(ExpressionEncoder encoder) {
        this(encoder, null);
    }

    public ExpressionDecoder(ExpressionEncoder encoder, BridgeObservabilitySink observabilitySink) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Decodes without a channel; functions in the result cannot be invoked.
     */
    public Object decode(ExpressionHandle handle, TranslationConfig config) {
        return decode(handle, TranslationContext.offline(config));
    }

    /**
     * @return the native value, or {@code null} for a {@code null} handle
     */
    public Object decode(ExpressionHandle handle, TranslationContext context) {
        if (handle == null) {
            return null;
        }
        return decode(handle.expression(), context);
    }

    public Object decode(Expression expression, TranslationContext context) {
        Objects.requireNonNull(expression, "expression");
        TranslationContext here = context.descend();
        TranslationConfig config = here.config();

        if (config.asFunction()) {
            return decodeFunction(expression, here);
        }
        if (!expression.isList() || config.fullForm()) {
            return decodeComplexAtom(expression, here);
        }

        Optional<ExpressionKind> vectorType = expression.vectorType();
        if (vectorType.isPresent()) {
            return traced(DecodeStage.SIMPLE_VECTOR, here,
                    () -> decodeSimpleVector(expression, vectorType.get(), here));
        }

        Optional<ExpressionKind> matrixType = expression.matrixType();
        if (matrixType.isPresent()) {
            return traced(DecodeStage.SIMPLE_MATRIX, here,
                    () -> decodeSimpleMatrix(expression, matrixType.get(), here));
        }

        return realize(expression.arguments(), here, this::decode);
    }

    // ========================================================================
    // Arrays
    // ========================================================================

    private List<?> decodeSimpleVector(Expression vector, ExpressionKind type, TranslationContext context) {
        if (context.config().numeric() && type.isBulkNumeric()) {
            double[] values = vector.asDoubleArray();
            List<Double> boxed = new ArrayList<>(values.length);
            for (double v : values) {
                boxed.add(v);
            }
            return Collections.unmodifiableList(boxed);
        }
        return realize(vector.arguments(), context, (element, ctx) -> decodeSimpleAtom(element, type, ctx));
    }

    private List<?> decodeSimpleMatrix(Expression matrix, ExpressionKind type, TranslationContext context) {
        return realize(matrix.arguments(), context,
                (row, ctx) -> decodeSimpleVector(row, type, ctx.descend()));
    }

    @FunctionalInterface
    private interface ElementDecoder {
        Object decode(Expression element, TranslationContext context);
    }

    /**
     * Applies the context's realization policy to a sequence of elements.
     */
    private static List<Object> realize(List<Expression> elements,
                                        TranslationContext context,
                                        ElementDecoder elementDecoder) {
        switch (context.config().realization()) {
            case VECTORS: {
                List<Object> out = new ArrayList<>(elements.size());
                for (Expression element : elements) {
                    out.add(elementDecoder.decode(element, context));
                }
                return Collections.unmodifiableList(out);
            }
            case SEQUENCES: {
                TranslationContext frozen = context;
                return new LazyList<>(elements.size(), i -> elementDecoder.decode(elements.get(i), frozen));
            }
            case LAZY_SEQUENCES: {
                // Deferred stages decode as plain sequences under the captured context.
                TranslationContext frozen = context.with(Flag.SEQUENCES);
                return new LazyList<>(elements.size(), i -> elementDecoder.decode(elements.get(i), frozen));
            }
            default:
                throw new IllegalStateException("Unknown realization " + context.config().realization());
        }
    }

    // ========================================================================
    // Atoms
    // ========================================================================

    private Object decodeComplexAtom(Expression expression, TranslationContext context) {
        ExpressionKind kind = expression.kind();
        if (kind != ExpressionKind.NORMAL) {
            return decodeSimpleAtom(expression, kind, context);
        }

        String head = expression.headName();
        if ("Function".equals(head) && context.config().decodesFunctions()) {
            return decodeFunction(expression, context);
        }
        if ("HashMapObject".equals(head) && context.config().decodesHashMaps()) {
            return traced(DecodeStage.HASH_MAP, context, () -> decodeHashMap(expression, context));
        }
        return decodeGeneric(expression, context);
    }

    private Object decodeSimpleAtom(Expression atom, ExpressionKind type, TranslationContext context) {
        return switch (type) {
            case BIG_INTEGER -> atom.asBigInteger();
            case BIG_DECIMAL -> atom.asBigDecimal();
            case INTEGER -> decodeInteger(atom);
            case REAL -> atom.asDouble();
            case STRING -> atom.asString();
            case RATIONAL -> decodeRational(atom);
            case SYMBOL -> decodeSymbol(atom, context);
            case NORMAL -> throw new IllegalStateException("Not an atom: " + atom);
        };
    }

    /**
     * {@code Integer} when the value lies within the 32-bit range, otherwise {@code Long}.
     */
    static Number decodeInteger(Expression atom) {
        long value = atom.asLong();
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return (int) value;
        }
        return value;
    }

    private static Rational decodeRational(Expression rational) {
        return Rational.of(
                integerPart(rational.argument(1)),
                integerPart(rational.argument(2)));
    }

    private static BigInteger integerPart(Expression part) {
        if (part.kind() == ExpressionKind.BIG_INTEGER) {
            return part.asBigInteger();
        }
        return BigInteger.valueOf(decodeInteger(part).longValue());
    }

    private static Object decodeSymbol(Expression symbol, TranslationContext context) {
        String name = symbol.symbolName();
        Optional<Symbol> alias = context.config().aliases().hostSymbolFor(name);
        if (alias.isPresent()) {
            return alias.get();
        }
        switch (name) {
            case "True":
                return Boolean.TRUE;
            case "False":
                return Boolean.FALSE;
            case "Null":
                return null;
            default:
                return Symbol.fromEngineName(name);
        }
    }

    // ========================================================================
    // Structured values
    // ========================================================================

    private GenericExpression decodeGeneric(Expression expression, TranslationContext context) {
        Object head = decode(expression.head(), context);
        List<Object> args = new ArrayList<>(expression.arguments().size());
        for (Expression argument : expression.arguments()) {
            args.add(decode(argument, context));
        }
        return new GenericExpression(head, args);
    }

    private Map<Object, Object> decodeHashMap(Expression expression, TranslationContext context) {
        if (expression.arguments().size() != 1) {
            throw new MalformedMapException("HashMapObject expects exactly one rule set but had "
                    + expression.arguments().size() + " arguments: " + expression);
        }

        Expression inside = expression.argument(1);
        final Expression rules;
        if (inside.isList()) {
            rules = inside;
        } else if ("Dispatch".equals(inside.headName())
                && !inside.arguments().isEmpty()
                && inside.argument(1).isList()) {
            rules = inside.argument(1);
        } else {
            throw new MalformedMapException("HashMapObject rule set must be a list of rules or a Dispatch: " + inside);
        }

        Map<Object, Object> map = new LinkedHashMap<>();
        for (Expression rule : rules.arguments()) {
            String head = rule.headName();
            if (!("Rule".equals(head) || "RuleDelayed".equals(head)) || rule.arguments().size() != 2) {
                throw new MalformedMapException("HashMapObject entry is not a rule: " + rule);
            }
            TranslationContext ruleContext = context.descend();
            map.put(decode(rule.argument(1), ruleContext), decode(rule.argument(2), ruleContext));
        }
        return Collections.unmodifiableMap(map);
    }

    private EngineFunction decodeFunction(Expression template, TranslationContext context) {
        return traced(DecodeStage.FUNCTION, context,
                () -> new DecodedFunction(template, context.forCallable()));
    }

    private <T> T traced(DecodeStage stage, TranslationContext context, Supplier<T> body) {
        if (!context.config().verbose()) {
            return body.get();
        }
        long start = System.nanoTime();
        try {
            return body.get();
        } finally {
            observabilitySink.onDecodeTrace(new DecodeTraceEvent(
                    Instant.now(),
                    stage,
                    context.depth(),
                    Duration.ofNanos(System.nanoTime() - start)));
        }
    }

    /**
     * Function bound to the channel and settings in force when it was decoded.
     */
    private final class DecodedFunction implements EngineFunction {
        private final Expression template;
        private final TranslationContext captured;

        private DecodedFunction(Expression template, TranslationContext captured) {
            this.template = template;
            this.captured = captured;
        }

        @Override
        public Object invoke(Object... arguments) {
            ChannelDriver channel = captured.channel();
            if (channel == null) {
                throw new IllegalStateException("Function " + template + " was decoded without an engine channel");
            }
            List<Expression> encoded = new ArrayList<>(arguments.length);
            for (Object argument : arguments) {
                encoded.add(encoder.encode(argument, captured.config()));
            }
            ExpressionHandle response = channel.request(Expressions.apply(template, encoded), captured.config());
            return decode(response, captured);
        }

        @Override
        public Expression template() {
            return template;
        }

        @Override
        public String toString() {
            return "EngineFunction[" + template + "]";
        }
    }
}
