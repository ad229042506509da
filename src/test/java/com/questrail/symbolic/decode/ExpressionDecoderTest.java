package com.questrail.symbolic.decode;

import com.questrail.symbolic.channel.ChannelDriver;
import com.questrail.symbolic.channel.ExpressionHandle;
import com.questrail.symbolic.config.AliasTable;
import com.questrail.symbolic.config.Flag;
import com.questrail.symbolic.config.TranslationConfig;
import com.questrail.symbolic.encode.ExpressionEncoder;
import com.questrail.symbolic.error.DecodeExhaustionException;
import com.questrail.symbolic.error.MalformedMapException;
import com.questrail.symbolic.expression.Expression;
import com.questrail.symbolic.expression.Expressions;
import com.questrail.symbolic.link.MiniEngine;
import com.questrail.symbolic.link.ScriptedEngineLink;
import com.questrail.symbolic.observability.DecodeStage;
import com.questrail.symbolic.observability.DecodeTraceEvent;
import com.questrail.symbolic.observability.RecordingObservabilitySink;
import com.questrail.symbolic.value.EngineFunction;
import com.questrail.symbolic.value.GenericExpression;
import com.questrail.symbolic.value.LazyList;
import com.questrail.symbolic.value.Rational;
import com.questrail.symbolic.value.Symbol;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ExpressionDecoder}.
 *
 * These tests validate the inbound translation boundary:
 *   Expression -> host value
 */
final class ExpressionDecoderTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ExpressionDecoder decoder = new ExpressionDecoder(new ExpressionEncoder(), sink);

    private Object decode(Expression e, Flag... flags)
    {
        return decoder.decode(e, TranslationContext.offline(TranslationConfig.of(flags)));
    }

    private static Expression ints(long... values)
    {
        Expression[] out = new Expression[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = Expressions.integer(values[i]);
        }
        return Expressions.list(out);
    }

    // ------------------------------------------------------------------
    // Atoms
    // ------------------------------------------------------------------

    @Test
    void integersNarrowToIntWhenTheyFit()
    {
        assertEquals(Integer.valueOf(Integer.MAX_VALUE), decode(Expressions.integer(Integer.MAX_VALUE)));
        assertEquals(Integer.valueOf(Integer.MIN_VALUE), decode(Expressions.integer(Integer.MIN_VALUE)));
        assertEquals(Long.valueOf(Integer.MAX_VALUE + 1L), decode(Expressions.integer(Integer.MAX_VALUE + 1L)));
        assertEquals(Long.valueOf(Integer.MIN_VALUE - 1L), decode(Expressions.integer(Integer.MIN_VALUE - 1L)));
    }

    @Test
    void otherAtomsKeepTheirPrecision()
    {
        BigInteger big = BigInteger.TWO.pow(100);
        BigDecimal precise = new BigDecimal("3.14159265358979323846264338327950288");

        assertEquals(big, decode(Expressions.bigInteger(big)));
        assertEquals(precise, decode(Expressions.bigDecimal(precise)));
        assertEquals(2.5, decode(Expressions.real(2.5)));
        assertEquals("text", decode(Expressions.string("text")));
    }

    @Test
    void rationalsStayExact()
    {
        assertEquals(Rational.of(1, 3), decode(Expressions.rational(1, 3)));

        BigInteger huge = BigInteger.TEN.pow(40);
        assertEquals(Rational.of(huge, BigInteger.valueOf(7)),
                decode(Expressions.rational(huge, BigInteger.valueOf(7))));
    }

    @Test
    void reservedSymbols()
    {
        assertEquals(Boolean.TRUE, decode(Expressions.TRUE));
        assertEquals(Boolean.FALSE, decode(Expressions.FALSE));
        assertNull(decode(Expressions.NULL));
    }

    @Test
    void symbolsGetHostSeparator()
    {
        assertEquals(Symbol.of("Global/x"), decode(Expressions.symbol("Global`x")));
        assertEquals(Symbol.of("Sin"), decode(Expressions.symbol("Sin")));
    }

    @Test
    void aliasesTakePrecedence()
    {
        TranslationConfig config = TranslationConfig.defaults()
                .withAliases(AliasTable.builder().alias("Plus", "+").build());

        Object decoded = decoder.decode(Expressions.symbol("Plus"), TranslationContext.offline(config));

        assertEquals(Symbol.of("+"), decoded);
    }

    @Test
    void nullHandleDecodesToNull()
    {
        assertNull(decoder.decode((ExpressionHandle) null, TranslationConfig.defaults()));
    }

    // ------------------------------------------------------------------
    // Lists and realization
    // ------------------------------------------------------------------

    @Test
    void simpleVectorIsEagerAndUnmodifiable()
    {
        Object decoded = decode(ints(1, 2, 3));

        assertEquals(List.of(1, 2, 3), decoded);
        assertFalse(decoded instanceof LazyList);
        assertThrows(UnsupportedOperationException.class, () -> ((List<Object>) decoded).add(4));
    }

    @Test
    void matrixDecodedRowByRow()
    {
        Expression m = Expressions.list(ints(1, 2), ints(3, 4));

        assertEquals(List.of(List.of(1, 2), List.of(3, 4)), decode(m));
    }

    @Test
    void mixedListDecodedElementwise()
    {
        Expression mixed = Expressions.list(
                Expressions.integer(1),
                Expressions.string("a"),
                ints(2, 3),
                Expressions.NULL);

        assertEquals(Arrays.asList(1, "a", List.of(2, 3), null), decode(mixed));
    }

    @Test
    void emptyListDecodesToEmptyList()
    {
        assertEquals(List.of(), decode(Expressions.list()));
    }

    @Test
    void numericCoercesNumericVectors()
    {
        assertEquals(List.of(1.0, 2.0, 3.0), decode(ints(1, 2, 3), Flag.NUMERIC));
        assertEquals(List.of("a", "b"),
                decode(Expressions.list(Expressions.string("a"), Expressions.string("b")), Flag.NUMERIC));
        assertEquals(List.of(Rational.of(1, 2)),
                decode(Expressions.list(Expressions.rational(1, 2)), Flag.NUMERIC));
    }

    @Test
    void sequencesRealizeOnDemand()
    {
        Object decoded = decode(ints(10, 20, 30), Flag.SEQUENCES);

        LazyList<?> lazy = assertInstanceOf(LazyList.class, decoded);
        assertEquals(0, lazy.realizedCount());
        assertEquals(20, lazy.get(1));
        assertEquals(1, lazy.realizedCount());
        assertEquals(List.of(10, 20, 30), lazy);
    }

    @Test
    void sequencesKeepNestedListsLazy()
    {
        Expression nested = Expressions.list(ints(1, 2), Expressions.list(Expressions.string("a")));

        LazyList<?> outer = assertInstanceOf(LazyList.class, decode(nested, Flag.SEQUENCES));
        LazyList<?> inner = assertInstanceOf(LazyList.class, outer.get(0));

        assertEquals(0, inner.realizedCount());
        assertEquals(List.of(1, 2), inner);
        assertEquals(List.of(List.of(1, 2), List.of("a")), outer);
    }

    @Test
    void lazySequencesStayLazyAllTheWayDown()
    {
        Expression nested = Expressions.list(ints(1, 2), Expressions.list(Expressions.string("a")));

        LazyList<?> outer = assertInstanceOf(LazyList.class, decode(nested, Flag.LAZY_SEQUENCES));
        LazyList<?> inner = assertInstanceOf(LazyList.class, outer.get(0));

        assertEquals(0, inner.realizedCount());
        assertEquals(List.of(1, 2), inner);
    }

    @Test
    void lazySequenceKeepsSettingsOfTheDecodingCall()
    {
        TranslationConfig config = TranslationConfig.of(Flag.SEQUENCES)
                .withAliases(AliasTable.builder().alias("Plus", "+").build());
        Expression symbols = Expressions.list(Expressions.symbol("Plus"), Expressions.symbol("Times"));

        List<?> lazy = (List<?>) decoder.decode(symbols, TranslationContext.offline(config));

        assertEquals(List.of(Symbol.of("+"), Symbol.of("Times")), lazy);
    }

    // ------------------------------------------------------------------
    // Structured values
    // ------------------------------------------------------------------

    @Test
    void genericExpressionForUnknownHeads()
    {
        Expression e = Expressions.apply("f", Expressions.symbol("x"), Expressions.integer(1));

        assertEquals(GenericExpression.of(Symbol.of("f"), Symbol.of("x"), 1), decode(e));
    }

    @Test
    void compoundHeadsDecodeRecursively()
    {
        Expression e = Expressions.apply(Expressions.apply("Derivative", Expressions.integer(1)),
                Expressions.symbol("f"));

        GenericExpression decoded = assertInstanceOf(GenericExpression.class, decode(e));
        assertEquals(GenericExpression.of(Symbol.of("Derivative"), 1), decoded.head());
        assertEquals(List.of(Symbol.of("f")), decoded.arguments());
    }

    @Test
    void fullFormDecodesListsGenerically()
    {
        Object decoded = decode(ints(1, 2), Flag.FULL_FORM);

        assertEquals(GenericExpression.of(Symbol.of("List"), 1, 2), decoded);
    }

    @Test
    void hashMapObjectDecodesToOrderedMap()
    {
        Expression map = Expressions.apply("HashMapObject", Expressions.list(
                Expressions.apply("Rule", Expressions.symbol("a"), Expressions.integer(1)),
                Expressions.apply("Rule", Expressions.symbol("b"), Expressions.integer(2))));

        Map<Object, Object> expected = new LinkedHashMap<>();
        expected.put(Symbol.of("a"), 1);
        expected.put(Symbol.of("b"), 2);

        Object decoded = decode(map);
        assertEquals(expected, decoded);
        assertEquals(List.of(Symbol.of("a"), Symbol.of("b")), List.copyOf(((Map<?, ?>) decoded).keySet()));
    }

    @Test
    void hashMapAcceptsDispatchAndDelayedRules()
    {
        Expression map = Expressions.apply("HashMapObject",
                Expressions.apply("Dispatch", Expressions.list(
                        Expressions.apply("RuleDelayed", Expressions.string("k"), Expressions.string("v")))));

        assertEquals(Map.of("k", "v"), decode(map));
    }

    @Test
    void malformedHashMapRejected()
    {
        Expression notRules = Expressions.apply("HashMapObject", Expressions.list(Expressions.integer(1)));
        Expression noArgs = Expressions.apply("HashMapObject");
        Expression wrongInner = Expressions.apply("HashMapObject", Expressions.string("x"));

        assertThrows(MalformedMapException.class, () -> decode(notRules));
        assertThrows(MalformedMapException.class, () -> decode(noArgs));
        assertThrows(MalformedMapException.class, () -> decode(wrongInner));
    }

    @Test
    void hashMapsCanBeSwitchedOff()
    {
        Expression map = Expressions.apply("HashMapObject", Expressions.list());

        assertInstanceOf(GenericExpression.class, decode(map, Flag.NO_HASH_MAPS));
        assertInstanceOf(GenericExpression.class, decode(map, Flag.FULL_FORM));
        assertEquals(Map.of(), decode(map));
    }

    // ------------------------------------------------------------------
    // Depth
    // ------------------------------------------------------------------

    @Test
    void nestingBeyondLimitFails()
    {
        Expression deep = Expressions.integer(0);
        for (int i = 0; i < 50; i++) {
            deep = Expressions.apply("f", deep);
        }
        Expression tree = deep;
        TranslationContext shallow = TranslationContext.offline(TranslationConfig.defaults().withMaxDepth(20));

        DecodeExhaustionException e = assertThrows(DecodeExhaustionException.class,
                () -> decoder.decode(tree, shallow));
        assertEquals(20, e.depthLimit());

        assertInstanceOf(GenericExpression.class, decode(tree));
    }

    // ------------------------------------------------------------------
    // Functions
    // ------------------------------------------------------------------

    @Test
    void functionDecodedOfflineCannotBeInvoked()
    {
        Expression template = Expressions.apply("Function",
                Expressions.apply("Plus", MiniEngine.slot(1), Expressions.integer(1)));

        EngineFunction f = assertInstanceOf(EngineFunction.class, decode(template));

        assertEquals(template, f.template());
        assertThrows(IllegalStateException.class, () -> f.invoke(5));
    }

    @Test
    void functionsCanBeSwitchedOff()
    {
        Expression template = Expressions.apply("Function", Expressions.symbol("x"));

        assertInstanceOf(GenericExpression.class, decode(template, Flag.NO_FUNCTIONS));
    }

    @Test
    void asFunctionWrapsAnyExpression()
    {
        EngineFunction f = assertInstanceOf(EngineFunction.class,
                decode(Expressions.symbol("Plus"), Flag.AS_FUNCTION));

        assertEquals(Expressions.symbol("Plus"), f.template());
    }

    @Test
    void functionCallsBackThroughItsChannel()
    {
        ScriptedEngineLink link = new ScriptedEngineLink(new MiniEngine());
        ChannelDriver channel = new ChannelDriver(link);
        Expression template = Expressions.apply("Function",
                Expressions.apply("Plus", MiniEngine.slot(1), Expressions.integer(1)));

        EngineFunction f = (EngineFunction) decoder.decode(template,
                TranslationContext.of(TranslationConfig.defaults(), channel));

        assertEquals(6, f.invoke(5));
        assertEquals(1, link.submitted().size());
        assertEquals(Expressions.apply(template, Expressions.integer(5)), link.submitted().get(0));
    }

    @Test
    void functionResultsDecodeAsPlainExpressions()
    {
        ScriptedEngineLink link = new ScriptedEngineLink(request -> Expressions.symbol("Plus"));
        ChannelDriver channel = new ChannelDriver(link);

        EngineFunction f = (EngineFunction) decoder.decode(Expressions.symbol("Identity"),
                TranslationContext.of(TranslationConfig.of(Flag.AS_FUNCTION), channel));

        assertEquals(Symbol.of("Plus"), f.invoke());
    }

    // ------------------------------------------------------------------
    // Tracing
    // ------------------------------------------------------------------

    @Test
    void verboseEmitsDecodeTraces()
    {
        decode(Expressions.list(ints(1, 2), ints(3, 4)), Flag.VERBOSE);

        List<DecodeTraceEvent> traces = sink.eventsOfType(DecodeTraceEvent.class);
        assertFalse(traces.isEmpty());
        assertEquals(DecodeStage.SIMPLE_MATRIX, traces.get(traces.size() - 1).stage());
    }

    @Test
    void quietEmitsNothing()
    {
        decode(ints(1, 2, 3));

        assertTrue(sink.getAllEvents().isEmpty());
    }
}
