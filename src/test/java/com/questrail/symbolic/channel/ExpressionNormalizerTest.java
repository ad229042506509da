package com.questrail.symbolic.channel;

import com.questrail.symbolic.error.UnsupportedInputTypeException;
import com.questrail.symbolic.expression.Expression;
import com.questrail.symbolic.expression.Expressions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ExpressionNormalizerTest
{
    private final List<String> parsed = new ArrayList<>();

    private final ExpressionNormalizer normalizer = new ExpressionNormalizer(text -> {
        parsed.add(text);
        return Expressions.symbol("parsed");
    });

    @Test
    void handleReturnedUnchanged()
    {
        ExpressionHandle handle = new ExpressionHandle(Expressions.integer(1), 7);

        assertSame(handle, normalizer.normalize(handle));
        assertTrue(parsed.isEmpty());
    }

    @Test
    void expressionWrappedWithoutRequestId()
    {
        Expression e = Expressions.apply("f", Expressions.integer(1));

        ExpressionHandle handle = normalizer.normalize(e);

        assertEquals(e, handle.expression());
        assertEquals(ExpressionHandle.NO_REQUEST, handle.requestId());
        assertFalse(handle.isResponse());
    }

    @Test
    void textGoesThroughParser()
    {
        ExpressionHandle handle = normalizer.normalize("a + b");

        assertEquals(Expressions.symbol("parsed"), handle.expression());
        assertEquals(List.of("a + b"), parsed);
    }

    @Test
    void nullPropagates()
    {
        assertNull(normalizer.normalize(null));
        assertEquals(InputShape.ABSENT, InputShape.of(null));
    }

    @Test
    void otherTypesRejected()
    {
        UnsupportedInputTypeException e = assertThrows(UnsupportedInputTypeException.class,
                () -> normalizer.normalize(42));

        assertEquals(Integer.class, e.inputType());
        assertTrue(e.getMessage().contains("java.lang.Integer"));
    }

    @Test
    void offlineNormalizerRejectsText()
    {
        ExpressionNormalizer offline = ExpressionNormalizer.offline();

        assertThrows(IllegalStateException.class, () -> offline.normalize("1+1"));
        assertNotNull(offline.normalize(Expressions.integer(1)));
    }
}
