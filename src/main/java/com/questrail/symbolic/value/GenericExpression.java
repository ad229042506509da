package com.questrail.symbolic.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fallback native form of an engine expression with no specialised
 * translation: the decoded head followed by the decoded arguments.
 *
 * <p>Arguments may contain {@code null} (a decoded {@code Null}), so the list
 * is an unmodifiable copy rather than a {@code List.of} snapshot.</p>
 */
public record GenericExpression(Object head, List<Object> arguments)
{
    public GenericExpression {
        Objects.requireNonNull(arguments, "arguments");
        arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public static GenericExpression of(Object head, Object... arguments) {
        List<Object> args = new ArrayList<>(arguments.length);
        Collections.addAll(args, arguments);
        return new GenericExpression(head, args);
    }

    @Override
    public String toString() {
        return arguments.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(" ", "(" + head + (arguments.isEmpty() ? "" : " "), ")"));
    }
}
