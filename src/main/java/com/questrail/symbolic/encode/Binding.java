package com.questrail.symbolic.encode;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One local variable of a {@code Module}: an engine symbol name and the host
 * value assigned to it.
 *
 * @param value any value {@link ExpressionEncoder} accepts, including {@code null}
 */
public record Binding(String name, Object value)
{
    // Optional context prefix segments, each followed by a backquote.
    private static final Pattern ENGINE_SYMBOL =
            Pattern.compile("(?:[A-Za-z$][A-Za-z0-9$]*`)*[A-Za-z$][A-Za-z0-9$]*");

    public Binding {
        Objects.requireNonNull(name, "name");
        if (!ENGINE_SYMBOL.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid engine symbol name: '" + name + "'");
        }
    }

    public static Binding of(String name, Object value) {
        return new Binding(name, value);
    }
}
