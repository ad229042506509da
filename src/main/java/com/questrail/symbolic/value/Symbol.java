package com.questrail.symbolic.value;

import java.util.Objects;

/**
 * Host-side identifier decoded from an engine symbol.
 *
 * <p>Namespaced names use {@code /} as separator, so the engine symbol
 * {@code Global`x} becomes {@code Symbol[Global/x]}. {@link #engineName()}
 * restores the engine spelling.</p>
 */
public record Symbol(String name)
{
    public static final char HOST_SEPARATOR = '/';
    public static final char ENGINE_SEPARATOR = '`';

    public Symbol {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name must not be empty");
        }
    }

    public static Symbol of(String name) {
        return new Symbol(name);
    }

    public static Symbol fromEngineName(String engineName) {
        return new Symbol(engineName.replace(ENGINE_SEPARATOR, HOST_SEPARATOR));
    }

    public String engineName() {
        return name.replace(HOST_SEPARATOR, ENGINE_SEPARATOR);
    }

    /**
     * Namespace part of the name, empty when the symbol is unqualified.
     */
    public String namespace() {
        int idx = name.lastIndexOf(HOST_SEPARATOR);
        return idx < 0 ? "" : name.substring(0, idx);
    }

    public String localName() {
        int idx = name.lastIndexOf(HOST_SEPARATOR);
        return idx < 0 ? name : name.substring(idx + 1);
    }

    @Override
    public String toString() {
        return name;
    }
}
