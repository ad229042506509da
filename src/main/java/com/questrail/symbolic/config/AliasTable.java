package com.questrail.symbolic.config;

import com.questrail.symbolic.value.Symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * AliasTable
 * =============================================================================
 * Immutable bidirectional mapping between engine symbol names and host
 * {@link Symbol}s.
 *
 * <p>Both directions are built once, at construction. A table is attached to a
 * {@link TranslationConfig} for the whole of a top-level call, so a lookup
 * never observes a table that changed mid-call.</p>
 *
 * <p>The reserved names {@code True}, {@code False} and {@code Null} always
 * decode to {@code true}, {@code false} and {@code null}; aliasing them is
 * rejected.</p>
 */
public final class AliasTable
{
    private static final Set<String> RESERVED = Set.of("True", "False", "Null");

    private static final AliasTable EMPTY = new AliasTable(Map.of());

    private final Map<String, Symbol> byEngineName;
    private final Map<Symbol, String> byHostSymbol;

    private AliasTable(Map<String, Symbol> byEngineName) {
        Map<Symbol, String> inverse = new LinkedHashMap<>();
        for (Map.Entry<String, Symbol> e : byEngineName.entrySet()) {
            String previous = inverse.putIfAbsent(e.getValue(), e.getKey());
            if (previous != null) {
                throw new IllegalArgumentException(
                        "Host symbol " + e.getValue() + " aliased by both " + previous + " and " + e.getKey());
            }
        }
        this.byEngineName = Collections.unmodifiableMap(new LinkedHashMap<>(byEngineName));
        this.byHostSymbol = Collections.unmodifiableMap(inverse);
    }

    public static AliasTable empty() {
        return EMPTY;
    }

    /**
     * Builds a table from engine names to host symbols, e.g.
     * {@code Map.of("Plus", Symbol.of("+"))}.
     */
    public static AliasTable of(Map<String, Symbol> engineToHost) {
        Objects.requireNonNull(engineToHost, "engineToHost");
        for (String engineName : engineToHost.keySet()) {
            if (RESERVED.contains(engineName)) {
                throw new IllegalArgumentException("Reserved symbol cannot be aliased: " + engineName);
            }
        }
        return engineToHost.isEmpty() ? EMPTY : new AliasTable(engineToHost);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Symbol> hostSymbolFor(String engineName) {
        return Optional.ofNullable(byEngineName.get(engineName));
    }

    public Optional<String> engineNameFor(Symbol hostSymbol) {
        return Optional.ofNullable(byHostSymbol.get(hostSymbol));
    }

    public boolean isEmpty() {
        return byEngineName.isEmpty();
    }

    public int size() {
        return byEngineName.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AliasTable other && byEngineName.equals(other.byEngineName);
    }

    @Override
    public int hashCode() {
        return byEngineName.hashCode();
    }

    @Override
    public String toString() {
        return "AliasTable" + byEngineName;
    }

    public static final class Builder {
        private final Map<String, Symbol> aliases = new LinkedHashMap<>();

        public Builder alias(String engineName, String hostName) {
            return alias(engineName, Symbol.of(hostName));
        }

        public Builder alias(String engineName, Symbol hostSymbol) {
            aliases.put(Objects.requireNonNull(engineName, "engineName"),
                    Objects.requireNonNull(hostSymbol, "hostSymbol"));
            return this;
        }

        public AliasTable build() {
            return AliasTable.of(aliases);
        }
    }
}
