package com.questrail.symbolic.config;

import java.util.Objects;

/**
 * TranslationConfig
 * -----------------------------------------------------------------------------
 * Immutable bundle of translation settings for one top-level call.
 *
 * <p>A bundle is never mutated. Refinements ({@link #with(Flag...)},
 * {@link #withAliases(AliasTable)}, {@link #withMaxDepth(int)}) return a new
 * bundle, which is what lazy sequence stages and decoded callables capture.</p>
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>realization: {@link Realization#VECTORS}</li>
 *   <li>structured decoding, functions and hash maps enabled</li>
 *   <li>exact numbers, quiet, lenient about engine errors</li>
 *   <li>no aliases, depth limit {@value #DEFAULT_MAX_DEPTH}</li>
 * </ul>
 */
public record TranslationConfig(
        Realization realization,
        boolean fullForm,
        boolean asFunction,
        boolean functions,
        boolean hashMaps,
        boolean numeric,
        boolean verbose,
        boolean strict,
        AliasTable aliases,
        int maxDepth
) {
    public static final int DEFAULT_MAX_DEPTH = 1024;

    private static final TranslationConfig DEFAULTS = builder().build();

    public TranslationConfig {
        Objects.requireNonNull(realization, "realization");
        Objects.requireNonNull(aliases, "aliases");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
    }

    public static TranslationConfig defaults() {
        return DEFAULTS;
    }

    public static TranslationConfig of(Flag... flags) {
        return DEFAULTS.with(flags);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Derives a bundle with the given flags applied in order.
     */
    public TranslationConfig with(Flag... flags) {
        Objects.requireNonNull(flags, "flags");
        if (flags.length == 0) {
            return this;
        }
        Builder b = toBuilder();
        for (Flag flag : flags) {
            b.flag(Objects.requireNonNull(flag, "flag"));
        }
        return b.build();
    }

    public TranslationConfig withAliases(AliasTable aliases) {
        return toBuilder().withAliases(aliases).build();
    }

    public TranslationConfig withMaxDepth(int maxDepth) {
        return toBuilder().withMaxDepth(maxDepth).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .withRealization(realization)
                .withFullForm(fullForm)
                .withAsFunction(asFunction)
                .withFunctions(functions)
                .withHashMaps(hashMaps)
                .withNumeric(numeric)
                .withVerbose(verbose)
                .withStrict(strict)
                .withAliases(aliases)
                .withMaxDepth(maxDepth);
    }

    /**
     * Whether {@code Function[...]} expressions decode to callables.
     */
    public boolean decodesFunctions() {
        return functions && !fullForm;
    }

    /**
     * Whether {@code HashMapObject[...]} expressions decode to maps.
     */
    public boolean decodesHashMaps() {
        return hashMaps && !fullForm;
    }

    public static final class Builder {
        private Realization realization = Realization.VECTORS;
        private boolean fullForm = false;
        private boolean asFunction = false;
        private boolean functions = true;
        private boolean hashMaps = true;
        private boolean numeric = false;
        private boolean verbose = false;
        private boolean strict = false;
        private AliasTable aliases = AliasTable.empty();
        private int maxDepth = DEFAULT_MAX_DEPTH;

        public Builder withRealization(Realization realization) {
            this.realization = realization;
            return this;
        }

        public Builder withFullForm(boolean fullForm) {
            this.fullForm = fullForm;
            return this;
        }

        public Builder withAsFunction(boolean asFunction) {
            this.asFunction = asFunction;
            return this;
        }

        public Builder withFunctions(boolean functions) {
            this.functions = functions;
            return this;
        }

        public Builder withHashMaps(boolean hashMaps) {
            this.hashMaps = hashMaps;
            return this;
        }

        public Builder withNumeric(boolean numeric) {
            this.numeric = numeric;
            return this;
        }

        public Builder withVerbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder withStrict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder withAliases(AliasTable aliases) {
            this.aliases = aliases;
            return this;
        }

        public Builder withMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder flag(Flag flag) {
            switch (flag) {
                case VECTORS -> realization = Realization.VECTORS;
                case SEQUENCES -> realization = Realization.SEQUENCES;
                case LAZY_SEQUENCES -> realization = Realization.LAZY_SEQUENCES;
                case STRUCTURED -> fullForm = false;
                case FULL_FORM -> fullForm = true;
                case AS_EXPRESSION -> asFunction = false;
                case AS_FUNCTION -> asFunction = true;
                case FUNCTIONS -> functions = true;
                case NO_FUNCTIONS -> functions = false;
                case HASH_MAPS -> hashMaps = true;
                case NO_HASH_MAPS -> hashMaps = false;
                case EXACT -> numeric = false;
                case NUMERIC -> numeric = true;
                case QUIET -> verbose = false;
                case VERBOSE -> verbose = true;
                case LENIENT -> strict = false;
                case STRICT -> strict = true;
            }
            return this;
        }

        public TranslationConfig build() {
            return new TranslationConfig(realization, fullForm, asFunction, functions, hashMaps,
                    numeric, verbose, strict, aliases, maxDepth);
        }
    }
}
