package com.questrail.symbolic.config;

/**
 * Flag
 * -----------------------------------------------------------------------------
 * Named translation switches, arranged in mutually exclusive groups.
 *
 * <p>Flags are applied with {@link TranslationConfig#with(Flag...)}; within one
 * group the flag applied last wins. The first flag listed in each group is the
 * default.</p>
 */
public enum Flag
{
    VECTORS(Group.REALIZATION),
    SEQUENCES(Group.REALIZATION),
    LAZY_SEQUENCES(Group.REALIZATION),

    /** Decode functions and maps as specialised values. */
    STRUCTURED(Group.STRUCTURE),
    /** Decode every non-atomic expression as a generic head plus arguments. */
    FULL_FORM(Group.STRUCTURE),

    AS_EXPRESSION(Group.SHAPE),
    /** Treat the whole result as a function template and return a callable. */
    AS_FUNCTION(Group.SHAPE),

    FUNCTIONS(Group.FUNCTIONS),
    NO_FUNCTIONS(Group.FUNCTIONS),

    HASH_MAPS(Group.HASH_MAPS),
    NO_HASH_MAPS(Group.HASH_MAPS),

    EXACT(Group.NUMERIC),
    /** Coerce homogeneous numeric arrays to doubles in bulk. */
    NUMERIC(Group.NUMERIC),

    QUIET(Group.TRACING),
    VERBOSE(Group.TRACING),

    LENIENT(Group.ENGINE_ERRORS),
    /** Raise on engine-reported evaluation errors instead of decoding them. */
    STRICT(Group.ENGINE_ERRORS);

    public enum Group {
        REALIZATION,
        STRUCTURE,
        SHAPE,
        FUNCTIONS,
        HASH_MAPS,
        NUMERIC,
        TRACING,
        ENGINE_ERRORS
    }

    private final Group group;

    Flag(Group group) {
        this.group = group;
    }

    public Group group() {
        return group;
    }
}
