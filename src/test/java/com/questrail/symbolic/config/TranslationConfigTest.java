package com.questrail.symbolic.config;

import com.questrail.symbolic.value.Symbol;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TranslationConfigTest
{
    @Test
    void defaults()
    {
        TranslationConfig config = TranslationConfig.defaults();

        assertEquals(Realization.VECTORS, config.realization());
        assertFalse(config.fullForm());
        assertFalse(config.asFunction());
        assertTrue(config.functions());
        assertTrue(config.hashMaps());
        assertFalse(config.numeric());
        assertFalse(config.verbose());
        assertFalse(config.strict());
        assertTrue(config.aliases().isEmpty());
        assertEquals(TranslationConfig.DEFAULT_MAX_DEPTH, config.maxDepth());
    }

    @Test
    void derivingLeavesSourceUntouched()
    {
        TranslationConfig base = TranslationConfig.defaults();
        TranslationConfig derived = base.with(Flag.SEQUENCES, Flag.NUMERIC);

        assertEquals(Realization.SEQUENCES, derived.realization());
        assertTrue(derived.numeric());
        assertEquals(Realization.VECTORS, base.realization());
        assertFalse(base.numeric());
    }

    @Test
    void laterFlagInSameGroupWins()
    {
        TranslationConfig config = TranslationConfig.of(Flag.STRICT, Flag.LAZY_SEQUENCES, Flag.LENIENT);

        assertFalse(config.strict());
        assertEquals(Realization.LAZY_SEQUENCES, config.realization());
        assertEquals(Flag.Group.ENGINE_ERRORS, Flag.STRICT.group());
        assertEquals(Flag.STRICT.group(), Flag.LENIENT.group());
    }

    @Test
    void fullFormDisablesFunctionsAndMaps()
    {
        TranslationConfig config = TranslationConfig.of(Flag.FULL_FORM);

        assertTrue(config.functions());
        assertFalse(config.decodesFunctions());
        assertFalse(config.decodesHashMaps());
        assertTrue(TranslationConfig.defaults().decodesFunctions());
        assertFalse(TranslationConfig.of(Flag.NO_HASH_MAPS).decodesHashMaps());
    }

    @Test
    void noFlagsReturnsSameInstance()
    {
        TranslationConfig config = TranslationConfig.defaults();

        assertSame(config, config.with());
    }

    @Test
    void aliasesAndDepthAttached()
    {
        AliasTable aliases = AliasTable.builder().alias("Plus", "+").build();
        TranslationConfig config = TranslationConfig.defaults().withAliases(aliases).withMaxDepth(8);

        assertEquals(Symbol.of("+"), config.aliases().hostSymbolFor("Plus").orElseThrow());
        assertEquals(8, config.maxDepth());
        assertEquals(config, config.toBuilder().build());
    }

    @Test
    void invalidValuesRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> TranslationConfig.defaults().withMaxDepth(0));
        assertThrows(NullPointerException.class, () -> TranslationConfig.builder().withRealization(null).build());
        assertThrows(NullPointerException.class, () -> TranslationConfig.defaults().with((Flag) null));
    }
}
