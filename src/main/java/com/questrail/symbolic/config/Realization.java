package com.questrail.symbolic.config;

/**
 * Realization
 * -----------------------------------------------------------------------------
 * How decoded sequences are materialized.
 *
 * <ul>
 *   <li>{@link #VECTORS}: eager, fixed-size, unmodifiable list.</li>
 *   <li>{@link #SEQUENCES}: finite lazy list; an element is decoded on first
 *       access with the same settings, so nested lists are lazy too.</li>
 *   <li>{@link #LAZY_SEQUENCES}: lazy list of deferred stages; each stage
 *       captures the settings in force and decodes its element as a
 *       {@link #SEQUENCES} list when first read.</li>
 * </ul>
 *
 * All three compare equal to each other once realized, since each is a
 * {@link java.util.List} with the same contents.
 */
public enum Realization
{
    VECTORS,
    SEQUENCES,
    LAZY_SEQUENCES
}
