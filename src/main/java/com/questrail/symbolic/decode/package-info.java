/**
 * Decode Engine
 * =============================================================================
 *
 * <p>Converts foreign {@link com.questrail.symbolic.expression.Expression}
 * trees into host values.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   ExpressionHandle (from the channel driver)
 *        → ExpressionDecoder        (dispatch on shape and config)
 *            → host value           (numbers, strings, lists, maps,
 *                                    symbols, generic expressions, functions)
 * </pre>
 *
 * <h2>Context</h2>
 * <p>Every step receives a {@link com.questrail.symbolic.decode.TranslationContext}.
 * Lazy list stages and decoded functions keep the context that created them,
 * so a sequence realized long after the call still decodes with the call's
 * settings and calls back through the call's channel.</p>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The decoder never touches the link directly.</li>
 *   <li>Depth is bounded by the configured limit; deeper trees fail with
 *       {@link com.questrail.symbolic.error.DecodeExhaustionException}.</li>
 * </ul>
 */
package com.questrail.symbolic.decode;
