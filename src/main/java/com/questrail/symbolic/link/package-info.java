/**
 * Engine Link Port
 * =============================================================================
 *
 * This package defines the <em>engine-agnostic transport boundary</em> between
 * a concrete engine connection (a vendor link library, a socket bridge, or a
 * test double) and the translation core.
 *
 * <h2>Why this port exists</h2>
 * The translation core must not depend on any vendor link type. Everything
 * above {@link com.questrail.symbolic.link.EngineLink} sees only
 * {@link com.questrail.symbolic.expression.Expression} trees and
 * {@link java.io.IOException}s.
 *
 * <h2>Architectural constraints</h2>
 * Implementations of this port MUST:
 * <ul>
 *   <li>Perform engine I/O only (no decoding into host values)</li>
 *   <li>Not serialize access themselves; the channel driver owns exclusivity</li>
 *   <li>Not retry failed exchanges</li>
 * </ul>
 */
package com.questrail.symbolic.link;
