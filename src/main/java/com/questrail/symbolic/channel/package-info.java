/**
 * Request normalization and exclusive access to one engine link.
 *
 * <p>{@link com.questrail.symbolic.channel.ChannelDriver} is the only class
 * that calls an {@link com.questrail.symbolic.link.EngineLink}.</p>
 */
package com.questrail.symbolic.channel;
