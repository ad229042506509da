package com.questrail.symbolic.decode;

import com.questrail.symbolic.channel.ChannelDriver;
import com.questrail.symbolic.config.Flag;
import com.questrail.symbolic.config.TranslationConfig;
import com.questrail.symbolic.error.DecodeExhaustionException;

import java.util.Objects;

/**
 * TranslationContext
 * -----------------------------------------------------------------------------
 * What a decode step sees: the configuration in force, the channel decoded
 * functions will call back through, and the current nesting depth.
 *
 * <p>Immutable. Lazy sequence stages and decoded functions keep the context
 * they were created with, so later realization from unrelated code observes
 * the settings and channel of the call that created them.</p>
 *
 * @param channel may be {@code null} for offline decoding; functions decoded
 *                offline refuse to be invoked
 */
public record TranslationContext(TranslationConfig config, ChannelDriver channel, int depth)
{
    public TranslationContext {
        Objects.requireNonNull(config, "config");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be non-negative");
        }
    }

    public static TranslationContext of(TranslationConfig config, ChannelDriver channel) {
        return new TranslationContext(config, channel, 0);
    }

    public static TranslationContext offline(TranslationConfig config) {
        return new TranslationContext(config, null, 0);
    }

    public TranslationContext with(Flag... flags) {
        return new TranslationContext(config.with(flags), channel, depth);
    }

    /**
     * Context for one level further down the tree.
     *
     * @throws DecodeExhaustionException past {@link TranslationConfig#maxDepth()}
     */
    TranslationContext descend() {
        if (depth >= config.maxDepth()) {
            throw new DecodeExhaustionException(config.maxDepth());
        }
        return new TranslationContext(config, channel, depth + 1);
    }

    /**
     * Context captured by a decoded function: plain-expression decoding of its
     * results, starting again from the root.
     */
    TranslationContext forCallable() {
        return new TranslationContext(config.with(Flag.AS_EXPRESSION), channel, 0);
    }
}
