package com.questrail.symbolic.api;

import com.questrail.symbolic.channel.ChannelDriver;
import com.questrail.symbolic.channel.ExpressionHandle;
import com.questrail.symbolic.config.Flag;
import com.questrail.symbolic.config.TranslationConfig;
import com.questrail.symbolic.decode.ExpressionDecoder;
import com.questrail.symbolic.decode.TranslationContext;
import com.questrail.symbolic.encode.Binding;
import com.questrail.symbolic.encode.BindingOption;
import com.questrail.symbolic.encode.ExpressionBuilder;
import com.questrail.symbolic.encode.ExpressionEncoder;
import com.questrail.symbolic.expression.Expression;
import com.questrail.symbolic.expression.Expressions;
import com.questrail.symbolic.link.EngineLink;
import com.questrail.symbolic.observability.BridgeObservabilitySink;
import com.questrail.symbolic.observability.Slf4jBridgeObservabilitySink;

import java.util.List;
import java.util.Objects;

/**
 * EngineBridge
 * =============================================================================
 * Composition root and caller surface for one engine link.
 *
 * <pre>
 *   EngineBridge bridge = EngineBridge.builder()
 *       .withLink(link)
 *       .build();
 *
 *   Object three = bridge.evaluate("1 + 2");
 *   Object sum   = bridge.evaluate(bridge.buildApplication("Plus", 1, 2));
 * </pre>
 *
 * <p>Every operation taking flags applies them on top of the bridge's default
 * {@link TranslationConfig}, for that call only. The bridge is thread-safe;
 * concurrent calls serialize on the link inside {@link ChannelDriver}.</p>
 */
public final class EngineBridge
{
    private final TranslationConfig defaultConfig;
    private final ChannelDriver channel;
    private final ExpressionEncoder encoder;
    private final ExpressionDecoder decoder;
    private final ExpressionBuilder builder;

    private EngineBridge(TranslationConfig defaultConfig,
                         ChannelDriver channel,
                         ExpressionEncoder encoder,
                         ExpressionDecoder decoder) {
        this.defaultConfig = defaultConfig;
        this.channel = channel;
        this.encoder = encoder;
        this.decoder = decoder;
        this.builder = new ExpressionBuilder(encoder, channel.normalizer());
    }

    public static Builder builder() {
        return new Builder();
    }

    public TranslationConfig defaultConfig() {
        return defaultConfig;
    }

    public ChannelDriver channel() {
        return channel;
    }

    // ------------------------------------------------------------------------
    // Requests
    // ------------------------------------------------------------------------

    /**
     * Canonical handle for text, an expression or a handle; text is parsed by
     * the engine without being evaluated.
     */
    public ExpressionHandle normalize(Object input) {
        return channel.normalizer().normalize(input);
    }

    public ExpressionHandle requestEvaluation(Object input, Flag... flags) {
        return channel.request(input, configFor(flags));
    }

    public ExpressionHandle requestEvaluation(Object input, TranslationConfig config) {
        return channel.request(input, config);
    }

    // ------------------------------------------------------------------------
    // Translation
    // ------------------------------------------------------------------------

    public Object decode(ExpressionHandle handle, Flag... flags) {
        return decode(handle, configFor(flags));
    }

    public Object decode(ExpressionHandle handle, TranslationConfig config) {
        return decoder.decode(handle, TranslationContext.of(config, channel));
    }

    public Expression encode(Object value) {
        return encoder.encode(value, defaultConfig);
    }

    public Expression encode(Object value, TranslationConfig config) {
        return encoder.encode(value, config);
    }

    /**
     * Normalizes and decodes {@code input} without evaluating it.
     */
    public Object parse(Object input, Flag... flags) {
        TranslationConfig config = configFor(flags);
        return decode(normalize(input), config);
    }

    /**
     * Evaluates {@code input} on the engine and decodes the result.
     */
    public Object evaluate(Object input, Flag... flags) {
        TranslationConfig config = configFor(flags);
        return decode(channel.request(input, config), config);
    }

    // ------------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------------

    public Expression buildApplication(String head, Object... arguments) {
        return builder.buildApplication(Expressions.symbol(head), defaultConfig, arguments);
    }

    public Expression buildApplication(Expression head, Object... arguments) {
        return builder.buildApplication(head, defaultConfig, arguments);
    }

    public Expression buildBinding(List<Binding> bindings, List<?> body, BindingOption... options) {
        return builder.buildBinding(bindings, body, defaultConfig, options);
    }

    private TranslationConfig configFor(Flag... flags) {
        return defaultConfig.with(flags);
    }

    public static final class Builder {
        private EngineLink link;
        private BridgeObservabilitySink observabilitySink;
        private TranslationConfig config = TranslationConfig.defaults();

        public Builder withLink(EngineLink link) {
            this.link = link;
            return this;
        }

        /**
         * Defaults to {@link Slf4jBridgeObservabilitySink}.
         */
        public Builder withObservabilitySink(BridgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withConfig(TranslationConfig config) {
            this.config = config;
            return this;
        }

        public EngineBridge build() {
            Objects.requireNonNull(link, "link");
            Objects.requireNonNull(config, "config");

            BridgeObservabilitySink sink = observabilitySink != null
                    ? observabilitySink
                    : new Slf4jBridgeObservabilitySink();

            ExpressionEncoder encoder = new ExpressionEncoder();
            return new EngineBridge(
                    config,
                    new ChannelDriver(link, sink),
                    encoder,
                    new ExpressionDecoder(encoder, sink));
        }
    }
}
