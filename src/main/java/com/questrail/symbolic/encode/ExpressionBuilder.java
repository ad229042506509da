package com.questrail.symbolic.encode;

import com.questrail.symbolic.channel.ExpressionHandle;
import com.questrail.symbolic.channel.ExpressionNormalizer;
import com.questrail.symbolic.config.TranslationConfig;
import com.questrail.symbolic.expression.Expression;
import com.questrail.symbolic.expression.Expressions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ExpressionBuilder
 * =============================================================================
 * Builds composite requests from host values before they are submitted.
 *
 * <h2>Applications</h2>
 * {@code buildApplication("Plus", 1, 2)} gives {@code Plus[1, 2]}. Arguments go
 * through {@link ExpressionEncoder}, so expressions and handles pass unchanged.
 *
 * <h2>Bindings</h2>
 * <pre>
 *   Module[List[Set[x, v], ...], CompoundExpression[body...]]    LAST_OUTPUT
 *   Module[List[Set[x, v], ...], List[body...]]                  ALL_OUTPUT
 *   Module[List[Set[x, v], ...],
 *          ParallelSubmit[List[x, ...], &lt;compound&gt;]]            PARALLEL
 * </pre>
 * Body entries are normalized, so text entries are parsed by the engine
 * (one exchange each) when the normalizer is backed by a channel.
 */
public final class ExpressionBuilder
{
    private final ExpressionEncoder encoder;
    private final ExpressionNormalizer normalizer;

    public ExpressionBuilder(ExpressionEncoder encoder, ExpressionNormalizer normalizer) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    public Expression buildApplication(String head, Object... arguments) {
        return buildApplication(Expressions.symbol(head), arguments);
    }

    public Expression buildApplication(Expression head, Object... arguments) {
        return buildApplication(head, TranslationConfig.defaults(), arguments);
    }

    /**
     * @param config supplies the alias table used to encode the arguments
     */
    public Expression buildApplication(Expression head, TranslationConfig config, Object... arguments) {
        Objects.requireNonNull(head, "head");
        Objects.requireNonNull(config, "config");
        List<Expression> encoded = new ArrayList<>(arguments.length);
        for (Object argument : arguments) {
            encoded.add(encoder.encode(argument, config));
        }
        return Expressions.apply(head, encoded);
    }

    public Expression buildBinding(List<Binding> bindings, List<?> body, BindingOption... options) {
        return buildBinding(bindings, body, TranslationConfig.defaults(), options);
    }

    /**
     * @param config supplies the alias table used to encode bound values
     * @throws IllegalArgumentException for conflicting options or an empty body
     */
    public Expression buildBinding(List<Binding> bindings,
                                   List<?> body,
                                   TranslationConfig config,
                                   BindingOption... options) {
        Objects.requireNonNull(bindings, "bindings");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(config, "config");
        Set<BindingOption> resolved = BindingOption.resolve(options);
        if (body.isEmpty()) {
            throw new IllegalArgumentException("Binding body must contain at least one expression");
        }

        List<Expression> sets = new ArrayList<>(bindings.size());
        List<Expression> variables = new ArrayList<>(bindings.size());
        for (Binding binding : bindings) {
            Expression variable = Expressions.symbol(binding.name());
            variables.add(variable);
            sets.add(Expressions.apply("Set", variable, encoder.encode(binding.value(), config)));
        }

        List<Expression> statements = new ArrayList<>(body.size());
        for (Object entry : body) {
            ExpressionHandle handle = normalizer.normalize(entry);
            statements.add(handle == null ? Expressions.NULL : handle.expression());
        }

        String compounder = resolved.contains(BindingOption.ALL_OUTPUT) ? "List" : "CompoundExpression";
        Expression compound = Expressions.apply(compounder, statements);
        if (resolved.contains(BindingOption.PARALLEL)) {
            compound = Expressions.apply("ParallelSubmit", Expressions.list(variables), compound);
        }
        return Expressions.apply("Module", Expressions.list(sets), compound);
    }
}
