package io.github.flameyossnowy.universal.aggregates.api.expression;

import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import org.jetbrains.annotations.NotNull;

/**
 * {@code expression AS alias}, the form an aggregate takes inside a projection list.
 */
public record AliasedExpression(SqlExpression expression, String alias) implements SqlExpression {
    public AliasedExpression {
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("Alias must not be blank");
        }
    }

    @Override
    public StringBuilder render(@NotNull RenderContext context, @NotNull StringBuilder sql) {
        return expression.render(context, sql).append(" AS ").append(alias);
    }
}
