package io.github.flameyossnowy.universal.aggregates.api.expression;

import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A value. {@code inline} forces the literal into the SQL text even when the context binds parameters.
 */
public record Literal(@Nullable Object value, boolean inline) implements SqlExpression {
    static final Literal NULL = new Literal(null, true);

    @Override
    public StringBuilder render(@NotNull RenderContext context, @NotNull StringBuilder sql) {
        return inline ? context.appendLiteral(sql, value) : context.appendValue(sql, value);
    }
}
