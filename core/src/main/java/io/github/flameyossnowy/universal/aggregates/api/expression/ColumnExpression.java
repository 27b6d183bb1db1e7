package io.github.flameyossnowy.universal.aggregates.api.expression;

import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import org.jetbrains.annotations.NotNull;

/**
 * Column reference. Qualified names such as {@code p.view_count} are written as given; with
 * {@code quoted} every part is wrapped in the dialect's identifier quotes.
 */
public record ColumnExpression(String name, boolean quoted) implements SqlExpression {
    public ColumnExpression {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be blank");
        }
    }

    @Override
    public StringBuilder render(@NotNull RenderContext context, @NotNull StringBuilder sql) {
        if (!quoted) {
            return sql.append(name);
        }

        int dot = name.indexOf('.');
        if (dot > -1) {
            context.appendQuoted(sql, name.substring(0, dot)).append('.');
            return context.appendQuoted(sql, name.substring(dot + 1));
        }
        return context.appendQuoted(sql, name);
    }
}
