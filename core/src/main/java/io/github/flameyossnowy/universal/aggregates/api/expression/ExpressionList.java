package io.github.flameyossnowy.universal.aggregates.api.expression;

import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Expressions written one after another with a separator, {@code ", "} for argument tuples.
 */
public record ExpressionList(String separator, List<SqlExpression> expressions) implements SqlExpression {
    public ExpressionList {
        expressions = List.copyOf(expressions);
        if (expressions.isEmpty()) {
            throw new IllegalArgumentException("Expression list must not be empty");
        }
    }

    @Override
    public StringBuilder render(@NotNull RenderContext context, @NotNull StringBuilder sql) {
        boolean seen = false;
        for (SqlExpression expression : expressions) {
            if (seen) {
                sql.append(separator);
            } else {
                seen = true;
            }
            expression.render(context, sql);
        }
        return sql;
    }
}
