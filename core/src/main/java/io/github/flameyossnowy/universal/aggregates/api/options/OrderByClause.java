package io.github.flameyossnowy.universal.aggregates.api.options;

import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import org.jetbrains.annotations.NotNull;

import java.util.List;

public record OrderByClause(List<OrderTerm> terms) implements SqlExpression {
    public OrderByClause {
        terms = List.copyOf(terms);
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("ORDER BY requires at least one term");
        }
    }

    @Override
    public StringBuilder render(@NotNull RenderContext context, @NotNull StringBuilder sql) {
        sql.append("ORDER BY ");
        boolean seen = false;
        for (OrderTerm term : terms) {
            if (seen) {
                sql.append(", ");
            } else {
                seen = true;
            }
            term.render(context, sql);
        }
        return sql;
    }
}
