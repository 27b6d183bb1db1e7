package io.github.flameyossnowy.universal.aggregates.api.options;

import io.github.flameyossnowy.universal.aggregates.api.expression.Expressions;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * One {@code expr ASC|DESC [NULLS FIRST|LAST]} entry of an ORDER BY list.
 */
public record OrderTerm(SqlExpression expression, SortOrder order, NullsOrder nulls) implements SqlExpression {
    public OrderTerm {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(nulls, "nulls");
    }

    @Contract("_ -> new")
    public static @NotNull OrderTerm asc(@NotNull String column) {
        return new OrderTerm(Expressions.column(column), SortOrder.ASCENDING, NullsOrder.DEFAULT);
    }

    @Contract("_ -> new")
    public static @NotNull OrderTerm desc(@NotNull String column) {
        return new OrderTerm(Expressions.column(column), SortOrder.DESCENDING, NullsOrder.DEFAULT);
    }

    @Override
    public StringBuilder render(@NotNull RenderContext context, @NotNull StringBuilder sql) {
        expression.render(context, sql).append(' ').append(order.sql());
        if (nulls != NullsOrder.DEFAULT) {
            sql.append(' ').append(nulls.sql());
        }
        return sql;
    }
}
