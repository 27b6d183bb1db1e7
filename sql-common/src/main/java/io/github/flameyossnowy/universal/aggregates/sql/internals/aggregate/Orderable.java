package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.options.NullsOrder;
import io.github.flameyossnowy.universal.aggregates.api.options.OrderTerm;
import io.github.flameyossnowy.universal.aggregates.api.options.OrderTermBuilder;
import io.github.flameyossnowy.universal.aggregates.api.options.SortOrder;
import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * ORDER BY capability, appends terms in call order.
 */
final class Orderable {
    private final AggregateExpression expression;

    Orderable(AggregateExpression expression) {
        this.expression = expression;
    }

    void orderBy(@NotNull String... columns) {
        for (String column : columns) {
            expression.addOrderTerm(OrderTerm.asc(column));
        }
    }

    void orderByDesc(@NotNull String... columns) {
        for (String column : columns) {
            expression.addOrderTerm(OrderTerm.desc(column));
        }
    }

    void orderByExpr(@NotNull SqlExpression orderExpression) {
        expression.addOrderTerm(new OrderTerm(orderExpression, SortOrder.ASCENDING, NullsOrder.DEFAULT));
    }

    void orderBy(@NotNull Consumer<OrderTermBuilder> term) {
        OrderTermBuilder builder = new OrderTermBuilder();
        term.accept(builder);
        expression.addOrderTerm(builder.build());
    }
}
