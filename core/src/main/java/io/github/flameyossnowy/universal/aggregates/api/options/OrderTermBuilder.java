package io.github.flameyossnowy.universal.aggregates.api.options;

import io.github.flameyossnowy.universal.aggregates.api.expression.Expressions;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import org.jetbrains.annotations.NotNull;

/**
 * Fluent form of {@link OrderTerm} for when direction and NULL placement both matter.
 *
 * <pre>{@code
 * ob.column("published_at").desc().nullsLast()
 * }</pre>
 */
public final class OrderTermBuilder {
    private SqlExpression expression;
    private SortOrder order = SortOrder.ASCENDING;
    private NullsOrder nulls = NullsOrder.DEFAULT;

    public OrderTermBuilder column(@NotNull String column) {
        this.expression = Expressions.column(column);
        return this;
    }

    public OrderTermBuilder expr(@NotNull SqlExpression expression) {
        this.expression = expression;
        return this;
    }

    public OrderTermBuilder asc() {
        this.order = SortOrder.ASCENDING;
        return this;
    }

    public OrderTermBuilder desc() {
        this.order = SortOrder.DESCENDING;
        return this;
    }

    public OrderTermBuilder nullsFirst() {
        this.nulls = NullsOrder.FIRST;
        return this;
    }

    public OrderTermBuilder nullsLast() {
        this.nulls = NullsOrder.LAST;
        return this;
    }

    public @NotNull OrderTerm build() {
        if (expression == null) {
            throw new IllegalStateException("ORDER BY term requires a column or an expression");
        }
        return new OrderTerm(expression, order, nulls);
    }
}
