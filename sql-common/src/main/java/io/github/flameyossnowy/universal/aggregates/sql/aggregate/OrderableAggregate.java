package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.options.OrderTermBuilder;
import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * ORDER BY inside the aggregate call. Terms are emitted in the order they were added.
 */
public interface OrderableAggregate<B> {
    B orderBy(@NotNull String... columns);

    B orderByDesc(@NotNull String... columns);

    B orderByExpr(@NotNull SqlExpression expression);

    /**
     * Adds one term with full control over direction and NULL placement.
     *
     * <pre>{@code
     * .orderBy(ob -> ob.column("published_at").desc().nullsLast())
     * }</pre>
     */
    B orderBy(@NotNull Consumer<OrderTermBuilder> term);
}
