package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.condition.ConditionBuilder;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Operations every aggregate builder has. {@code B} is the concrete builder type so chained calls keep
 * the richest interface.
 *
 * <pre>{@code
 * fn.sum().column("view_count").filter(cb -> cb.eq("status", "published"))
 * }</pre>
 */
public interface BaseAggregate<B extends BaseAggregate<B>> extends SqlExpression {
    /**
     * Sets the aggregate argument to a column reference.
     */
    B column(@NotNull String column);

    /**
     * Sets the aggregate argument to an arbitrary expression.
     */
    B expr(@NotNull SqlExpression expression);

    B expr(@NotNull String sql, Object... args);

    /**
     * Restricts the rows fed to the aggregate, {@code FILTER (WHERE ...)} where the dialect has it and a
     * CASE rewrite of the argument where it does not.
     */
    B filter(@NotNull Consumer<ConditionBuilder> builder);

    B filter(@NotNull SqlExpression condition);

    AggregationType type();
}
