package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import org.jetbrains.annotations.NotNull;

/**
 * JSON object aggregation. {@link #column(String)} / {@link #expr(SqlExpression)} set the value, the key
 * is set separately and is required.
 */
public interface JsonObjectAggBuilder extends BaseAggregate<JsonObjectAggBuilder>,
    DistinctableAggregate<JsonObjectAggBuilder>,
    OrderableAggregate<JsonObjectAggBuilder> {

    JsonObjectAggBuilder keyColumn(@NotNull String column);

    JsonObjectAggBuilder keyExpr(@NotNull SqlExpression expression);
}
