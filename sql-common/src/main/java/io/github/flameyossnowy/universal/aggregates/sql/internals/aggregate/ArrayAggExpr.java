package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.dialect.DialectFunctions;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.options.OrderTermBuilder;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.ArrayAggBuilder;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.NullsMode;
import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * ARRAY_AGG on PostgreSQL, a JSON array elsewhere ({@code JSON_ARRAYAGG} on MySQL,
 * {@code JSON_GROUP_ARRAY} on SQLite). The JSON variants take neither DISTINCT nor ORDER BY.
 */
final class ArrayAggExpr extends AbstractAggregateBuilder<ArrayAggBuilder> implements ArrayAggBuilder {
    private final Distinctable distinctable = new Distinctable(expression);
    private final Orderable orderable = new Orderable(expression);
    private final NullHandling nullHandling = new NullHandling(expression);

    ArrayAggExpr() {
        super(AggregationType.ARRAY_AGG);
    }

    @Override
    public ArrayAggBuilder distinct() {
        distinctable.distinct();
        return this;
    }

    @Override
    public ArrayAggBuilder orderBy(@NotNull String... columns) {
        orderable.orderBy(columns);
        return this;
    }

    @Override
    public ArrayAggBuilder orderByDesc(@NotNull String... columns) {
        orderable.orderByDesc(columns);
        return this;
    }

    @Override
    public ArrayAggBuilder orderByExpr(@NotNull SqlExpression orderExpression) {
        orderable.orderByExpr(orderExpression);
        return this;
    }

    @Override
    public ArrayAggBuilder orderBy(@NotNull Consumer<OrderTermBuilder> term) {
        orderable.orderBy(term);
        return this;
    }

    @Override
    public ArrayAggBuilder ignoreNulls() {
        nullHandling.ignoreNulls();
        return this;
    }

    @Override
    public ArrayAggBuilder respectNulls() {
        nullHandling.respectNulls();
        return this;
    }

    @Override
    protected AggregateCall rewrite(@NotNull RenderContext context) {
        AggregateCall call = AggregateCall.of(expression);
        AggregateCall base = expression.nullsMode() == NullsMode.IGNORE
            ? call.withArgument(ignoringNulls(call.argument()))
            : call;

        return context.dispatcher().apply(DialectFunctions.<AggregateCall>builder()
            .postgres(() -> base.withFunctionName("ARRAY_AGG"))
            .mysql(() -> withoutDistinctOrOrdering(base.withFunctionName("JSON_ARRAYAGG"), context))
            .sqlite(() -> withoutDistinctOrOrdering(base.withFunctionName("JSON_GROUP_ARRAY"), context))
            .orElse(() -> {
                throw unsupported(context.sqlType());
            })
            .build());
    }
}
