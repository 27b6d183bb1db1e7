package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.dialect.DialectFunctions;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.options.OrderTermBuilder;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.JsonArrayAggBuilder;
import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

final class JsonArrayAggExpr extends AbstractAggregateBuilder<JsonArrayAggBuilder> implements JsonArrayAggBuilder {
    private final Distinctable distinctable = new Distinctable(expression);
    private final Orderable orderable = new Orderable(expression);

    JsonArrayAggExpr() {
        super(AggregationType.JSON_ARRAY_AGG);
    }

    @Override
    public JsonArrayAggBuilder distinct() {
        distinctable.distinct();
        return this;
    }

    @Override
    public JsonArrayAggBuilder orderBy(@NotNull String... columns) {
        orderable.orderBy(columns);
        return this;
    }

    @Override
    public JsonArrayAggBuilder orderByDesc(@NotNull String... columns) {
        orderable.orderByDesc(columns);
        return this;
    }

    @Override
    public JsonArrayAggBuilder orderByExpr(@NotNull SqlExpression orderExpression) {
        orderable.orderByExpr(orderExpression);
        return this;
    }

    @Override
    public JsonArrayAggBuilder orderBy(@NotNull Consumer<OrderTermBuilder> term) {
        orderable.orderBy(term);
        return this;
    }

    @Override
    protected AggregateCall rewrite(@NotNull RenderContext context) {
        AggregateCall base = AggregateCall.of(expression);

        return context.dispatcher().apply(DialectFunctions.<AggregateCall>builder()
            .postgres(() -> base.withFunctionName("JSON_AGG"))
            .mysql(() -> withoutDistinctOrOrdering(base.withFunctionName("JSON_ARRAYAGG"), context))
            .sqlite(() -> withoutDistinctOrOrdering(base.withFunctionName("JSON_GROUP_ARRAY"), context))
            .orElse(() -> {
                throw unsupported(context.sqlType());
            })
            .build());
    }
}
