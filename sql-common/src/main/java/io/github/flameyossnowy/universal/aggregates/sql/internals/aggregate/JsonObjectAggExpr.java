package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.dialect.DialectFunctions;
import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import io.github.flameyossnowy.universal.aggregates.api.exceptions.MissingArgumentsException;
import io.github.flameyossnowy.universal.aggregates.api.expression.Expressions;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.options.OrderTermBuilder;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.JsonObjectAggBuilder;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * {@code NAME(key, value)}: JSON_OBJECT_AGG on PostgreSQL, JSON_OBJECTAGG on MySQL, JSON_GROUP_OBJECT on
 * SQLite. Under an emulated FILTER only the value is wrapped, the key is left as is.
 */
final class JsonObjectAggExpr extends AbstractAggregateBuilder<JsonObjectAggBuilder> implements JsonObjectAggBuilder {
    private final Distinctable distinctable = new Distinctable(expression);
    private final Orderable orderable = new Orderable(expression);

    JsonObjectAggExpr() {
        super(AggregationType.JSON_OBJECT_AGG);
    }

    @Override
    public JsonObjectAggBuilder keyColumn(@NotNull String column) {
        expression.setKey(Expressions.column(column));
        return this;
    }

    @Override
    public JsonObjectAggBuilder keyExpr(@NotNull SqlExpression key) {
        expression.setKey(Objects.requireNonNull(key, "key"));
        return this;
    }

    @Override
    public JsonObjectAggBuilder distinct() {
        distinctable.distinct();
        return this;
    }

    @Override
    public JsonObjectAggBuilder orderBy(@NotNull String... columns) {
        orderable.orderBy(columns);
        return this;
    }

    @Override
    public JsonObjectAggBuilder orderByDesc(@NotNull String... columns) {
        orderable.orderByDesc(columns);
        return this;
    }

    @Override
    public JsonObjectAggBuilder orderByExpr(@NotNull SqlExpression orderExpression) {
        orderable.orderByExpr(orderExpression);
        return this;
    }

    @Override
    public JsonObjectAggBuilder orderBy(@NotNull Consumer<OrderTermBuilder> term) {
        orderable.orderBy(term);
        return this;
    }

    @Override
    protected void validate(@NotNull SQLType sqlType) {
        if (expression.key() == null) {
            throw new MissingArgumentsException("JSON object aggregation requires a key, call keyColumn(...) or keyExpr(...)", expression.functionName(), sqlType);
        }
        super.validate(sqlType);
    }

    @Override
    protected AggregateCall rewrite(@NotNull RenderContext context) {
        AggregateCall base = AggregateCall.of(expression).withLeadingArguments(expression.key());

        return context.dispatcher().apply(DialectFunctions.<AggregateCall>builder()
            .postgres(() -> base.withFunctionName("JSON_OBJECT_AGG"))
            .mysql(() -> withoutDistinctOrOrdering(base.withFunctionName("JSON_OBJECTAGG"), context))
            .sqlite(() -> withoutDistinctOrOrdering(base.withFunctionName("JSON_GROUP_OBJECT"), context))
            .orElse(() -> {
                throw unsupported(context.sqlType());
            })
            .build());
    }
}
