package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.dialect.DialectFunctions;
import io.github.flameyossnowy.universal.aggregates.api.expression.Expressions;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.options.OrderTermBuilder;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.NullsMode;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.StringAggBuilder;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * <pre>
 * PostgreSQL: STRING_AGG([DISTINCT ]arg, 'sep'[ ORDER BY ...])
 * MySQL:      GROUP_CONCAT([DISTINCT ]arg[ ORDER BY ...] SEPARATOR 'sep'), NULLS FIRST/LAST as an IS NULL key
 * SQLite:     GROUP_CONCAT(arg, 'sep'[ ORDER BY ...]), GROUP_CONCAT(DISTINCT arg[ ORDER BY ...])
 * </pre>
 * IGNORE NULLS becomes a CASE guard on the argument for all three.
 */
final class StringAggExpr extends AbstractAggregateBuilder<StringAggBuilder> implements StringAggBuilder {
    private final Distinctable distinctable = new Distinctable(expression);
    private final Orderable orderable = new Orderable(expression);
    private final NullHandling nullHandling = new NullHandling(expression);

    StringAggExpr() {
        super(AggregationType.STRING_AGG);
    }

    @Override
    public StringAggBuilder separator(@NotNull String separator) {
        expression.setSeparator(Objects.requireNonNull(separator, "separator"));
        return this;
    }

    @Override
    public StringAggBuilder distinct() {
        distinctable.distinct();
        return this;
    }

    @Override
    public StringAggBuilder orderBy(@NotNull String... columns) {
        orderable.orderBy(columns);
        return this;
    }

    @Override
    public StringAggBuilder orderByDesc(@NotNull String... columns) {
        orderable.orderByDesc(columns);
        return this;
    }

    @Override
    public StringAggBuilder orderByExpr(@NotNull SqlExpression orderExpression) {
        orderable.orderByExpr(orderExpression);
        return this;
    }

    @Override
    public StringAggBuilder orderBy(@NotNull Consumer<OrderTermBuilder> term) {
        orderable.orderBy(term);
        return this;
    }

    @Override
    public StringAggBuilder ignoreNulls() {
        nullHandling.ignoreNulls();
        return this;
    }

    @Override
    public StringAggBuilder respectNulls() {
        nullHandling.respectNulls();
        return this;
    }

    @Override
    protected AggregateCall rewrite(@NotNull RenderContext context) {
        AggregateCall call = AggregateCall.of(expression);
        AggregateCall base = expression.nullsMode() == NullsMode.IGNORE
            ? call.withArgument(ignoringNulls(call.argument()))
            : call;
        SqlExpression separator = Expressions.inlineLiteral(expression.separator());

        return context.dispatcher().apply(DialectFunctions.<AggregateCall>builder()
            .postgres(() -> base.withFunctionName("STRING_AGG").withTrailingArguments(separator))
            .mysql(() -> withEmulatedNullsOrdering(base, context)
                .withFunctionName("GROUP_CONCAT")
                .withTrailer(Expressions.expr("SEPARATOR ?", separator)))
            .sqlite(() -> base.distinct()
                // SQLite rejects DISTINCT aggregates with more than one argument
                ? base.withFunctionName("GROUP_CONCAT")
                : base.withFunctionName("GROUP_CONCAT").withTrailingArguments(separator))
            .orElse(() -> {
                throw unsupported(context.sqlType());
            })
            .build());
    }
}
