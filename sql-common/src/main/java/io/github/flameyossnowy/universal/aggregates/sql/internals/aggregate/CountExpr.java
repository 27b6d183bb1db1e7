package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.expression.Expressions;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import io.github.flameyossnowy.universal.aggregates.api.utils.Logging;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.CountBuilder;
import org.jetbrains.annotations.NotNull;

final class CountExpr extends AbstractAggregateBuilder<CountBuilder> implements CountBuilder {
    private static final SqlExpression ALL_ROWS = Expressions.raw("*");

    private final Distinctable distinctable = new Distinctable(expression);

    CountExpr() {
        super(AggregationType.COUNT);
    }

    @Override
    public CountBuilder all() {
        expression.setArgument(ALL_ROWS);
        return this;
    }

    @Override
    public CountBuilder distinct() {
        distinctable.distinct();
        return this;
    }

    /**
     * {@code COUNT(DISTINCT *)} is not valid SQL anywhere; counting all rows ignores DISTINCT.
     */
    @Override
    protected AggregateCall rewrite(@NotNull RenderContext context) {
        AggregateCall call = AggregateCall.of(expression);
        if (call.argument() != ALL_ROWS || !call.distinct()) {
            return call;
        }

        Logging.deepInfo(() -> "DISTINCT ignored for COUNT(*) on " + context.sqlType().getName());
        return call.withDistinct(false);
    }
}
