package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.SumBuilder;

final class SumExpr extends AbstractAggregateBuilder<SumBuilder> implements SumBuilder {
    private final Distinctable distinctable = new Distinctable(expression);

    SumExpr() {
        super(AggregationType.SUM);
    }

    @Override
    public SumBuilder distinct() {
        distinctable.distinct();
        return this;
    }
}
