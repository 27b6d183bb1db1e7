package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AvgBuilder;

final class AvgExpr extends AbstractAggregateBuilder<AvgBuilder> implements AvgBuilder {
    private final Distinctable distinctable = new Distinctable(expression);

    AvgExpr() {
        super(AggregationType.AVG);
    }

    @Override
    public AvgBuilder distinct() {
        distinctable.distinct();
        return this;
    }
}
