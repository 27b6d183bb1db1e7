package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.MaxBuilder;

final class MaxExpr extends AbstractAggregateBuilder<MaxBuilder> implements MaxBuilder {
    MaxExpr() {
        super(AggregationType.MAX);
    }
}
