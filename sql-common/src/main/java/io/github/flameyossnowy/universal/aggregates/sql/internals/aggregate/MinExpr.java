package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.MinBuilder;

final class MinExpr extends AbstractAggregateBuilder<MinBuilder> implements MinBuilder {
    MinExpr() {
        super(AggregationType.MIN);
    }
}
