package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.StdDevBuilder;

final class StdDevExpr extends StatisticalAggExpr<StdDevBuilder> implements StdDevBuilder {
    StdDevExpr() {
        super(AggregationType.STDDEV, "STDDEV");
    }
}
