package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.VarianceBuilder;

final class VarianceExpr extends StatisticalAggExpr<VarianceBuilder> implements VarianceBuilder {
    VarianceExpr() {
        super(AggregationType.VARIANCE, "VAR");
    }
}
