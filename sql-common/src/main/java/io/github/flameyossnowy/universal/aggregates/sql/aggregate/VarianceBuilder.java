package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

public interface VarianceBuilder extends BaseAggregate<VarianceBuilder>, StatisticalAggregate<VarianceBuilder> {
}
