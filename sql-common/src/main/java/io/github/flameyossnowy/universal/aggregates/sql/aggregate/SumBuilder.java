package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

public interface SumBuilder extends BaseAggregate<SumBuilder>, DistinctableAggregate<SumBuilder> {
}
