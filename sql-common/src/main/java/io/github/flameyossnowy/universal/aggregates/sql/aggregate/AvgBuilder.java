package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

public interface AvgBuilder extends BaseAggregate<AvgBuilder>, DistinctableAggregate<AvgBuilder> {
}
