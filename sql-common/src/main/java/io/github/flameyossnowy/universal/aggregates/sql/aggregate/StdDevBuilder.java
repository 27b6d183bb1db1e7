package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

public interface StdDevBuilder extends BaseAggregate<StdDevBuilder>, StatisticalAggregate<StdDevBuilder> {
}
