package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

public interface MaxBuilder extends BaseAggregate<MaxBuilder> {
}
