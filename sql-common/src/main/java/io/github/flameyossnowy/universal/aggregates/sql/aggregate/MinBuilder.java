package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

public interface MinBuilder extends BaseAggregate<MinBuilder> {
}
