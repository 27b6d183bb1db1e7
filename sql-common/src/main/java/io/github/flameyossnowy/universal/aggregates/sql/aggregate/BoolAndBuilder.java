package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

public interface BoolAndBuilder extends BaseAggregate<BoolAndBuilder> {
}
