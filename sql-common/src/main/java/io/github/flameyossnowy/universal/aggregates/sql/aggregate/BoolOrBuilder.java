package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

public interface BoolOrBuilder extends BaseAggregate<BoolOrBuilder> {
}
