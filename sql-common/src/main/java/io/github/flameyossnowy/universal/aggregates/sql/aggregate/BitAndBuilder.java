package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

public interface BitAndBuilder extends BaseAggregate<BitAndBuilder> {
}
