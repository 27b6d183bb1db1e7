package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

public interface CountBuilder extends BaseAggregate<CountBuilder>, DistinctableAggregate<CountBuilder> {
    /**
     * COUNT(*) semantics.
     */
    CountBuilder all();
}
