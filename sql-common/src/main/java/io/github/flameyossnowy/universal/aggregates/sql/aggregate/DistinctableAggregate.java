package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

public interface DistinctableAggregate<B> {
    /**
     * Aggregates DISTINCT values only. Calling it again has no further effect.
     */
    B distinct();
}
