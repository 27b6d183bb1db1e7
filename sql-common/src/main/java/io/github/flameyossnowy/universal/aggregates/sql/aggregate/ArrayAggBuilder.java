package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

/**
 * ARRAY_AGG. MySQL and SQLite aggregate into a JSON array and cannot honour DISTINCT or ORDER BY there;
 * both are dropped for those dialects.
 */
public interface ArrayAggBuilder extends BaseAggregate<ArrayAggBuilder>,
    DistinctableAggregate<ArrayAggBuilder>,
    OrderableAggregate<ArrayAggBuilder>,
    NullHandlingAggregate<ArrayAggBuilder> {
}
