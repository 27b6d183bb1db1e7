package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

public interface JsonArrayAggBuilder extends BaseAggregate<JsonArrayAggBuilder>,
    DistinctableAggregate<JsonArrayAggBuilder>,
    OrderableAggregate<JsonArrayAggBuilder> {
}
