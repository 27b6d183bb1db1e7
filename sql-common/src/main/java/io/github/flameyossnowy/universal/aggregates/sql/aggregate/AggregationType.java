package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

/**
 * Aggregate families the compiler can emit. The constant name is the neutral SQL function name;
 * dialect rewrites may emit a different one.
 */
public enum AggregationType {
    // Basic aggregations
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX,

    // String aggregations
    STRING_AGG,      // STRING_AGG (PostgreSQL), GROUP_CONCAT (MySQL, SQLite)

    // Array/JSON aggregations
    ARRAY_AGG,       // ARRAY_AGG (PostgreSQL), JSON_ARRAYAGG (MySQL), JSON_GROUP_ARRAY (SQLite)
    JSON_OBJECT_AGG, // JSON_OBJECT_AGG (PostgreSQL), JSON_OBJECTAGG (MySQL), JSON_GROUP_OBJECT (SQLite)
    JSON_ARRAY_AGG,  // JSON_AGG (PostgreSQL), JSON_ARRAYAGG (MySQL), JSON_GROUP_ARRAY (SQLite)

    // Bitwise / boolean
    BIT_OR,
    BIT_AND,
    BOOL_OR,
    BOOL_AND,

    // Statistical
    STDDEV,
    VARIANCE;

    public String functionName() {
        return name();
    }
}
