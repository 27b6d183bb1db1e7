package io.github.flameyossnowy.universal.aggregates.api;

/**
 * Describes the grammar traits of a database engine that matter when emitting
 * aggregate expressions.
 */
public interface DatabaseImplementation {
    String getName();

    char quoteChar();

    /**
     * Whether the engine accepts the SQL standard {@code agg(...) FILTER (WHERE ...)} clause.
     * Engines without it get a CASE based rewrite instead.
     */
    boolean supportsFilterClause();
}
