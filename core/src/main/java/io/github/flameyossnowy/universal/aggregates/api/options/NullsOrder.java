package io.github.flameyossnowy.universal.aggregates.api.options;

/**
 * Placement of NULLs inside an ORDER BY term. {@link #DEFAULT} leaves it to the engine.
 */
public enum NullsOrder {
    DEFAULT(""),
    FIRST("NULLS FIRST"),
    LAST("NULLS LAST");

    private final String sql;

    NullsOrder(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }
}
