package io.github.flameyossnowy.universal.aggregates.api.options;

public enum SortOrder {
    ASCENDING("ASC"),
    DESCENDING("DESC");

    private final String sql;

    SortOrder(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }
}
