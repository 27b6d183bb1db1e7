package io.github.flameyossnowy.universal.aggregates.api.dialect;

import io.github.flameyossnowy.universal.aggregates.api.DatabaseImplementation;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;

public enum SQLType implements DatabaseImplementation {
    MYSQL("MySQL", '`', false),
    SQLITE("SQLite", '"', true),
    POSTGRESQL("PostgreSQL", '"', true),
    ORACLE("Oracle", '"', false),
    SQL_SERVER("SQL Server", '"', false);

    private final String name;
    private final char quotesChar;
    private final boolean supportsFilterClause;

    SQLType(String name, char quotesChar, boolean supportsFilterClause) {
        this.name = name;
        this.quotesChar = quotesChar;
        this.supportsFilterClause = supportsFilterClause;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public char quoteChar() {
        return quotesChar;
    }

    @Override
    public boolean supportsFilterClause() {
        return supportsFilterClause;
    }

    /**
     * Resolve a dialect from a configuration value such as {@code "postgres"} or {@code "MySQL"}.
     */
    public static @NotNull SQLType fromName(@NotNull String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "").replace(" ", "");
        return switch (normalized) {
            case "mysql", "mariadb" -> MYSQL;
            case "sqlite", "sqlite3" -> SQLITE;
            case "postgresql", "postgres", "pg", "pgsql" -> POSTGRESQL;
            case "oracle" -> ORACLE;
            case "sqlserver", "mssql" -> SQL_SERVER;
            default -> throw new IllegalArgumentException("Unknown SQL dialect: " + value);
        };
    }
}
