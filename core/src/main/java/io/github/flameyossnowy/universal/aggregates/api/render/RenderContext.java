package io.github.flameyossnowy.universal.aggregates.api.render;

import io.github.flameyossnowy.universal.aggregates.api.dialect.DialectDispatcher;
import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * State of one SQL generation pass: the active dialect, the options and the parameters collected so far.
 * A context is not shared between passes.
 */
public final class RenderContext {
    private final SQLType sqlType;
    private final RenderOptions options;
    private final DialectDispatcher dispatcher;
    private final List<Object> params = new ArrayList<>(8);

    public RenderContext(@NotNull SQLType sqlType, @NotNull RenderOptions options) {
        this.sqlType = Objects.requireNonNull(sqlType, "sqlType");
        this.options = Objects.requireNonNull(options, "options");
        this.dispatcher = new DialectDispatcher(sqlType);
    }

    public static @NotNull RenderContext of(@NotNull SQLType sqlType) {
        return new RenderContext(sqlType, RenderOptions.DEFAULT);
    }

    public SQLType sqlType() {
        return sqlType;
    }

    public RenderOptions options() {
        return options;
    }

    public DialectDispatcher dispatcher() {
        return dispatcher;
    }

    public List<Object> params() {
        return Collections.unmodifiableList(params);
    }

    /**
     * Appends a value either as a bound {@code ?} parameter or as an inline literal, depending on the options.
     * {@code null} is always written as {@code NULL}.
     */
    public StringBuilder appendValue(@NotNull StringBuilder sql, @Nullable Object value) {
        if (value != null && options.parameterized()) {
            params.add(value);
            return sql.append('?');
        }
        return appendLiteral(sql, value);
    }

    /**
     * Appends a value as an inline literal regardless of the options, for grammar positions that do not
     * accept bind parameters (MySQL's {@code SEPARATOR}, for one).
     */
    public StringBuilder appendLiteral(@NotNull StringBuilder sql, @Nullable Object value) {
        if (value == null) {
            return sql.append("NULL");
        }
        if (value instanceof Number || value instanceof Boolean) {
            return sql.append(value);
        }
        return sql.append('\'').append(value.toString().replace("'", "''")).append('\'');
    }

    public StringBuilder appendQuoted(@NotNull StringBuilder sql, @NotNull String identifier) {
        char quote = sqlType.quoteChar();
        return sql.append(quote).append(identifier.replace(String.valueOf(quote), String.valueOf(quote) + quote)).append(quote);
    }

    public ParameterizedSql toParameterizedSql(@NotNull StringBuilder sql) {
        return new ParameterizedSql(sql.toString(), params);
    }
}
