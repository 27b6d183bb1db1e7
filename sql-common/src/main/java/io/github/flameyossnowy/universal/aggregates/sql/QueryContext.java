package io.github.flameyossnowy.universal.aggregates.sql;

import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderOptions;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Dialect and render options of the query an aggregate is being built for.
 *
 * <pre>{@code
 * QueryContext context = QueryContext.builder(SQLType.MYSQL)
 *     .withOptions(RenderOptions.PARAMETERIZED)
 *     .build();
 * }</pre>
 */
public record QueryContext(SQLType sqlType, RenderOptions options) {
    public QueryContext {
        Objects.requireNonNull(sqlType, "sqlType");
        Objects.requireNonNull(options, "options");
    }

    @Contract("_ -> new")
    public static @NotNull QueryContext of(@NotNull SQLType sqlType) {
        return new QueryContext(sqlType, RenderOptions.DEFAULT);
    }

    @Contract("_ -> new")
    public static @NotNull Builder builder(@NotNull SQLType sqlType) {
        return new Builder(sqlType);
    }

    /**
     * A fresh context for one render pass. Contexts collect parameters and must not be shared.
     */
    public @NotNull RenderContext newRenderContext() {
        return new RenderContext(sqlType, options);
    }

    public static final class Builder {
        private SQLType sqlType;
        private RenderOptions options = RenderOptions.DEFAULT;

        private Builder(SQLType sqlType) {
            this.sqlType = sqlType;
        }

        public Builder withSqlType(@NotNull SQLType sqlType) {
            this.sqlType = sqlType;
            return this;
        }

        public Builder withOptions(@NotNull RenderOptions options) {
            this.options = options;
            return this;
        }

        public QueryContext build() {
            return new QueryContext(sqlType, options);
        }
    }
}
