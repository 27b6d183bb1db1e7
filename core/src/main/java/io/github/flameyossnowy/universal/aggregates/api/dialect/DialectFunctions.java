package io.github.flameyossnowy.universal.aggregates.api.dialect;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Value-producing callbacks keyed by dialect. A handler reports failure by throwing; the exception
 * leaves {@link DialectDispatcher#apply(DialectFunctions)} unchanged.
 *
 * <pre>{@code
 * String name = dispatcher.apply(DialectFunctions.<String>builder()
 *     .postgres(() -> "STRING_AGG")
 *     .mysql(() -> "GROUP_CONCAT")
 *     .sqlite(() -> "GROUP_CONCAT")
 *     .build());
 * }</pre>
 *
 * @param <R> the produced value
 */
public final class DialectFunctions<R> {
    private final Map<SQLType, Supplier<R>> handlers;
    private final Supplier<R> fallback;

    private DialectFunctions(Map<SQLType, Supplier<R>> handlers, Supplier<R> fallback) {
        this.handlers = handlers;
        this.fallback = fallback;
    }

    @Contract(value = " -> new", pure = true)
    public static <R> @NotNull Builder<R> builder() {
        return new Builder<>();
    }

    public @Nullable Supplier<R> handlerFor(@NotNull SQLType sqlType) {
        Supplier<R> handler = handlers.get(sqlType);
        return handler != null ? handler : fallback;
    }

    public static final class Builder<R> {
        private final Map<SQLType, Supplier<R>> handlers = new EnumMap<>(SQLType.class);
        private Supplier<R> fallback;

        private Builder() {}

        public Builder<R> postgres(@NotNull Supplier<R> function) {
            return on(SQLType.POSTGRESQL, function);
        }

        public Builder<R> mysql(@NotNull Supplier<R> function) {
            return on(SQLType.MYSQL, function);
        }

        public Builder<R> sqlite(@NotNull Supplier<R> function) {
            return on(SQLType.SQLITE, function);
        }

        public Builder<R> oracle(@NotNull Supplier<R> function) {
            return on(SQLType.ORACLE, function);
        }

        public Builder<R> sqlServer(@NotNull Supplier<R> function) {
            return on(SQLType.SQL_SERVER, function);
        }

        public Builder<R> on(@NotNull SQLType sqlType, @NotNull Supplier<R> function) {
            handlers.put(sqlType, function);
            return this;
        }

        public Builder<R> orElse(@NotNull Supplier<R> function) {
            this.fallback = function;
            return this;
        }

        public DialectFunctions<R> build() {
            return new DialectFunctions<>(new EnumMap<>(handlers), fallback);
        }
    }
}
