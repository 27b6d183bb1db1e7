package io.github.flameyossnowy.universal.aggregates.api.dialect;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.EnumMap;
import java.util.Map;

/**
 * Side-effect callbacks keyed by dialect, run through {@link DialectDispatcher#run(DialectActions)}.
 *
 * <pre>{@code
 * dispatcher.run(DialectActions.builder()
 *     .mysql(() -> emulate = true)
 *     .orElse(() -> emulate = false)
 *     .build());
 * }</pre>
 */
public final class DialectActions {
    private final Map<SQLType, Runnable> handlers;
    private final Runnable fallback;

    private DialectActions(Map<SQLType, Runnable> handlers, Runnable fallback) {
        this.handlers = handlers;
        this.fallback = fallback;
    }

    @Contract(value = " -> new", pure = true)
    public static @NotNull Builder builder() {
        return new Builder();
    }

    /**
     * The handler registered for the dialect, otherwise the default handler, otherwise {@code null}.
     */
    public @Nullable Runnable handlerFor(@NotNull SQLType sqlType) {
        Runnable handler = handlers.get(sqlType);
        return handler != null ? handler : fallback;
    }

    public static final class Builder {
        private final Map<SQLType, Runnable> handlers = new EnumMap<>(SQLType.class);
        private Runnable fallback;

        private Builder() {}

        public Builder postgres(@NotNull Runnable action) {
            return on(SQLType.POSTGRESQL, action);
        }

        public Builder mysql(@NotNull Runnable action) {
            return on(SQLType.MYSQL, action);
        }

        public Builder sqlite(@NotNull Runnable action) {
            return on(SQLType.SQLITE, action);
        }

        public Builder oracle(@NotNull Runnable action) {
            return on(SQLType.ORACLE, action);
        }

        public Builder sqlServer(@NotNull Runnable action) {
            return on(SQLType.SQL_SERVER, action);
        }

        public Builder on(@NotNull SQLType sqlType, @NotNull Runnable action) {
            handlers.put(sqlType, action);
            return this;
        }

        public Builder orElse(@NotNull Runnable action) {
            this.fallback = action;
            return this;
        }

        public DialectActions build() {
            return new DialectActions(new EnumMap<>(handlers), fallback);
        }
    }
}
