package io.github.flameyossnowy.universal.aggregates.api.dialect;

import io.github.flameyossnowy.universal.aggregates.api.exceptions.DialectUnsupportedOperationException;
import io.github.flameyossnowy.universal.aggregates.api.expression.Expressions;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs exactly one dialect handler for the dialect it is bound to, falling back to the default handler.
 */
public final class DialectDispatcher {
    private final SQLType sqlType;

    public DialectDispatcher(@NotNull SQLType sqlType) {
        this.sqlType = Objects.requireNonNull(sqlType, "sqlType");
    }

    public SQLType sqlType() {
        return sqlType;
    }

    /**
     * Runs the matching action. Without a match and without a default this is a no-op.
     */
    public void run(@NotNull DialectActions actions) {
        Runnable handler = actions.handlerFor(sqlType);
        if (handler != null) {
            handler.run();
        }
    }

    /**
     * Runs the matching function and returns its value.
     *
     * @throws DialectUnsupportedOperationException when neither a matching nor a default handler exists
     */
    public <R> R apply(@NotNull DialectFunctions<R> functions) {
        Supplier<R> handler = functions.handlerFor(sqlType);
        if (handler == null) {
            throw new DialectUnsupportedOperationException("No handler registered for dialect", null, sqlType);
        }
        return handler.get();
    }

    /**
     * Picks the expression for this dialect, or the SQL {@code NULL} literal when nothing matches.
     */
    public @NotNull SqlExpression select(@NotNull DialectFunctions<SqlExpression> functions) {
        Supplier<SqlExpression> handler = functions.handlerFor(sqlType);
        return handler != null ? handler.get() : Expressions.nullValue();
    }
}
