package io.github.flameyossnowy.universal.aggregates.api.exceptions;

import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import org.jetbrains.annotations.Nullable;

/**
 * Base class for failures raised while turning an aggregate expression into SQL text.
 */
public class AggregateRenderException extends RuntimeException {
    private final String functionName;
    private final SQLType sqlType;

    public AggregateRenderException(String message, @Nullable String functionName, @Nullable SQLType sqlType) {
        super(describe(message, functionName, sqlType));
        this.functionName = functionName;
        this.sqlType = sqlType;
    }

    public AggregateRenderException(String message, Throwable cause, @Nullable String functionName, @Nullable SQLType sqlType) {
        super(describe(message, functionName, sqlType), cause);
        this.functionName = functionName;
        this.sqlType = sqlType;
    }

    public @Nullable String getFunctionName() {
        return functionName;
    }

    public @Nullable SQLType getSqlType() {
        return sqlType;
    }

    private static String describe(String message, String functionName, SQLType sqlType) {
        if (functionName == null && sqlType == null) {
            return message;
        }

        StringBuilder out = new StringBuilder(message).append(" (");
        if (functionName != null) {
            out.append("function=").append(functionName);
        }
        if (sqlType != null) {
            if (functionName != null) {
                out.append(", ");
            }
            out.append("dialect=").append(sqlType.getName());
        }
        return out.append(')').toString();
    }
}
