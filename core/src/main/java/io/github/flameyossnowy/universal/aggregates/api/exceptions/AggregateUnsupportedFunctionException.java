package io.github.flameyossnowy.universal.aggregates.api.exceptions;

import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import org.jetbrains.annotations.Nullable;

/**
 * A known limitation: the aggregate family has no rewrite path on the dialect, for example
 * STDDEV on SQLite. No approximation is attempted.
 */
public class AggregateUnsupportedFunctionException extends AggregateRenderException {
    public AggregateUnsupportedFunctionException(String message, @Nullable String functionName, @Nullable SQLType sqlType) {
        super(message, functionName, sqlType);
    }
}
