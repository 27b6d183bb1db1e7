package io.github.flameyossnowy.universal.aggregates.api.exceptions;

import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import org.jetbrains.annotations.Nullable;

/**
 * The active dialect has no handler for an operation, usually an aggregate family used on an engine
 * that cannot express it at all.
 */
public class DialectUnsupportedOperationException extends AggregateRenderException {
    public DialectUnsupportedOperationException(String message, @Nullable String functionName, @Nullable SQLType sqlType) {
        super(message, functionName, sqlType);
    }
}
