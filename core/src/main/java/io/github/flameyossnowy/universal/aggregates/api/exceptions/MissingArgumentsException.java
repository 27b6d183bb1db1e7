package io.github.flameyossnowy.universal.aggregates.api.exceptions;

import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import org.jetbrains.annotations.Nullable;

/**
 * A required aggregate argument (or the key of a JSON object aggregation) was never set.
 */
public class MissingArgumentsException extends AggregateRenderException {
    public MissingArgumentsException(String message, @Nullable String functionName, @Nullable SQLType sqlType) {
        super(message, functionName, sqlType);
    }
}
