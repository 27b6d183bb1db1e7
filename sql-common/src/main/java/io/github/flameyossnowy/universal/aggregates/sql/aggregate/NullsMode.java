package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

/**
 * NULL treatment of an aggregate. {@link #DEFAULT} and {@link #RESPECT} keep NULL inputs, {@link #IGNORE}
 * guards the argument so NULLs never reach the aggregate. No dialect takes an {@code IGNORE NULLS} suffix
 * on the aggregates that support this mode, so none is emitted.
 */
public enum NullsMode {
    DEFAULT,
    RESPECT,
    IGNORE
}
