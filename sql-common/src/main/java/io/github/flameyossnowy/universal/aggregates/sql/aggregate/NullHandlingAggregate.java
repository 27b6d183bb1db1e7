package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

/**
 * IGNORE / RESPECT NULLS. The two are mutually exclusive; the last call wins.
 */
public interface NullHandlingAggregate<B> {
    B ignoreNulls();

    B respectNulls();
}
