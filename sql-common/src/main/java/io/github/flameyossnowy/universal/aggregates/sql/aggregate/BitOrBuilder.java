package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

/**
 * BIT_OR. SQLite has no bitwise aggregate and gets a 0/1 emulation, so only use it there for flag columns.
 */
public interface BitOrBuilder extends BaseAggregate<BitOrBuilder> {
}
