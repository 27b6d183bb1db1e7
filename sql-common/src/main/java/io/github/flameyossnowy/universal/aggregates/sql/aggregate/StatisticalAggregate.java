package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

/**
 * Population / sample selection for statistical aggregates. The last call wins; without a call the
 * dialect default applies.
 */
public interface StatisticalAggregate<B> {
    B population();

    B sample();
}
