package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.sql.aggregate.StatisticalMode;

final class Statistical {
    private final AggregateExpression expression;

    Statistical(AggregateExpression expression) {
        this.expression = expression;
    }

    void population() {
        expression.setStatisticalMode(StatisticalMode.POPULATION);
    }

    void sample() {
        expression.setStatisticalMode(StatisticalMode.SAMPLE);
    }
}
