package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.sql.aggregate.NullsMode;

final class NullHandling {
    private final AggregateExpression expression;

    NullHandling(AggregateExpression expression) {
        this.expression = expression;
    }

    void ignoreNulls() {
        expression.setNullsMode(NullsMode.IGNORE);
    }

    void respectNulls() {
        expression.setNullsMode(NullsMode.RESPECT);
    }
}
