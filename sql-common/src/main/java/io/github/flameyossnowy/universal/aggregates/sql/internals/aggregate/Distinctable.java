package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

/**
 * DISTINCT capability. Writes only the distinct flag of the expression it is attached to.
 */
final class Distinctable {
    private final AggregateExpression expression;

    Distinctable(AggregateExpression expression) {
        this.expression = expression;
    }

    void distinct() {
        expression.setDistinct(true);
    }
}
