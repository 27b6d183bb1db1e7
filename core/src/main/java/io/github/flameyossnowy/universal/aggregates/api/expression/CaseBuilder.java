package io.github.flameyossnowy.universal.aggregates.api.expression;

import io.github.flameyossnowy.universal.aggregates.api.condition.ConditionBuilder;
import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Builds searched ({@code CASE WHEN cond THEN ...}) and simple ({@code CASE subject WHEN value THEN ...})
 * CASE expressions.
 *
 * <pre>{@code
 * Expressions.caseWhen(cb -> cb
 *     .when(c -> c.eq("status", "published")).then(Expressions.raw("1"))
 *     .otherwise(Expressions.raw("0")));
 * }</pre>
 */
public interface CaseBuilder {
    /**
     * Turns this into a simple CASE over the given subject.
     */
    CaseBuilder subject(@NotNull SqlExpression subject);

    CaseBuilder subjectColumn(@NotNull String column);

    CaseWhenBuilder when(@NotNull SqlExpression condition);

    CaseWhenBuilder when(@NotNull Consumer<ConditionBuilder> condition);

    /**
     * Sets the ELSE branch. {@link SqlExpression}s are rendered in place, other values become literals.
     */
    CaseBuilder otherwise(Object value);

    interface CaseWhenBuilder {
        CaseBuilder then(Object value);
    }
}
