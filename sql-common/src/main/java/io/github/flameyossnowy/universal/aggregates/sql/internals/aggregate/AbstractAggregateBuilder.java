package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.condition.ConditionBuilder;
import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import io.github.flameyossnowy.universal.aggregates.api.exceptions.DialectUnsupportedOperationException;
import io.github.flameyossnowy.universal.aggregates.api.expression.Expressions;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.options.NullsOrder;
import io.github.flameyossnowy.universal.aggregates.api.options.OrderTerm;
import io.github.flameyossnowy.universal.aggregates.api.options.SortOrder;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import io.github.flameyossnowy.universal.aggregates.api.utils.Logging;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.BaseAggregate;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Base of every aggregate builder: argument and filter handling plus the render pipeline
 * (validate, rewrite for the dialect, emit).
 *
 * @param <B> the public builder interface implemented by the subclass
 */
abstract class AbstractAggregateBuilder<B extends BaseAggregate<B>> implements BaseAggregate<B> {
    private static final SqlExpression TRUE_FLAG = Expressions.raw("1");
    private static final SqlExpression FALSE_FLAG = Expressions.raw("0");

    protected final AggregateExpression expression;

    protected AbstractAggregateBuilder(@NotNull AggregationType type) {
        this.expression = new AggregateExpression(type);
    }

    @SuppressWarnings("unchecked")
    protected final B self() {
        return (B) this;
    }

    @Override
    public B column(@NotNull String column) {
        expression.setArgument(Expressions.column(column));
        return self();
    }

    @Override
    public B expr(@NotNull SqlExpression argument) {
        expression.setArgument(Objects.requireNonNull(argument, "argument"));
        return self();
    }

    @Override
    public B expr(@NotNull String sql, Object... args) {
        expression.setArgument(Expressions.expr(sql, args));
        return self();
    }

    @Override
    public B filter(@NotNull Consumer<ConditionBuilder> builder) {
        expression.setFilter(ConditionBuilder.build(builder));
        return self();
    }

    @Override
    public B filter(@NotNull SqlExpression condition) {
        expression.setFilter(Objects.requireNonNull(condition, "condition"));
        return self();
    }

    @Override
    public AggregationType type() {
        return expression.type();
    }

    @Override
    public final StringBuilder render(@NotNull RenderContext context, @NotNull StringBuilder sql) {
        validate(context.sqlType());
        AggregateCall call = rewrite(context);
        Logging.deepInfo(() -> "Resolved " + expression.type() + " as " + call.functionName() + " for " + context.sqlType().getName());
        return AggregateRenderer.render(call, context, sql);
    }

    /**
     * Checks the builder is complete before any SQL is written.
     */
    protected void validate(@NotNull SQLType sqlType) {
        expression.requireArgument(sqlType);
    }

    /**
     * Resolves the call for the dialect being rendered. The default emits the neutral form unchanged.
     */
    protected AggregateCall rewrite(@NotNull RenderContext context) {
        return AggregateCall.of(expression);
    }

    protected final DialectUnsupportedOperationException unsupported(@NotNull SQLType sqlType) {
        return new DialectUnsupportedOperationException("Aggregate has no rendering for this dialect", expression.functionName(), sqlType);
    }

    /**
     * {@code CASE WHEN arg IS NOT NULL THEN arg END}, used where IGNORE NULLS cannot be written as a suffix.
     */
    protected static SqlExpression ignoringNulls(@NotNull SqlExpression argument) {
        return Expressions.caseWhen(cb -> cb.when(Expressions.isNotNull(argument)).then(argument));
    }

    /**
     * {@code CASE WHEN predicate THEN 1 ELSE 0 END}, the 0/1 flag MAX/MIN run over where a bitwise or
     * boolean aggregate is missing.
     */
    protected static SqlExpression asFlag(@NotNull SqlExpression predicate) {
        return Expressions.caseWhen(cb -> cb.when(predicate).then(TRUE_FLAG).otherwise(FALSE_FLAG));
    }

    /**
     * Drops DISTINCT and ORDER BY for targets whose function cannot take them.
     */
    protected final AggregateCall withoutDistinctOrOrdering(@NotNull AggregateCall call, @NotNull RenderContext context) {
        if (!call.distinct() && call.orderBy().isEmpty()) {
            return call;
        }

        String message = "DISTINCT/ORDER BY dropped from " + expression.type() + " on " + context.sqlType().getName()
            + ", " + call.functionName() + " does not support them";
        if (context.options().warnOnDegradation()) {
            Logging.warn(message);
        } else {
            Logging.deepInfo(() -> message);
        }
        return call.withDistinct(false).withOrderBy(List.of());
    }

    /**
     * Rewrites {@code NULLS FIRST|LAST} into a leading {@code expr IS NULL} sort key for targets whose
     * ORDER BY has no null placement (MySQL): {@code x DESC NULLS LAST} becomes
     * {@code x IS NULL ASC, x DESC}.
     */
    protected final AggregateCall withEmulatedNullsOrdering(@NotNull AggregateCall call, @NotNull RenderContext context) {
        if (call.orderBy().stream().allMatch(term -> term.nulls() == NullsOrder.DEFAULT)) {
            return call;
        }

        List<OrderTerm> terms = new ArrayList<>(call.orderBy().size() + 1);
        for (OrderTerm term : call.orderBy()) {
            if (term.nulls() != NullsOrder.DEFAULT) {
                SortOrder nullsKey = term.nulls() == NullsOrder.LAST ? SortOrder.ASCENDING : SortOrder.DESCENDING;
                terms.add(new OrderTerm(Expressions.isNull(term.expression()), nullsKey, NullsOrder.DEFAULT));
                terms.add(new OrderTerm(term.expression(), term.order(), NullsOrder.DEFAULT));
            } else {
                terms.add(term);
            }
        }

        Logging.deepInfo(() -> "Emulating NULLS FIRST/LAST for " + call.functionName() + " on " + context.sqlType().getName());
        return call.withOrderBy(terms);
    }
}
