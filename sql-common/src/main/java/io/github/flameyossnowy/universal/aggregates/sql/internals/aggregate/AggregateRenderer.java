package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.expression.Expressions;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.options.OrderByClause;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import io.github.flameyossnowy.universal.aggregates.api.utils.Logging;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import org.jetbrains.annotations.NotNull;

/**
 * Turns an {@link AggregateCall} into SQL text.
 *
 * <p>Native form: {@code NAME([DISTINCT ]args[ ORDER BY ...][ trailer])[ FILTER (WHERE cond)]}.
 * Dialects without FILTER get the condition folded into the argument instead:</p>
 * <pre>{@code
 * COUNT(x) FILTER (WHERE c)  ->  SUM(CASE WHEN c THEN 1 ELSE 0 END)
 * SUM(x)   FILTER (WHERE c)  ->  SUM(CASE WHEN c THEN x ELSE 0 END)
 * F(x)     FILTER (WHERE c)  ->  F(CASE WHEN c THEN x ELSE NULL END)
 * }</pre>
 */
final class AggregateRenderer {
    private static final SqlExpression ONE = Expressions.raw("1");
    private static final SqlExpression ZERO = Expressions.raw("0");

    private static final String COUNT = AggregationType.COUNT.functionName();
    private static final String SUM = AggregationType.SUM.functionName();

    private AggregateRenderer() {}

    static StringBuilder render(@NotNull AggregateCall call, @NotNull RenderContext context, @NotNull StringBuilder sql) {
        if (call.filter() != null && !context.sqlType().supportsFilterClause()) {
            return renderEmulatedFilter(call, context, sql);
        }

        sql.append(call.functionName()).append('(');
        appendArguments(call, call.argument(), context, sql);
        sql.append(')');

        if (call.filter() != null) {
            sql.append(" FILTER (WHERE ");
            call.filter().render(context, sql);
            sql.append(')');
        }
        return sql;
    }

    private static StringBuilder renderEmulatedFilter(AggregateCall call, RenderContext context, StringBuilder sql) {
        String name = call.functionName();

        // COUNT DISTINCT keeps counting distinct values, NULL rows are skipped by COUNT itself
        boolean countRows = COUNT.equals(name) && !call.distinct();
        SqlExpression whenMatched = countRows ? ONE : call.argument();
        SqlExpression otherwise = countRows || SUM.equals(name) ? ZERO : Expressions.nullValue();
        SqlExpression filter = call.filter();

        Logging.deepInfo(() -> "Emulating FILTER for " + name + " on " + context.sqlType().getName());

        SqlExpression wrapped = Expressions.caseWhen(cb -> cb.when(filter).then(whenMatched).otherwise(otherwise));
        sql.append(countRows ? SUM : name).append('(');
        appendArguments(call, wrapped, context, sql);
        sql.append(')');
        return sql;
    }

    private static void appendArguments(AggregateCall call, SqlExpression argument, RenderContext context, StringBuilder sql) {
        if (call.distinct()) {
            sql.append("DISTINCT ");
        }

        for (SqlExpression leading : call.leadingArguments()) {
            leading.render(context, sql).append(", ");
        }

        argument.render(context, sql);

        for (SqlExpression trailing : call.trailingArguments()) {
            sql.append(", ");
            trailing.render(context, sql);
        }

        if (!call.orderBy().isEmpty()) {
            sql.append(' ');
            new OrderByClause(call.orderBy()).render(context, sql);
        }

        if (call.trailer() != null) {
            sql.append(' ');
            call.trailer().render(context, sql);
        }
    }
}
