package io.github.flameyossnowy.universal.aggregates.api.expression;

import io.github.flameyossnowy.universal.aggregates.api.condition.ConditionBuilder;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

final class CaseExpression implements CaseBuilder, SqlExpression {
    private final List<WhenClause> clauses = new ArrayList<>(2);
    private SqlExpression subject;
    private SqlExpression otherwise;

    private record WhenClause(SqlExpression when, SqlExpression then) {}

    @Override
    public CaseBuilder subject(@NotNull SqlExpression subject) {
        this.subject = subject;
        return this;
    }

    @Override
    public CaseBuilder subjectColumn(@NotNull String column) {
        this.subject = Expressions.column(column);
        return this;
    }

    @Override
    public CaseWhenBuilder when(@NotNull SqlExpression condition) {
        return value -> {
            clauses.add(new WhenClause(condition, Expressions.valueOf(value)));
            return this;
        };
    }

    @Override
    public CaseWhenBuilder when(@NotNull Consumer<ConditionBuilder> condition) {
        return when(ConditionBuilder.build(condition));
    }

    @Override
    public CaseBuilder otherwise(Object value) {
        this.otherwise = Expressions.valueOf(value);
        return this;
    }

    @Override
    public StringBuilder render(@NotNull RenderContext context, @NotNull StringBuilder sql) {
        if (clauses.isEmpty()) {
            throw new IllegalStateException("CASE expression requires at least one WHEN clause");
        }

        sql.append("CASE");
        if (subject != null) {
            sql.append(' ');
            subject.render(context, sql);
        }

        for (WhenClause clause : clauses) {
            sql.append(" WHEN ");
            clause.when().render(context, sql);
            sql.append(" THEN ");
            clause.then().render(context, sql);
        }

        if (otherwise != null) {
            sql.append(" ELSE ");
            otherwise.render(context, sql);
        }

        return sql.append(" END");
    }
}
