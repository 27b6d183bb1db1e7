package io.github.flameyossnowy.universal.aggregates.api.condition;

import io.github.flameyossnowy.universal.aggregates.api.expression.Expressions;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * Collects predicates for FILTER clauses and CASE branches. Predicates added one after another are
 * joined with {@code AND}; {@link #or(Consumer)} opens a parenthesised {@code OR} group.
 *
 * <pre>{@code
 * cb.eq("status", "published").gt("view_count", 80)
 * // status = 'published' AND view_count > 80
 *
 * cb.or(g -> g.eq("status", "draft").eq("status", "review"))
 * // (status = 'draft' OR status = 'review')
 * }</pre>
 */
public final class ConditionBuilder {
    private final List<SqlExpression> predicates = new ArrayList<>(4);

    ConditionBuilder() {}

    /**
     * Runs the callback against a fresh builder and returns the resulting predicate.
     *
     * @throws IllegalStateException when the callback added nothing
     */
    public static @NotNull SqlExpression build(@NotNull Consumer<ConditionBuilder> builder) {
        ConditionBuilder conditions = new ConditionBuilder();
        builder.accept(conditions);
        return conditions.toExpression();
    }

    // ==================== Comparison Operators ====================

    public ConditionBuilder eq(@NotNull String column, @Nullable Object value) {
        if (value == null) {
            return isNull(column);
        }
        return compare(column, "=", value);
    }

    public ConditionBuilder ne(@NotNull String column, @Nullable Object value) {
        if (value == null) {
            return isNotNull(column);
        }
        return compare(column, "!=", value);
    }

    public ConditionBuilder gt(@NotNull String column, @NotNull Object value) {
        return compare(column, ">", value);
    }

    public ConditionBuilder gte(@NotNull String column, @NotNull Object value) {
        return compare(column, ">=", value);
    }

    public ConditionBuilder lt(@NotNull String column, @NotNull Object value) {
        return compare(column, "<", value);
    }

    public ConditionBuilder lte(@NotNull String column, @NotNull Object value) {
        return compare(column, "<=", value);
    }

    public ConditionBuilder like(@NotNull String column, @NotNull String pattern) {
        return compare(column, "LIKE", pattern);
    }

    public ConditionBuilder between(@NotNull String column, @NotNull Object start, @NotNull Object end) {
        predicates.add(Expressions.expr("? BETWEEN ? AND ?", Expressions.column(column), start, end));
        return this;
    }

    public ConditionBuilder in(@NotNull String column, @NotNull Collection<?> values) {
        return membership(column, "IN", values);
    }

    public ConditionBuilder notIn(@NotNull String column, @NotNull Collection<?> values) {
        return membership(column, "NOT IN", values);
    }

    // ==================== Null / Boolean Checks ====================

    public ConditionBuilder isNull(@NotNull String column) {
        predicates.add(Expressions.isNull(Expressions.column(column)));
        return this;
    }

    public ConditionBuilder isNotNull(@NotNull String column) {
        predicates.add(Expressions.isNotNull(Expressions.column(column)));
        return this;
    }

    public ConditionBuilder isTrue(@NotNull String column) {
        predicates.add(Expressions.expr("? IS TRUE", Expressions.column(column)));
        return this;
    }

    public ConditionBuilder isFalse(@NotNull String column) {
        predicates.add(Expressions.expr("? IS FALSE", Expressions.column(column)));
        return this;
    }

    // ==================== Raw Expressions & Grouping ====================

    public ConditionBuilder expr(@NotNull SqlExpression predicate) {
        predicates.add(predicate);
        return this;
    }

    public ConditionBuilder expr(@NotNull String sql, Object... args) {
        predicates.add(Expressions.expr(sql, args));
        return this;
    }

    public ConditionBuilder or(@NotNull Consumer<ConditionBuilder> group) {
        return group(" OR ", group);
    }

    public ConditionBuilder and(@NotNull Consumer<ConditionBuilder> group) {
        return group(" AND ", group);
    }

    @Contract(pure = true)
    public boolean isEmpty() {
        return predicates.isEmpty();
    }

    public @NotNull SqlExpression toExpression() {
        if (predicates.isEmpty()) {
            throw new IllegalStateException("Condition builder produced no predicates");
        }
        if (predicates.size() == 1) {
            return predicates.get(0);
        }
        return new Junction(" AND ", List.copyOf(predicates), false);
    }

    private ConditionBuilder compare(String column, String operator, Object value) {
        predicates.add(Expressions.expr("? " + operator + " ?", Expressions.column(column), value));
        return this;
    }

    private ConditionBuilder membership(String column, String operator, Collection<?> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException(operator + " requires at least one value for column " + column);
        }

        List<Object> items = List.copyOf(values);
        predicates.add((context, sql) -> {
            Expressions.column(column).render(context, sql).append(' ').append(operator).append(" (");
            boolean seen = false;
            for (Object item : items) {
                if (seen) {
                    sql.append(", ");
                } else {
                    seen = true;
                }
                context.appendValue(sql, item);
            }
            return sql.append(')');
        });
        return this;
    }

    private ConditionBuilder group(String joiner, Consumer<ConditionBuilder> group) {
        ConditionBuilder nested = new ConditionBuilder();
        group.accept(nested);
        if (nested.isEmpty()) {
            throw new IllegalStateException("Condition group produced no predicates");
        }
        predicates.add(new Junction(joiner, List.copyOf(nested.predicates), true));
        return this;
    }

    private record Junction(String joiner, List<SqlExpression> parts, boolean parenthesised) implements SqlExpression {
        @Override
        public StringBuilder render(@NotNull RenderContext context, @NotNull StringBuilder sql) {
            if (parenthesised) {
                sql.append('(');
            }

            boolean seen = false;
            for (SqlExpression part : parts) {
                if (seen) {
                    sql.append(joiner);
                } else {
                    seen = true;
                }
                part.render(context, sql);
            }

            return parenthesised ? sql.append(')') : sql;
        }
    }
}
