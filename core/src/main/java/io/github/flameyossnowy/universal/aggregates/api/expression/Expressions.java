package io.github.flameyossnowy.universal.aggregates.api.expression;

import io.github.flameyossnowy.universal.aggregates.api.dialect.DialectFunctions;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Consumer;

/**
 * Factory for the expression fragments aggregates embed: columns, raw SQL, tuples, CASE and null checks.
 *
 * <pre>{@code
 * Expressions.column("view_count")                       // view_count
 * Expressions.expr("COALESCE(?, 0)", column("score"))    // COALESCE(score, 0)
 * Expressions.exprs(column("k"), column("v"))            // k, v
 * Expressions.isNotNull(column("title"))                 // title IS NOT NULL
 * }</pre>
 */
public final class Expressions {
    private Expressions() {}

    @Contract("_ -> new")
    public static @NotNull SqlExpression column(@NotNull String name) {
        return new ColumnExpression(name, false);
    }

    /**
     * A column reference wrapped in the active dialect's identifier quotes.
     */
    @Contract("_ -> new")
    public static @NotNull SqlExpression quotedColumn(@NotNull String name) {
        return new ColumnExpression(name, true);
    }

    @Contract("_, _ -> new")
    public static @NotNull SqlExpression expr(@NotNull String sql, Object... args) {
        return new RawExpression(sql, args);
    }

    /**
     * SQL written verbatim, never parameterized. Used for fixed tokens such as {@code *} or {@code 1}.
     */
    public static @NotNull SqlExpression raw(@NotNull String sql) {
        return (context, out) -> out.append(sql);
    }

    public static @NotNull SqlExpression exprs(@NotNull SqlExpression... expressions) {
        return new ExpressionList(", ", List.of(expressions));
    }

    public static @NotNull SqlExpression exprsWithSeparator(@NotNull String separator, @NotNull SqlExpression... expressions) {
        return new ExpressionList(separator, List.of(expressions));
    }

    public static @NotNull SqlExpression caseWhen(@NotNull Consumer<CaseBuilder> builder) {
        CaseExpression expression = new CaseExpression();
        builder.accept(expression);
        return expression;
    }

    public static @NotNull SqlExpression isNull(@NotNull SqlExpression expression) {
        return expr("? IS NULL", expression);
    }

    public static @NotNull SqlExpression isNotNull(@NotNull SqlExpression expression) {
        return expr("? IS NOT NULL", expression);
    }

    public static @NotNull SqlExpression nullValue() {
        return Literal.NULL;
    }

    public static @NotNull SqlExpression literal(@Nullable Object value) {
        return new Literal(value, false);
    }

    public static @NotNull SqlExpression inlineLiteral(@Nullable Object value) {
        return new Literal(value, true);
    }

    public static @NotNull SqlExpression as(@NotNull SqlExpression expression, @NotNull String alias) {
        return new AliasedExpression(expression, alias);
    }

    /**
     * Picks the expression for the dialect being rendered. Without a matching or default handler the
     * expression renders as {@code NULL}.
     */
    public static @NotNull SqlExpression byDialect(@NotNull DialectFunctions<SqlExpression> functions) {
        return (RenderContext context, StringBuilder sql) -> context.dispatcher().select(functions).render(context, sql);
    }

    static @NotNull SqlExpression valueOf(@Nullable Object value) {
        return value instanceof SqlExpression expression ? expression : literal(value);
    }
}
