package io.github.flameyossnowy.universal.aggregates.sql;

import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import io.github.flameyossnowy.universal.aggregates.api.expression.Expressions;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.render.ParameterizedSql;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import io.github.flameyossnowy.universal.aggregates.api.utils.Logging;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.*;
import io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate.AggregateBuilders;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Builds aggregate expressions for one query and renders them for its dialect.
 *
 * <pre>{@code
 * AggregateFunctions fn = new AggregateFunctions(QueryContext.of(SQLType.MYSQL));
 *
 * ParameterizedSql sql = fn.render(fn.count(cb -> cb.all().filter(c -> c.eq("status", "published"))));
 * // SUM(CASE WHEN status = 'published' THEN 1 ELSE 0 END)
 * }</pre>
 *
 * <p>Builders are single-threaded while being configured; a finished builder may be rendered any number
 * of times and always yields the same SQL.</p>
 */
public final class AggregateFunctions {
    private final QueryContext context;

    public AggregateFunctions(@NotNull QueryContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    @Contract("_ -> new")
    public static @NotNull AggregateFunctions of(@NotNull SQLType sqlType) {
        return new AggregateFunctions(QueryContext.of(sqlType));
    }

    public QueryContext context() {
        return context;
    }

    // ==================== Builders ====================

    public CountBuilder count() {
        return AggregateBuilders.count();
    }

    public SumBuilder sum() {
        return AggregateBuilders.sum();
    }

    public AvgBuilder avg() {
        return AggregateBuilders.avg();
    }

    public MinBuilder min() {
        return AggregateBuilders.min();
    }

    public MaxBuilder max() {
        return AggregateBuilders.max();
    }

    public StringAggBuilder stringAgg() {
        return AggregateBuilders.stringAgg();
    }

    public ArrayAggBuilder arrayAgg() {
        return AggregateBuilders.arrayAgg();
    }

    public JsonObjectAggBuilder jsonObjectAgg() {
        return AggregateBuilders.jsonObjectAgg();
    }

    public JsonArrayAggBuilder jsonArrayAgg() {
        return AggregateBuilders.jsonArrayAgg();
    }

    public BitOrBuilder bitOr() {
        return AggregateBuilders.bitOr();
    }

    public BitAndBuilder bitAnd() {
        return AggregateBuilders.bitAnd();
    }

    public BoolOrBuilder boolOr() {
        return AggregateBuilders.boolOr();
    }

    public BoolAndBuilder boolAnd() {
        return AggregateBuilders.boolAnd();
    }

    public StdDevBuilder stdDev() {
        return AggregateBuilders.stdDev();
    }

    public VarianceBuilder variance() {
        return AggregateBuilders.variance();
    }

    // ==================== Callback forms ====================

    public SqlExpression count(@NotNull Consumer<CountBuilder> builder) {
        return configure(count(), builder);
    }

    public SqlExpression sum(@NotNull Consumer<SumBuilder> builder) {
        return configure(sum(), builder);
    }

    public SqlExpression avg(@NotNull Consumer<AvgBuilder> builder) {
        return configure(avg(), builder);
    }

    public SqlExpression min(@NotNull Consumer<MinBuilder> builder) {
        return configure(min(), builder);
    }

    public SqlExpression max(@NotNull Consumer<MaxBuilder> builder) {
        return configure(max(), builder);
    }

    public SqlExpression stringAgg(@NotNull Consumer<StringAggBuilder> builder) {
        return configure(stringAgg(), builder);
    }

    public SqlExpression arrayAgg(@NotNull Consumer<ArrayAggBuilder> builder) {
        return configure(arrayAgg(), builder);
    }

    public SqlExpression jsonObjectAgg(@NotNull Consumer<JsonObjectAggBuilder> builder) {
        return configure(jsonObjectAgg(), builder);
    }

    public SqlExpression jsonArrayAgg(@NotNull Consumer<JsonArrayAggBuilder> builder) {
        return configure(jsonArrayAgg(), builder);
    }

    public SqlExpression bitOr(@NotNull Consumer<BitOrBuilder> builder) {
        return configure(bitOr(), builder);
    }

    public SqlExpression bitAnd(@NotNull Consumer<BitAndBuilder> builder) {
        return configure(bitAnd(), builder);
    }

    public SqlExpression boolOr(@NotNull Consumer<BoolOrBuilder> builder) {
        return configure(boolOr(), builder);
    }

    public SqlExpression boolAnd(@NotNull Consumer<BoolAndBuilder> builder) {
        return configure(boolAnd(), builder);
    }

    public SqlExpression stdDev(@NotNull Consumer<StdDevBuilder> builder) {
        return configure(stdDev(), builder);
    }

    public SqlExpression variance(@NotNull Consumer<VarianceBuilder> builder) {
        return configure(variance(), builder);
    }

    private static <B extends BaseAggregate<B>> SqlExpression configure(B aggregate, Consumer<B> builder) {
        builder.accept(aggregate);
        return aggregate;
    }

    // ==================== Shorthands ====================

    public SqlExpression countAll() {
        return count().all();
    }

    public SqlExpression countAll(boolean distinct) {
        CountBuilder count = count().all();
        return distinct ? count.distinct() : count;
    }

    public SqlExpression countColumn(@NotNull String column) {
        return count().column(column);
    }

    public SqlExpression countColumn(@NotNull String column, boolean distinct) {
        CountBuilder count = count().column(column);
        return distinct ? count.distinct() : count;
    }

    public SqlExpression sumColumn(@NotNull String column) {
        return sum().column(column);
    }

    public SqlExpression sumColumn(@NotNull String column, boolean distinct) {
        SumBuilder sum = sum().column(column);
        return distinct ? sum.distinct() : sum;
    }

    public SqlExpression avgColumn(@NotNull String column) {
        return avg().column(column);
    }

    public SqlExpression avgColumn(@NotNull String column, boolean distinct) {
        AvgBuilder avg = avg().column(column);
        return distinct ? avg.distinct() : avg;
    }

    public SqlExpression minColumn(@NotNull String column) {
        return min().column(column);
    }

    public SqlExpression maxColumn(@NotNull String column) {
        return max().column(column);
    }

    // ==================== Rendering ====================

    /**
     * {@code expr AS alias}, for placing an aggregate in a projection list.
     */
    public SqlExpression as(@NotNull SqlExpression expression, @NotNull String alias) {
        return Expressions.as(expression, alias);
    }

    /**
     * Renders the expression for this context's dialect. Rendering failures propagate unchanged.
     */
    public @NotNull ParameterizedSql render(@NotNull SqlExpression expression) {
        RenderContext renderContext = context.newRenderContext();
        StringBuilder sql = new StringBuilder(64);
        expression.render(renderContext, sql);

        ParameterizedSql result = renderContext.toParameterizedSql(sql);
        if (context.options().logSql()) {
            Logging.info(() -> "[" + context.sqlType().getName() + "] " + result.sql() + (result.hasParams() ? " " + result.params() : ""));
        }
        return result;
    }

    public @NotNull String toSql(@NotNull SqlExpression expression) {
        return render(expression).sql();
    }
}
