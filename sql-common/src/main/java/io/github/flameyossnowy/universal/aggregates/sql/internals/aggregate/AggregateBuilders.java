package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.sql.aggregate.*;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Entry point into the builder implementations. Each call returns a fresh, unconfigured builder.
 */
public final class AggregateBuilders {
    private AggregateBuilders() {}

    @Contract(" -> new")
    public static @NotNull CountBuilder count() {
        return new CountExpr();
    }

    @Contract(" -> new")
    public static @NotNull SumBuilder sum() {
        return new SumExpr();
    }

    @Contract(" -> new")
    public static @NotNull AvgBuilder avg() {
        return new AvgExpr();
    }

    @Contract(" -> new")
    public static @NotNull MinBuilder min() {
        return new MinExpr();
    }

    @Contract(" -> new")
    public static @NotNull MaxBuilder max() {
        return new MaxExpr();
    }

    @Contract(" -> new")
    public static @NotNull StringAggBuilder stringAgg() {
        return new StringAggExpr();
    }

    @Contract(" -> new")
    public static @NotNull ArrayAggBuilder arrayAgg() {
        return new ArrayAggExpr();
    }

    @Contract(" -> new")
    public static @NotNull JsonObjectAggBuilder jsonObjectAgg() {
        return new JsonObjectAggExpr();
    }

    @Contract(" -> new")
    public static @NotNull JsonArrayAggBuilder jsonArrayAgg() {
        return new JsonArrayAggExpr();
    }

    @Contract(" -> new")
    public static @NotNull BitOrBuilder bitOr() {
        return new BitOrExpr();
    }

    @Contract(" -> new")
    public static @NotNull BitAndBuilder bitAnd() {
        return new BitAndExpr();
    }

    @Contract(" -> new")
    public static @NotNull BoolOrBuilder boolOr() {
        return new BoolOrExpr();
    }

    @Contract(" -> new")
    public static @NotNull BoolAndBuilder boolAnd() {
        return new BoolAndExpr();
    }

    @Contract(" -> new")
    public static @NotNull StdDevBuilder stdDev() {
        return new StdDevExpr();
    }

    @Contract(" -> new")
    public static @NotNull VarianceBuilder variance() {
        return new VarianceExpr();
    }
}
