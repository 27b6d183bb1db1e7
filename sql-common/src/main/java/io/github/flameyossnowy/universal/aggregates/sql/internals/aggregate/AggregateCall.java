package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.options.OrderTerm;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Dialect-resolved shape of one aggregate call. Dialect rewrites derive a new call with the
 * {@code withX} methods, the builder that produced it stays untouched.
 *
 * <p>Arguments are emitted as {@code leading..., argument, trailing...}; only {@link #argument()} is
 * wrapped when FILTER has to be emulated. {@link #trailer()} is emitted after the ORDER BY list, as
 * MySQL's {@code SEPARATOR} clause is.</p>
 */
record AggregateCall(
    String functionName,
    boolean distinct,
    List<SqlExpression> leadingArguments,
    SqlExpression argument,
    List<SqlExpression> trailingArguments,
    List<OrderTerm> orderBy,
    @Nullable SqlExpression trailer,
    @Nullable SqlExpression filter
) {
    AggregateCall {
        Objects.requireNonNull(functionName, "functionName");
        Objects.requireNonNull(argument, "argument");
        leadingArguments = List.copyOf(leadingArguments);
        trailingArguments = List.copyOf(trailingArguments);
        orderBy = List.copyOf(orderBy);
    }

    @Contract("_ -> new")
    static @NotNull AggregateCall of(@NotNull AggregateExpression expression) {
        return new AggregateCall(
            expression.functionName(),
            expression.isDistinct(),
            List.of(),
            Objects.requireNonNull(expression.argument(), "argument"),
            List.of(),
            expression.orderBy(),
            null,
            expression.filter()
        );
    }

    AggregateCall withFunctionName(@NotNull String functionName) {
        return new AggregateCall(functionName, distinct, leadingArguments, argument, trailingArguments, orderBy, trailer, filter);
    }

    AggregateCall withDistinct(boolean distinct) {
        return new AggregateCall(functionName, distinct, leadingArguments, argument, trailingArguments, orderBy, trailer, filter);
    }

    AggregateCall withArgument(@NotNull SqlExpression argument) {
        return new AggregateCall(functionName, distinct, leadingArguments, argument, trailingArguments, orderBy, trailer, filter);
    }

    AggregateCall withLeadingArguments(@NotNull SqlExpression... leadingArguments) {
        return new AggregateCall(functionName, distinct, List.of(leadingArguments), argument, trailingArguments, orderBy, trailer, filter);
    }

    AggregateCall withTrailingArguments(@NotNull SqlExpression... trailingArguments) {
        return new AggregateCall(functionName, distinct, leadingArguments, argument, List.of(trailingArguments), orderBy, trailer, filter);
    }

    AggregateCall withOrderBy(@NotNull List<OrderTerm> orderBy) {
        return new AggregateCall(functionName, distinct, leadingArguments, argument, trailingArguments, orderBy, trailer, filter);
    }

    AggregateCall withTrailer(@Nullable SqlExpression trailer) {
        return new AggregateCall(functionName, distinct, leadingArguments, argument, trailingArguments, orderBy, trailer, filter);
    }
}
