package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import io.github.flameyossnowy.universal.aggregates.api.exceptions.MissingArgumentsException;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.options.OrderTerm;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.NullsMode;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.StatisticalMode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state shared by a builder and its capabilities. Rendering never writes to it.
 */
final class AggregateExpression {
    private final AggregationType type;
    private final List<OrderTerm> orderBy = new ArrayList<>(2);

    private SqlExpression argument;
    private SqlExpression filter;
    private boolean distinct;
    private NullsMode nullsMode = NullsMode.DEFAULT;
    private StatisticalMode statisticalMode = StatisticalMode.DEFAULT;

    // STRING_AGG
    private String separator = ",";

    // JSON_OBJECT_AGG
    private SqlExpression key;

    AggregateExpression(@NotNull AggregationType type) {
        this.type = type;
    }

    AggregationType type() {
        return type;
    }

    String functionName() {
        return type.functionName();
    }

    @Nullable SqlExpression argument() {
        return argument;
    }

    void setArgument(@NotNull SqlExpression argument) {
        this.argument = argument;
    }

    @Nullable SqlExpression filter() {
        return filter;
    }

    void setFilter(@NotNull SqlExpression filter) {
        this.filter = filter;
    }

    boolean isDistinct() {
        return distinct;
    }

    void setDistinct(boolean distinct) {
        this.distinct = distinct;
    }

    List<OrderTerm> orderBy() {
        return Collections.unmodifiableList(orderBy);
    }

    void addOrderTerm(@NotNull OrderTerm term) {
        orderBy.add(term);
    }

    NullsMode nullsMode() {
        return nullsMode;
    }

    void setNullsMode(@NotNull NullsMode nullsMode) {
        this.nullsMode = nullsMode;
    }

    StatisticalMode statisticalMode() {
        return statisticalMode;
    }

    void setStatisticalMode(@NotNull StatisticalMode statisticalMode) {
        this.statisticalMode = statisticalMode;
    }

    String separator() {
        return separator;
    }

    void setSeparator(@NotNull String separator) {
        this.separator = separator;
    }

    @Nullable SqlExpression key() {
        return key;
    }

    void setKey(@NotNull SqlExpression key) {
        this.key = key;
    }

    void requireArgument(@NotNull SQLType sqlType) {
        if (argument == null) {
            throw new MissingArgumentsException("Aggregate requires an argument, call column(...) or expr(...)", functionName(), sqlType);
        }
    }
}
