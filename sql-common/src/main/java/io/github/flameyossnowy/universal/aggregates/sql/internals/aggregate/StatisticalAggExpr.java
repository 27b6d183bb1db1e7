package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.dialect.DialectFunctions;
import io.github.flameyossnowy.universal.aggregates.api.exceptions.AggregateUnsupportedFunctionException;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.BaseAggregate;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.StatisticalAggregate;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.StatisticalMode;
import org.jetbrains.annotations.NotNull;

/**
 * STDDEV / VARIANCE. The emitted name is {@code stem_POP} or {@code stem_SAMP}:
 * <ul>
 *     <li>PostgreSQL: population unless {@link #sample()} was called.</li>
 *     <li>MySQL: the plain function name unless a mode was chosen.</li>
 *     <li>SQLite: no statistical aggregates, rendering fails.</li>
 * </ul>
 */
abstract class StatisticalAggExpr<B extends BaseAggregate<B> & StatisticalAggregate<B>>
    extends AbstractAggregateBuilder<B> implements StatisticalAggregate<B> {

    private final Statistical statistical = new Statistical(expression);
    private final String stem;

    protected StatisticalAggExpr(@NotNull AggregationType type, @NotNull String stem) {
        super(type);
        this.stem = stem;
    }

    @Override
    public B population() {
        statistical.population();
        return self();
    }

    @Override
    public B sample() {
        statistical.sample();
        return self();
    }

    private String nameFor(StatisticalMode mode) {
        return stem + '_' + mode.suffix();
    }

    @Override
    protected AggregateCall rewrite(@NotNull RenderContext context) {
        AggregateCall base = AggregateCall.of(expression);
        StatisticalMode mode = expression.statisticalMode();

        return context.dispatcher().apply(DialectFunctions.<AggregateCall>builder()
            .postgres(() -> base.withFunctionName(nameFor(mode == StatisticalMode.DEFAULT ? StatisticalMode.POPULATION : mode)))
            .mysql(() -> mode == StatisticalMode.DEFAULT ? base : base.withFunctionName(nameFor(mode)))
            .sqlite(() -> {
                throw new AggregateUnsupportedFunctionException("SQLite has no statistical aggregates", expression.functionName(), context.sqlType());
            })
            .orElse(() -> {
                throw unsupported(context.sqlType());
            })
            .build());
    }
}
