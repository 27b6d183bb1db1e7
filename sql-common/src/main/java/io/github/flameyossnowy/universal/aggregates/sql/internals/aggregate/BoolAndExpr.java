package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.dialect.DialectFunctions;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.BoolAndBuilder;
import org.jetbrains.annotations.NotNull;

/**
 * BOOL_AND, native on PostgreSQL. Elsewhere {@code MIN(CASE WHEN arg THEN 1 ELSE 0 END)}.
 */
final class BoolAndExpr extends AbstractAggregateBuilder<BoolAndBuilder> implements BoolAndBuilder {
    BoolAndExpr() {
        super(AggregationType.BOOL_AND);
    }

    @Override
    protected AggregateCall rewrite(@NotNull RenderContext context) {
        AggregateCall base = AggregateCall.of(expression);
        AggregateCall emulated = base.withFunctionName("MIN").withArgument(asFlag(base.argument()));

        return context.dispatcher().apply(DialectFunctions.<AggregateCall>builder()
            .postgres(() -> base)
            .mysql(() -> emulated)
            .sqlite(() -> emulated)
            .orElse(() -> {
                throw unsupported(context.sqlType());
            })
            .build());
    }
}
