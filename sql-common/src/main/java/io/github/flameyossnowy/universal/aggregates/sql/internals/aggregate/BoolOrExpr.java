package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.dialect.DialectFunctions;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.BoolOrBuilder;
import org.jetbrains.annotations.NotNull;

/**
 * BOOL_OR, native on PostgreSQL. Elsewhere {@code MAX(CASE WHEN arg THEN 1 ELSE 0 END)}.
 */
final class BoolOrExpr extends AbstractAggregateBuilder<BoolOrBuilder> implements BoolOrBuilder {
    BoolOrExpr() {
        super(AggregationType.BOOL_OR);
    }

    @Override
    protected AggregateCall rewrite(@NotNull RenderContext context) {
        AggregateCall base = AggregateCall.of(expression);
        AggregateCall emulated = base.withFunctionName("MAX").withArgument(asFlag(base.argument()));

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
