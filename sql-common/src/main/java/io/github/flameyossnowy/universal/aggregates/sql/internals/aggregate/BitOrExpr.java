package io.github.flameyossnowy.universal.aggregates.sql.internals.aggregate;

import io.github.flameyossnowy.universal.aggregates.api.dialect.DialectFunctions;
import io.github.flameyossnowy.universal.aggregates.api.expression.Expressions;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.AggregationType;
import io.github.flameyossnowy.universal.aggregates.sql.aggregate.BitOrBuilder;
import org.jetbrains.annotations.NotNull;

/**
 * BIT_OR, native on PostgreSQL and MySQL. Elsewhere {@code MAX(CASE WHEN arg != 0 THEN 1 ELSE 0 END)}.
 */
final class BitOrExpr extends AbstractAggregateBuilder<BitOrBuilder> implements BitOrBuilder {
    BitOrExpr() {
        super(AggregationType.BIT_OR);
    }

    @Override
    protected AggregateCall rewrite(@NotNull RenderContext context) {
        AggregateCall base = AggregateCall.of(expression);
        AggregateCall emulated = base.withFunctionName("MAX").withArgument(asFlag(Expressions.expr("? != 0", base.argument())));

        return context.dispatcher().apply(DialectFunctions.<AggregateCall>builder()
            .postgres(() -> base)
            .mysql(() -> base)
            .sqlite(() -> emulated)
            .orElse(() -> {
                throw unsupported(context.sqlType());
            })
            .build());
    }
}
