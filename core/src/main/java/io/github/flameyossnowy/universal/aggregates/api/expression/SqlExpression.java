package io.github.flameyossnowy.universal.aggregates.api.expression;

import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import org.jetbrains.annotations.NotNull;

/**
 * A fragment of SQL that knows how to write itself for the dialect of a {@link RenderContext}.
 *
 * <p>Implementations append to the given buffer and return it. Failures are reported with
 * unchecked exceptions and abort the whole statement.</p>
 */
@FunctionalInterface
public interface SqlExpression {
    StringBuilder render(@NotNull RenderContext context, @NotNull StringBuilder sql);
}
