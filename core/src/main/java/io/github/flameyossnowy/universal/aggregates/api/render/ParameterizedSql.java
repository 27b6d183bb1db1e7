package io.github.flameyossnowy.universal.aggregates.api.render;

import java.util.List;

/**
 * Rendered SQL text plus the positional parameters its {@code ?} placeholders refer to.
 */
public record ParameterizedSql(String sql, List<Object> params) {
    public ParameterizedSql {
        params = List.copyOf(params);
    }

    public boolean hasParams() {
        return !params.isEmpty();
    }
}
