package io.github.flameyossnowy.universal.aggregates.sql.aggregate;

import org.jetbrains.annotations.NotNull;

/**
 * STRING_AGG / GROUP_CONCAT.
 *
 * <pre>{@code
 * fn.stringAgg().column("title").orderBy("title").separator("; ")
 * // PostgreSQL: STRING_AGG(title, '; ' ORDER BY title ASC)
 * // MySQL:      GROUP_CONCAT(title ORDER BY title ASC SEPARATOR '; ')
 * }</pre>
 */
public interface StringAggBuilder extends BaseAggregate<StringAggBuilder>,
    DistinctableAggregate<StringAggBuilder>,
    OrderableAggregate<StringAggBuilder>,
    NullHandlingAggregate<StringAggBuilder> {

    /**
     * Sets the delimiter placed between values, a comma by default. SQLite drops it for DISTINCT
     * aggregation because DISTINCT aggregates take a single argument there.
     */
    StringAggBuilder separator(@NotNull String separator);
}
