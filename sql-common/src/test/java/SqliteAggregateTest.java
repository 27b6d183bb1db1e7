import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import io.github.flameyossnowy.universal.aggregates.api.exceptions.AggregateRenderException;
import io.github.flameyossnowy.universal.aggregates.api.exceptions.AggregateUnsupportedFunctionException;
import io.github.flameyossnowy.universal.aggregates.sql.AggregateFunctions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqliteAggregateTest {
    private final AggregateFunctions fn = AggregateFunctions.of(SQLType.SQLITE);

    @Test
    void string_agg_passes_separator_as_second_argument() {
        assertEquals("GROUP_CONCAT(title, ',')", fn.toSql(fn.stringAgg().column("title")));
        assertEquals("GROUP_CONCAT(title, '-' ORDER BY title ASC)", fn.toSql(fn.stringAgg().column("title").separator("-").orderBy("title")));
    }

    @Test
    void string_agg_distinct_drops_separator() {
        assertEquals("GROUP_CONCAT(DISTINCT title)", fn.toSql(fn.stringAgg().column("title").distinct().separator(";")));
    }

    @Test
    void count_uses_native_filter_clause() {
        String sql = fn.toSql(fn.count().all().filter(c -> c.eq("status", "published")));
        assertEquals("COUNT(*) FILTER (WHERE status = 'published')", sql);
    }

    @Test
    void bitwise_aggregates_are_emulated() {
        assertEquals("MAX(CASE WHEN flags != 0 THEN 1 ELSE 0 END)", fn.toSql(fn.bitOr().column("flags")));
        assertEquals("MIN(CASE WHEN flags != 0 THEN 1 ELSE 0 END)", fn.toSql(fn.bitAnd().column("flags")));
    }

    @Test
    void emulated_aggregate_keeps_native_filter() {
        String sql = fn.toSql(fn.boolOr().column("active").filter(c -> c.gt("score", 3)));
        assertEquals("MAX(CASE WHEN active THEN 1 ELSE 0 END) FILTER (WHERE score > 3)", sql);
    }

    @Test
    void json_aggregates_use_group_functions() {
        assertEquals("JSON_GROUP_ARRAY(title)", fn.toSql(fn.arrayAgg().column("title").distinct().orderBy("title")));
        assertEquals("JSON_GROUP_ARRAY(title)", fn.toSql(fn.jsonArrayAgg().column("title")));
        assertEquals("JSON_GROUP_OBJECT(slug, title)", fn.toSql(fn.jsonObjectAgg().keyColumn("slug").column("title")));
    }

    @Test
    void array_agg_ignore_nulls_guards_argument() {
        assertEquals("JSON_GROUP_ARRAY(CASE WHEN title IS NOT NULL THEN title END)", fn.toSql(fn.arrayAgg().column("title").ignoreNulls()));
    }

    @Test
    void statistical_aggregates_are_unsupported() {
        AggregateUnsupportedFunctionException stddev =
            assertThrows(AggregateUnsupportedFunctionException.class, () -> fn.toSql(fn.stdDev().column("score")));
        assertEquals("STDDEV", stddev.getFunctionName());
        assertEquals(SQLType.SQLITE, stddev.getSqlType());

        AggregateRenderException variance =
            assertThrows(AggregateUnsupportedFunctionException.class, () -> fn.toSql(fn.variance().column("score").sample()));
        assertEquals("VARIANCE", variance.getFunctionName());
    }
}
