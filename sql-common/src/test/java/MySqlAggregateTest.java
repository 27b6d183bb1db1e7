import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import io.github.flameyossnowy.universal.aggregates.api.render.ParameterizedSql;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderOptions;
import io.github.flameyossnowy.universal.aggregates.sql.AggregateFunctions;
import io.github.flameyossnowy.universal.aggregates.sql.QueryContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MySqlAggregateTest {
    private final AggregateFunctions fn = AggregateFunctions.of(SQLType.MYSQL);

    @Test
    void string_agg_becomes_group_concat_with_separator_clause() {
        String sql = fn.toSql(fn.stringAgg().column("title").orderBy("title").separator("; "));
        assertEquals("GROUP_CONCAT(title ORDER BY title ASC SEPARATOR '; ')", sql);
    }

    @Test
    void string_agg_distinct_keeps_separator() {
        assertEquals("GROUP_CONCAT(DISTINCT title SEPARATOR ',')", fn.toSql(fn.stringAgg().column("title").distinct()));
    }

    @Test
    void string_agg_ignore_nulls_guards_argument() {
        String sql = fn.toSql(fn.stringAgg().column("title").ignoreNulls());
        assertEquals("GROUP_CONCAT(CASE WHEN title IS NOT NULL THEN title END SEPARATOR ',')", sql);
    }

    @Test
    void array_agg_drops_ordering() {
        assertEquals("JSON_ARRAYAGG(title)", fn.toSql(fn.arrayAgg().column("title").orderBy("view_count")));
    }

    @Test
    void array_agg_drops_distinct() {
        assertEquals("JSON_ARRAYAGG(title)", fn.toSql(fn.arrayAgg().column("title").distinct()));
    }

    @Test
    void json_aggregates_use_mysql_names() {
        assertEquals("JSON_OBJECTAGG(slug, title)", fn.toSql(fn.jsonObjectAgg().keyColumn("slug").column("title")));
        assertEquals("JSON_ARRAYAGG(title)", fn.toSql(fn.jsonArrayAgg().column("title").orderBy("title")));
    }

    @Test
    void bitwise_aggregates_are_native() {
        assertEquals("BIT_OR(flags)", fn.toSql(fn.bitOr().column("flags")));
        assertEquals("BIT_AND(flags)", fn.toSql(fn.bitAnd().column("flags")));
    }

    @Test
    void boolean_aggregates_are_emulated_with_max_and_min() {
        assertEquals("MAX(CASE WHEN active THEN 1 ELSE 0 END)", fn.toSql(fn.boolOr().column("active")));
        assertEquals("MIN(CASE WHEN active THEN 1 ELSE 0 END)", fn.toSql(fn.boolAnd().column("active")));
    }

    @Test
    void statistical_mode_is_optional() {
        assertEquals("STDDEV(score)", fn.toSql(fn.stdDev().column("score")));
        assertEquals("STDDEV_POP(score)", fn.toSql(fn.stdDev().column("score").population()));
        assertEquals("VARIANCE(score)", fn.toSql(fn.variance().column("score")));
        assertEquals("VAR_SAMP(score)", fn.toSql(fn.variance().column("score").sample()));
    }

    @Test
    void parameterized_filter_binds_value() {
        AggregateFunctions parameterized = new AggregateFunctions(
            QueryContext.builder(SQLType.MYSQL).withOptions(RenderOptions.PARAMETERIZED).build());

        ParameterizedSql sql = parameterized.render(parameterized.count().all().filter(c -> c.eq("status", "published")));

        assertEquals("SUM(CASE WHEN status = ? THEN 1 ELSE 0 END)", sql.sql());
        assertEquals(List.of("published"), sql.params());
    }

    @Test
    void separator_stays_inline_in_parameterized_mode() {
        AggregateFunctions parameterized = new AggregateFunctions(
            QueryContext.builder(SQLType.MYSQL).withOptions(RenderOptions.PARAMETERIZED).build());

        ParameterizedSql sql = parameterized.render(parameterized.stringAgg().column("title").separator(" | "));

        assertEquals("GROUP_CONCAT(title SEPARATOR ' | ')", sql.sql());
        assertFalse(sql.hasParams());
    }

    @Test
    void group_concat_emulates_nulls_placement() {
        String last = fn.toSql(fn.stringAgg().column("title").orderBy(o -> o.column("published_at").desc().nullsLast()));
        assertEquals("GROUP_CONCAT(title ORDER BY published_at IS NULL ASC, published_at DESC SEPARATOR ',')", last);

        String first = fn.toSql(fn.stringAgg().column("title").orderBy("title").orderBy(o -> o.column("rank").nullsFirst()));
        assertEquals("GROUP_CONCAT(title ORDER BY title ASC, rank IS NULL DESC, rank ASC SEPARATOR ',')", first);
    }

    @Test
    void nulls_placement_is_kept_on_postgres() {
        AggregateFunctions postgres = AggregateFunctions.of(SQLType.POSTGRESQL);
        String sql = postgres.toSql(postgres.stringAgg().column("title").orderBy(o -> o.column("published_at").desc().nullsLast()));

        assertEquals("STRING_AGG(title, ',' ORDER BY published_at DESC NULLS LAST)", sql);
    }
}
