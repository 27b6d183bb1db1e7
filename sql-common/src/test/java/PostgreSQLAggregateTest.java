import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import io.github.flameyossnowy.universal.aggregates.api.exceptions.MissingArgumentsException;
import io.github.flameyossnowy.universal.aggregates.sql.AggregateFunctions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PostgreSQLAggregateTest {
    private final AggregateFunctions fn = AggregateFunctions.of(SQLType.POSTGRESQL);

    @Test
    void sum_column_renders_plain_call() {
        assertEquals("SUM(view_count)", fn.toSql(fn.sum().column("view_count")));
    }

    @Test
    void count_all_uses_native_filter_clause() {
        String sql = fn.toSql(fn.count().all().filter(c -> c.eq("status", "published")));
        assertEquals("COUNT(*) FILTER (WHERE status = 'published')", sql);
    }

    @Test
    void count_distinct_column() {
        assertEquals("COUNT(DISTINCT author_id)", fn.toSql(fn.count().column("author_id").distinct()));
    }

    @Test
    void avg_with_filter_keeps_argument() {
        String sql = fn.toSql(fn.avg().column("score").filter(c -> c.isTrue("active")));
        assertEquals("AVG(score) FILTER (WHERE active IS TRUE)", sql);
    }

    @Test
    void string_agg_places_separator_before_order_by() {
        String sql = fn.toSql(fn.stringAgg().column("title").orderBy("title").separator("; "));
        assertEquals("STRING_AGG(title, '; ' ORDER BY title ASC)", sql);
    }

    @Test
    void string_agg_defaults_to_comma_separator() {
        assertEquals("STRING_AGG(title, ',')", fn.toSql(fn.stringAgg().column("title")));
    }

    @Test
    void string_agg_ignore_nulls_guards_argument_without_suffix() {
        String sql = fn.toSql(fn.stringAgg().column("title").ignoreNulls());
        assertEquals("STRING_AGG(CASE WHEN title IS NOT NULL THEN title END, ',')", sql);
    }

    @Test
    void array_agg_keeps_distinct_and_ordering() {
        String sql = fn.toSql(fn.arrayAgg().column("title").distinct().orderByDesc("title"));
        assertEquals("ARRAY_AGG(DISTINCT title ORDER BY title DESC)", sql);
    }

    @Test
    void json_aggregates_use_postgres_names() {
        assertEquals("JSON_OBJECT_AGG(slug, title)", fn.toSql(fn.jsonObjectAgg().keyColumn("slug").column("title")));
        assertEquals("JSON_AGG(title ORDER BY published_at DESC NULLS LAST)",
            fn.toSql(fn.jsonArrayAgg().column("title").orderBy(o -> o.column("published_at").desc().nullsLast())));
    }

    @Test
    void json_object_agg_requires_key() {
        MissingArgumentsException error =
            assertThrows(MissingArgumentsException.class, () -> fn.toSql(fn.jsonObjectAgg().column("title")));
        assertEquals("JSON_OBJECT_AGG", error.getFunctionName());
    }

    @Test
    void bitwise_and_boolean_aggregates_are_native() {
        assertEquals("BIT_OR(flags)", fn.toSql(fn.bitOr().column("flags")));
        assertEquals("BIT_AND(flags)", fn.toSql(fn.bitAnd().column("flags")));
        assertEquals("BOOL_OR(active)", fn.toSql(fn.boolOr().column("active")));
        assertEquals("BOOL_AND(active)", fn.toSql(fn.boolAnd().column("active")));
    }

    @Test
    void statistical_aggregates_default_to_population() {
        assertEquals("STDDEV_POP(score)", fn.toSql(fn.stdDev().column("score")));
        assertEquals("STDDEV_SAMP(score)", fn.toSql(fn.stdDev().column("score").sample()));
        assertEquals("VAR_POP(score)", fn.toSql(fn.variance().column("score")));
        assertEquals("VAR_SAMP(score)", fn.toSql(fn.variance().column("score").sample()));
    }

    @Test
    void min_and_max_accept_expressions() {
        assertEquals("MIN(LENGTH(title))", fn.toSql(fn.min().expr("LENGTH(title)")));
        assertEquals("MAX(price * 2)", fn.toSql(fn.max().expr("price * ?", 2)));
    }

    @Test
    void count_all_ignores_distinct() {
        assertEquals("COUNT(*)", fn.toSql(fn.countAll(true)));
        assertEquals("COUNT(*) FILTER (WHERE status = 'published')",
            fn.toSql(fn.count().all().distinct().filter(c -> c.eq("status", "published"))));
    }

    @Test
    void raw_argument_may_contain_quoted_question_mark() {
        assertEquals("STRING_AGG(COALESCE(title, '?'), ',')", fn.toSql(fn.stringAgg().expr("COALESCE(title, '?')")));
    }

    @Test
    void null_handling_never_emits_a_suffix() {
        for (SQLType sqlType : new SQLType[] { SQLType.POSTGRESQL, SQLType.MYSQL, SQLType.SQLITE }) {
            AggregateFunctions dialect = AggregateFunctions.of(sqlType);
            String titles = dialect.toSql(dialect.stringAgg().column("title").respectNulls());
            String array = dialect.toSql(dialect.arrayAgg().column("title").ignoreNulls());

            assertFalse(titles.contains("NULLS"), sqlType + ": " + titles);
            assertFalse(array.contains("NULLS"), sqlType + ": " + array);
        }
    }
}
