import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.render.ParameterizedSql;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderOptions;
import io.github.flameyossnowy.universal.aggregates.api.utils.Logging;
import io.github.flameyossnowy.universal.aggregates.sql.AggregateFunctions;
import io.github.flameyossnowy.universal.aggregates.sql.QueryContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AggregateFunctionsTest {

    @AfterEach
    void reset_logging() {
        Logging.ENABLED = false;
        Logging.DEEP = false;
    }

    @Test
    void callback_forms_return_configured_expressions() {
        AggregateFunctions fn = AggregateFunctions.of(SQLType.POSTGRESQL);

        SqlExpression count = fn.count(cb -> cb.all().filter(c -> c.eq("status", "published")));
        SqlExpression titles = fn.stringAgg(sb -> sb.column("title").orderBy("title"));

        assertEquals("COUNT(*) FILTER (WHERE status = 'published')", fn.toSql(count));
        assertEquals("STRING_AGG(title, ',' ORDER BY title ASC)", fn.toSql(titles));
        assertEquals("BOOL_AND(active)", fn.toSql(fn.boolAnd(b -> b.column("active"))));
    }

    @Test
    void shorthands_render_basic_aggregates() {
        AggregateFunctions fn = AggregateFunctions.of(SQLType.MYSQL);

        assertEquals("COUNT(*)", fn.toSql(fn.countAll()));
        assertEquals("COUNT(id)", fn.toSql(fn.countColumn("id")));
        assertEquals("COUNT(DISTINCT author_id)", fn.toSql(fn.countColumn("author_id", true)));
        assertEquals("SUM(view_count)", fn.toSql(fn.sumColumn("view_count")));
        assertEquals("SUM(DISTINCT view_count)", fn.toSql(fn.sumColumn("view_count", true)));
        assertEquals("AVG(DISTINCT score)", fn.toSql(fn.avgColumn("score", true)));
        assertEquals("MIN(created_at)", fn.toSql(fn.minColumn("created_at")));
        assertEquals("MAX(created_at)", fn.toSql(fn.maxColumn("created_at")));
    }

    @Test
    void alias_wraps_rendered_aggregate() {
        AggregateFunctions fn = AggregateFunctions.of(SQLType.MYSQL);
        SqlExpression total = fn.as(fn.sum().column("view_count").filter(c -> c.eq("status", "published")), "published_views");

        assertEquals("SUM(CASE WHEN status = 'published' THEN view_count ELSE 0 END) AS published_views", fn.toSql(total));
    }

    @Test
    void each_render_collects_its_own_parameters() {
        AggregateFunctions fn = new AggregateFunctions(QueryContext.builder(SQLType.POSTGRESQL)
            .withOptions(RenderOptions.PARAMETERIZED)
            .build());
        SqlExpression expression = fn.sum().column("amount").filter(c -> c.gte("amount", 10).lt("amount", 100));

        ParameterizedSql first = fn.render(expression);
        ParameterizedSql second = fn.render(expression);

        assertEquals("SUM(amount) FILTER (WHERE amount >= ? AND amount < ?)", first.sql());
        assertEquals(List.of(10, 100), first.params());
        assertEquals(first, second);
    }

    @Test
    void logging_options_do_not_change_output() {
        Logging.ENABLED = true;
        Logging.DEEP = true;
        AggregateFunctions fn = new AggregateFunctions(QueryContext.builder(SQLType.SQLITE)
            .withOptions(RenderOptions.builder().withLogSql(true).withWarnOnDegradation(true).build())
            .build());

        assertEquals("JSON_GROUP_ARRAY(title)", fn.toSql(fn.arrayAgg().column("title").distinct().orderBy("title")));
        assertEquals("GROUP_CONCAT(title, ',')", fn.toSql(fn.stringAgg().column("title")));
    }

    @Test
    void query_context_exposes_dialect_and_options() {
        QueryContext context = QueryContext.builder(SQLType.MYSQL)
            .withSqlType(SQLType.SQLITE)
            .withOptions(RenderOptions.PARAMETERIZED)
            .build();

        assertEquals(SQLType.SQLITE, context.sqlType());
        assertTrue(context.options().parameterized());
        assertEquals(SQLType.SQLITE, context.newRenderContext().sqlType());
        assertNotSame(context.newRenderContext(), context.newRenderContext());
    }
}
