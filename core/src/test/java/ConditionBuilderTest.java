import io.github.flameyossnowy.universal.aggregates.api.condition.ConditionBuilder;
import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import io.github.flameyossnowy.universal.aggregates.api.expression.SqlExpression;
import io.github.flameyossnowy.universal.aggregates.api.render.ParameterizedSql;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import io.github.flameyossnowy.universal.aggregates.api.render.RenderOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConditionBuilderTest {

    private static String render(SqlExpression expression) {
        return expression.render(RenderContext.of(SQLType.POSTGRESQL), new StringBuilder()).toString();
    }

    @Test
    void single_predicate_renders_without_parentheses() {
        assertEquals("status = 'published'", render(ConditionBuilder.build(c -> c.eq("status", "published"))));
    }

    @Test
    void predicates_are_joined_with_and() {
        SqlExpression condition = ConditionBuilder.build(c -> c
            .gt("view_count", 100)
            .lte("rating", 4.5)
            .like("title", "%java%"));

        assertEquals("view_count > 100 AND rating <= 4.5 AND title LIKE '%java%'", render(condition));
    }

    @Test
    void null_comparisons_become_is_null_checks() {
        assertEquals("deleted_at IS NULL", render(ConditionBuilder.build(c -> c.eq("deleted_at", null))));
        assertEquals("deleted_at IS NOT NULL", render(ConditionBuilder.build(c -> c.ne("deleted_at", null))));
    }

    @Test
    void or_group_is_parenthesised() {
        SqlExpression condition = ConditionBuilder.build(c -> c
            .isTrue("active")
            .or(g -> g.eq("role", "admin").eq("role", "owner")));

        assertEquals("active IS TRUE AND (role = 'admin' OR role = 'owner')", render(condition));
    }

    @Test
    void in_and_between_render_value_lists() {
        SqlExpression condition = ConditionBuilder.build(c -> c
            .in("status", List.of("draft", "review"))
            .between("created_at", "2024-01-01", "2024-12-31"));

        assertEquals("status IN ('draft', 'review') AND created_at BETWEEN '2024-01-01' AND '2024-12-31'", render(condition));
    }

    @Test
    void empty_in_list_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ConditionBuilder.build(c -> c.notIn("status", List.of())));
    }

    @Test
    void empty_builder_and_empty_group_are_rejected() {
        assertThrows(IllegalStateException.class, () -> ConditionBuilder.build(c -> {}));
        assertThrows(IllegalStateException.class, () -> ConditionBuilder.build(c -> c.or(g -> {})));
    }

    @Test
    void parameterized_rendering_collects_values_in_order() {
        SqlExpression condition = ConditionBuilder.build(c -> c
            .eq("status", "published")
            .in("author_id", List.of(3, 7))
            .expr("score > ?", 10));

        RenderContext context = new RenderContext(SQLType.MYSQL, RenderOptions.PARAMETERIZED);
        ParameterizedSql sql = context.toParameterizedSql(condition.render(context, new StringBuilder()));

        assertEquals("status = ? AND author_id IN (?, ?) AND score > ?", sql.sql());
        assertEquals(List.of("published", 3, 7, 10), sql.params());
    }
}
