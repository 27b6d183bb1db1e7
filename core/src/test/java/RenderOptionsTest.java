import io.github.flameyossnowy.universal.aggregates.api.render.RenderOptions;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RenderOptionsTest {

    @Test
    void builder_defaults_to_inline_rendering() {
        RenderOptions options = RenderOptions.builder().build();

        assertEquals(RenderOptions.DEFAULT, options);
        assertFalse(options.parameterized());
        assertFalse(options.logSql());
        assertFalse(options.warnOnDegradation());
    }

    @Test
    void from_properties_reads_every_key() {
        Properties properties = new Properties();
        properties.setProperty(RenderOptions.PARAMETERIZED_KEY, "true");
        properties.setProperty(RenderOptions.LOG_SQL_KEY, " TRUE ");
        properties.setProperty(RenderOptions.WARN_ON_DEGRADATION_KEY, "no");

        RenderOptions options = RenderOptions.fromProperties(properties);

        assertTrue(options.parameterized());
        assertTrue(options.logSql());
        assertFalse(options.warnOnDegradation());
    }

    @Test
    void load_default_reads_classpath_resource() {
        RenderOptions options = RenderOptions.loadDefault();

        assertFalse(options.parameterized());
        assertTrue(options.logSql());
        assertTrue(options.warnOnDegradation());
    }
}
