package io.github.flameyossnowy.universal.aggregates.api.render;

import io.github.flameyossnowy.universal.aggregates.api.utils.Logging;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings that change how aggregate expressions are emitted.
 *
 * <pre>{@code
 * RenderOptions options = RenderOptions.builder()
 *     .withParameterized(true)
 *     .withLogSql(true)
 *     .build();
 * }</pre>
 *
 * @param parameterized      bind literal values as {@code ?} parameters instead of inlining them
 * @param logSql             log every rendered aggregate through {@link Logging}
 * @param warnOnDegradation  log a warning when a dialect silently drops DISTINCT or ORDER BY
 */
public record RenderOptions(boolean parameterized, boolean logSql, boolean warnOnDegradation) {
    public static final String RESOURCE_NAME = "universal-aggregates.properties";
    public static final String PARAMETERIZED_KEY = "universal.aggregates.parameterized";
    public static final String LOG_SQL_KEY = "universal.aggregates.log-sql";
    public static final String WARN_ON_DEGRADATION_KEY = "universal.aggregates.warn-on-degradation";

    public static final RenderOptions DEFAULT = new RenderOptions(false, false, false);
    public static final RenderOptions PARAMETERIZED = new RenderOptions(true, false, false);

    @Contract(value = " -> new", pure = true)
    public static @NotNull Builder builder() {
        return new Builder();
    }

    public static @NotNull RenderOptions fromProperties(@NotNull Properties properties) {
        return builder()
            .withParameterized(Boolean.parseBoolean(properties.getProperty(PARAMETERIZED_KEY, "false").trim()))
            .withLogSql(Boolean.parseBoolean(properties.getProperty(LOG_SQL_KEY, "false").trim()))
            .withWarnOnDegradation(Boolean.parseBoolean(properties.getProperty(WARN_ON_DEGRADATION_KEY, "false").trim()))
            .build();
    }

    /**
     * Reads {@value #RESOURCE_NAME} from the context class loader, or returns {@link #DEFAULT} when absent.
     */
    public static @NotNull RenderOptions loadDefault() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = RenderOptions.class.getClassLoader();
        }

        try (InputStream in = loader.getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                return DEFAULT;
            }

            Properties properties = new Properties();
            properties.load(in);
            RenderOptions options = fromProperties(properties);
            Logging.info(() -> "Loaded render options from " + RESOURCE_NAME + ": " + options);
            return options;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE_NAME, e);
        }
    }

    public static final class Builder {
        private boolean parameterized;
        private boolean logSql;
        private boolean warnOnDegradation;

        private Builder() {}

        public Builder withParameterized(boolean parameterized) {
            this.parameterized = parameterized;
            return this;
        }

        public Builder withLogSql(boolean logSql) {
            this.logSql = logSql;
            return this;
        }

        public Builder withWarnOnDegradation(boolean warnOnDegradation) {
            this.warnOnDegradation = warnOnDegradation;
            return this;
        }

        public RenderOptions build() {
            return new RenderOptions(parameterized, logSql, warnOnDegradation);
        }
    }
}
