package io.github.flameyossnowy.universal.aggregates.api.utils;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Global logging switches used across the library.
 *
 * <p>{@link #ENABLED} turns informational output on, {@link #DEEP} additionally enables the
 * per-rewrite tracing. Warnings and errors are always forwarded.</p>
 */
public final class Logging {
    public static volatile boolean ENABLED = false;
    public static volatile boolean DEEP = false;

    private static final Logger LOGGER = LoggerFactory.getLogger("universal-aggregates");

    private Logging() {}

    public static void info(@NotNull Supplier<String> message) {
        if (ENABLED && LOGGER.isInfoEnabled()) {
            LOGGER.info(message.get());
        }
    }

    public static void info(String message) {
        if (ENABLED) {
            LOGGER.info(message);
        }
    }

    public static void deepInfo(@NotNull Supplier<String> message) {
        if (ENABLED && DEEP && LOGGER.isInfoEnabled()) {
            LOGGER.info("[deep] " + message.get());
        }
    }

    public static void warn(String message) {
        LOGGER.warn(message);
    }

    public static void error(String message) {
        LOGGER.error(message);
    }

    public static void error(String message, Throwable throwable) {
        LOGGER.error(message, throwable);
    }
}
