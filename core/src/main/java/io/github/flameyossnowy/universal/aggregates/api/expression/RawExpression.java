package io.github.flameyossnowy.universal.aggregates.api.expression;

import io.github.flameyossnowy.universal.aggregates.api.render.RenderContext;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * Raw SQL template. Every {@code ?} consumes one argument: nested {@link SqlExpression}s are rendered in
 * place, anything else becomes a literal or a bound parameter.
 *
 * <p>A {@code ?} inside a single-quoted string is plain text, and {@code \?} writes a literal {@code ?}
 * (PostgreSQL's JSONB operators):</p>
 * <pre>{@code
 * Expressions.expr("COALESCE(?, '?')", column)        // one placeholder
 * Expressions.expr("payload \\?| ?", keys)            // payload ?| <keys>
 * }</pre>
 */
public final class RawExpression implements SqlExpression {
    private final String template;
    private final Object[] args;

    RawExpression(@NotNull String template, Object... args) {
        this.template = template;
        this.args = args == null ? new Object[] { null } : args.clone();

        int placeholders = countPlaceholders(template);
        if (placeholders != this.args.length) {
            throw new IllegalArgumentException(
                "Expression '" + template + "' has " + placeholders + " placeholders but " + this.args.length + " arguments"
            );
        }
    }

    public String template() {
        return template;
    }

    @Override
    public StringBuilder render(@NotNull RenderContext context, @NotNull StringBuilder sql) {
        int next = 0;
        boolean quoted = false;
        int length = template.length();
        for (int i = 0; i < length; i++) {
            char c = template.charAt(i);
            if (c == '\'') {
                // '' inside a string flips twice and stays quoted
                quoted = !quoted;
                sql.append(c);
                continue;
            }
            if (!quoted && isEscapedPlaceholder(template, i)) {
                sql.append('?');
                i++;
                continue;
            }
            if (quoted || c != '?') {
                sql.append(c);
                continue;
            }

            Object arg = args[next++];
            if (arg instanceof SqlExpression expression) {
                expression.render(context, sql);
            } else {
                context.appendValue(sql, arg);
            }
        }
        return sql;
    }

    static int countPlaceholders(@NotNull String template) {
        int count = 0;
        boolean quoted = false;
        int length = template.length();
        for (int i = 0; i < length; i++) {
            char c = template.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && isEscapedPlaceholder(template, i)) {
                i++;
            } else if (!quoted && c == '?') {
                count++;
            }
        }
        return count;
    }

    private static boolean isEscapedPlaceholder(String template, int index) {
        return template.charAt(index) == '\\' && index + 1 < template.length() && template.charAt(index + 1) == '?';
    }

    @Override
    public String toString() {
        return "RawExpression[" + template + ", " + Arrays.toString(args) + "]";
    }
}
