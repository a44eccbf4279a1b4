// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core;

import java.util.regex.Pattern;

/**
 * Makes caller-supplied text safe to put in a log line.
 *
 * <p>Descriptors and base paths are arbitrary strings chosen by callers, so:
 * <ul>
 * <li>carriage returns, line feeds and other control characters are escaped,
 * preventing forged log lines</li>
 * <li>excessively long output is truncated</li>
 * </ul>
 * Tab characters and the ANSI escape introducer used by {@link AnsiColors} are kept.
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Control characters except tab, escape and the newline used by multi-line formats. */
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x08\\x0B-\\x1A\\x1C-\\x1F\\x7F]");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;
        if (sanitized.indexOf('\r') >= 0) {
            sanitized = sanitized.replace("\r", "\\r");
        }
        sanitized = CONTROL.matcher(sanitized).replaceAll("?");

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }
        return sanitized;
    }

    /**
     * Escapes line breaks inside a single caller-supplied value so it cannot start a new log line.
     *
     * @param value the value, may be null
     * @return the value with {@code \n} and {@code \r} escaped
     */
    public static String inline(final String value) {
        if (value == null) {
            return "null";
        }
        return value.replace("\r", "\\r").replace("\n", "\\n");
    }
}
