// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core;

/**
 * ANSI color palette for debug tracing, disabled automatically when stdout is not
 * a terminal unless {@code FORCE_COLOR=true}.
 *
 * <ul>
 * <li><b>TEAL</b> - success</li>
 * <li><b>CORAL</b> - aborts</li>
 * <li><b>INDIGO</b> - preparation</li>
 * <li><b>AMBER</b> - royalty</li>
 * <li><b>LAVENDER</b> - transfers</li>
 * <li><b>MINT</b> - mints</li>
 * </ul>
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    public static final String RESET = ansi("0");
    public static final String TEAL = ansi("38;5;44");
    public static final String CORAL = ansi("38;5;204");
    public static final String INDIGO = ansi("38;5;99");
    public static final String AMBER = ansi("38;5;214");
    public static final String LAVENDER = ansi("38;5;183");
    public static final String MINT = ansi("38;5;121");
    public static final String SLATE = ansi("38;5;247");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }

    /**
     * Shortens a hash or address for display: values longer than 16 characters
     * become {@code 0x12345678...abcd}.
     *
     * @param value the value to shorten
     * @return the shortened value, or "null"
     */
    public static String hash(final String value) {
        if (value == null) {
            return "null";
        }
        if (value.length() > 16) {
            return value.substring(0, 10) + "..." + value.substring(value.length() - 4);
        }
        return value;
    }
}
