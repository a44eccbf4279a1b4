// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug tracer for ledger activity.
 *
 * <p>Output goes to the {@code sh.latent.debug} SLF4J logger, or straight to stdout
 * (colored) when attached to a terminal. Every line passes through
 * {@link LogSanitizer} first.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.latent.debug");

    private DebugLogger() {
    }

    public static void logLedger(final String message, final Object... args) {
        if (!LatentDebug.isLedgerLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logEvent(final String message, final Object... args) {
        if (!LatentDebug.isEventLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!LatentDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        final String sanitized = LogSanitizer.sanitize(formatted);

        if (AnsiColors.IS_TTY) {
            System.out.println(sanitized);
        } else {
            LOG.info(sanitized);
        }
    }
}
