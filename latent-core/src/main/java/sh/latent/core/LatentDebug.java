// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core;

/**
 * Global toggle for verbose debug tracing of ledger operations.
 *
 * <p>Two channels exist: ledger tracing (prepare, mint, transfer, royalty and
 * aborts) and event tracing (every notification appended to an event log).
 * Fields are volatile; the compound check in {@link #isEnabled()} is best effort.
 */
public final class LatentDebug {

    private static volatile boolean ledgerLogging = false;
    private static volatile boolean eventLogging = false;

    private LatentDebug() {
    }

    /**
     * @return true if either channel is enabled
     */
    public static boolean isEnabled() {
        return ledgerLogging || eventLogging;
    }

    public static void setEnabled(final boolean enabled) {
        ledgerLogging = enabled;
        eventLogging = enabled;
    }

    public static void setLedgerLogging(final boolean enabled) {
        ledgerLogging = enabled;
    }

    public static boolean isLedgerLoggingEnabled() {
        return ledgerLogging;
    }

    public static void setEventLogging(final boolean enabled) {
        eventLogging = enabled;
    }

    public static boolean isEventLoggingEnabled() {
        return eventLogging;
    }
}
