// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core;

import static sh.latent.core.AnsiColors.*;

import sh.latent.core.types.Address;
import sh.latent.core.types.TokenId;

/**
 * Formats debug trace lines for ledger operations.
 *
 * <p>Every line uses a bracketed tag, shortened identities and inline-escaped
 * caller-supplied strings:
 * <pre>
 * [PREPARE] id=1 creator=0x11111111...1111 descriptor=ipfs://a
 * ✓ [MINT] id=1 owner=0x11111111...1111
 * [TRANSFER] id=1 from=0x11111111...1111 to=0x22222222...2222
 * [ROYALTY] id=1 recipient=0x33333333...3333 bps=500
 * ✗ [ABORT] op=prepare reason=DUPLICATE_METADATA undone=2
 * </pre>
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private LogFormatter() {
    }

    public static String formatPrepare(TokenId id, Address creator, String descriptor) {
        return String.format(
                "%s[PREPARE]%s id=%s creator=%s descriptor=%s",
                INDIGO, RESET,
                id.value(),
                hash(creator.value()),
                LogSanitizer.inline(descriptor));
    }

    public static String formatMint(TokenId id, Address owner) {
        return String.format(
                "%s✓%s %s[MINT]%s id=%s owner=%s",
                MINT, RESET,
                MINT, RESET,
                id.value(),
                hash(owner.value()));
    }

    public static String formatTransfer(TokenId id, Address from, Address to) {
        return String.format(
                "%s[TRANSFER]%s id=%s from=%s to=%s",
                LAVENDER, RESET,
                id.value(),
                hash(from.value()),
                hash(to.value()));
    }

    public static String formatRoyalty(TokenId id, Address recipient, int bps) {
        return String.format(
                "%s[ROYALTY]%s id=%s recipient=%s bps=%d",
                AMBER, RESET,
                id.value(),
                hash(recipient.value()),
                bps);
    }

    public static String formatEvent(String json) {
        return String.format("%s[EVENT]%s %s", SLATE, RESET, json);
    }

    public static String formatAbort(String operation, String reason, int undone) {
        return String.format(
                "%s✗%s %s[ABORT]%s op=%s reason=%s undone=%d",
                CORAL, RESET,
                CORAL, RESET,
                operation,
                CORAL + reason + RESET,
                undone);
    }
}
