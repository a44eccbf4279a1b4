// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.error;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.latent.core.types.TokenId;

/**
 * A ledger operation was rejected. Nothing the operation did before the failure
 * remains applied.
 *
 * <p>Every instance carries a {@link Reason} so callers can branch on the failure
 * without matching message text. Subclasses exist per reason for callers that
 * prefer typed catch clauses.
 *
 * @since 0.1.0
 */
public non-sealed class LedgerException extends LatentException {

    /** Reason tag for a rejected operation. */
    public enum Reason {
        /** {@code prepare} called with an empty descriptor. */
        EMPTY_DESCRIPTOR,
        /** Descriptor content hash already claimed by another token. */
        DUPLICATE_METADATA,
        /** The id was never prepared (or the token does not exist in the ownership ledger). */
        UNKNOWN_TOKEN,
        /** A second mint of the same id was attempted. */
        ALREADY_MINTED,
        /** The caller is not allowed to perform the operation. */
        UNAUTHORIZED,
        /** Royalty rate above the fee denominator. */
        ROYALTY_TOO_HIGH,
        /** The ownership ledger refused the transfer (wrong owner, zero recipient, receiver refusal). */
        TRANSFER_REJECTED
    }

    private final Reason reason;
    private final @Nullable TokenId tokenId;

    public LedgerException(final Reason reason, final @Nullable TokenId tokenId, final String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.tokenId = tokenId;
    }

    public LedgerException(
            final Reason reason, final @Nullable TokenId tokenId, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.tokenId = tokenId;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Returns the token the rejected operation referenced, if any.
     *
     * @return the token id, or {@code null} for operations not tied to a token
     */
    public @Nullable TokenId tokenId() {
        return tokenId;
    }
}
