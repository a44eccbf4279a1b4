// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.error;

import sh.latent.core.types.TokenId;

/**
 * Thrown when the ownership ledger refuses to move a token: the source is not the
 * owner, the recipient is the zero address, or a receiver refused delivery.
 *
 * @since 0.1.0
 */
public final class TransferRejectedException extends LedgerException {

    public TransferRejectedException(final TokenId tokenId, final String message) {
        super(Reason.TRANSFER_REJECTED, tokenId, message);
    }

    public TransferRejectedException(final TokenId tokenId, final String message, final Throwable cause) {
        super(Reason.TRANSFER_REJECTED, tokenId, message, cause);
    }
}
