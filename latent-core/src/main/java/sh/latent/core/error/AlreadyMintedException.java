// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.error;

import sh.latent.core.types.TokenId;

/**
 * Thrown when a token that already has an owner is minted again.
 *
 * <p>Unreachable through the public transfer path unless a receiver callback tries
 * to re-enter minting for the token being delivered.
 *
 * @since 0.1.0
 */
public final class AlreadyMintedException extends LedgerException {

    public AlreadyMintedException(final TokenId tokenId) {
        super(Reason.ALREADY_MINTED, tokenId, "token " + tokenId.value() + " already minted");
    }
}
