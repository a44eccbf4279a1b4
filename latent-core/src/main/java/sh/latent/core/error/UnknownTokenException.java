// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.error;

import sh.latent.core.types.TokenId;

/**
 * Thrown when an operation references a token that does not exist.
 *
 * @since 0.1.0
 */
public final class UnknownTokenException extends LedgerException {

    public UnknownTokenException(final TokenId tokenId) {
        super(Reason.UNKNOWN_TOKEN, tokenId, "unknown token " + tokenId.value());
    }

    public UnknownTokenException(final TokenId tokenId, final String message) {
        super(Reason.UNKNOWN_TOKEN, tokenId, message);
    }
}
