// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.error;

import sh.latent.core.types.Hash;
import sh.latent.core.types.TokenId;

/**
 * Thrown when a descriptor's content hash has already been claimed by a prepared token.
 *
 * @since 0.1.0
 */
public final class DuplicateMetadataException extends LedgerException {

    private final Hash descriptorHash;

    public DuplicateMetadataException(final Hash descriptorHash, final TokenId existingId) {
        super(Reason.DUPLICATE_METADATA, existingId,
                "descriptor hash " + descriptorHash.value() + " already claimed by token " + existingId.value());
        this.descriptorHash = descriptorHash;
    }

    public Hash descriptorHash() {
        return descriptorHash;
    }

    /** The token that owns the descriptor hash. */
    public TokenId existingId() {
        return tokenId();
    }
}
