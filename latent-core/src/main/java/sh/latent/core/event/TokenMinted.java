// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.event;

import java.util.Objects;

import sh.latent.core.types.Address;
import sh.latent.core.types.TokenId;

/**
 * A prepared token received its first owner. Emitted once per token, immediately
 * before the {@link Transfer} that delivers it.
 *
 * @param tokenId the minted token
 * @param owner   the initial owner of record (the source of the first transfer)
 */
public record TokenMinted(TokenId tokenId, Address owner) implements LedgerEvent {

    public TokenMinted {
        Objects.requireNonNull(tokenId, "tokenId");
        Objects.requireNonNull(owner, "owner");
    }
}
