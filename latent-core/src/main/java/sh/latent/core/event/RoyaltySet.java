// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.event;

import java.util.Objects;

import sh.latent.core.types.Address;
import sh.latent.core.types.TokenId;

/**
 * The creator set (or replaced) the royalty terms of a token.
 *
 * @param tokenId   the token
 * @param recipient who receives royalty proceeds
 * @param bps       the rate in basis points
 */
public record RoyaltySet(TokenId tokenId, Address recipient, int bps) implements LedgerEvent {

    public RoyaltySet {
        Objects.requireNonNull(tokenId, "tokenId");
        Objects.requireNonNull(recipient, "recipient");
    }
}
