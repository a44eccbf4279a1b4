// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.event;

import java.util.Objects;

import sh.latent.core.types.Address;
import sh.latent.core.types.TokenId;

/**
 * Ownership of a token moved from {@code from} to {@code to}.
 */
public record Transfer(Address from, Address to, TokenId tokenId) implements LedgerEvent {

    public Transfer {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(tokenId, "tokenId");
    }
}
