// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.event;

import java.util.Objects;

import sh.latent.core.types.Address;
import sh.latent.core.types.TokenId;

/**
 * The owner approved {@code approved} to transfer one token. {@link Address#ZERO} clears the approval.
 */
public record Approval(Address owner, Address approved, TokenId tokenId) implements LedgerEvent {

    public Approval {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(approved, "approved");
        Objects.requireNonNull(tokenId, "tokenId");
    }
}
