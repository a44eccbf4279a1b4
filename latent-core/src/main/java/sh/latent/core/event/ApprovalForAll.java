// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.event;

import java.util.Objects;

import sh.latent.core.types.Address;

/**
 * The owner granted or revoked operator rights over all of its tokens.
 */
public record ApprovalForAll(Address owner, Address operator, boolean approved) implements LedgerEvent {

    public ApprovalForAll {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(operator, "operator");
    }
}
