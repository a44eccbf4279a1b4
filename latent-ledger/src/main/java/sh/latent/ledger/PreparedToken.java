// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.latent.core.types.Address;
import sh.latent.core.types.Hash;
import sh.latent.core.types.TokenId;

/**
 * Registry record of a prepared token.
 *
 * <p>{@code creator}, {@code descriptor} and {@code descriptorHash} never change.
 * {@code initialOwner} is {@code null} until the token is minted, and set exactly once.
 * Current ownership after mint is tracked by the {@link OwnershipLedger}.
 *
 * @param id             the token id
 * @param creator        the identity that prepared the token
 * @param descriptor     the metadata pointer
 * @param descriptorHash Keccak-256 of the descriptor's UTF-8 bytes
 * @param initialOwner   the owner of record at mint time, or {@code null} while unminted
 */
public record PreparedToken(
        TokenId id,
        Address creator,
        String descriptor,
        Hash descriptorHash,
        @Nullable Address initialOwner) {

    public PreparedToken {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(creator, "creator");
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(descriptorHash, "descriptorHash");
    }

    public boolean minted() {
        return initialOwner != null;
    }

    PreparedToken mintedTo(final Address owner) {
        return new PreparedToken(id, creator, descriptor, descriptorHash, Objects.requireNonNull(owner, "owner"));
    }
}
