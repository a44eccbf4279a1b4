// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.event;

import java.util.Objects;

import sh.latent.core.types.Address;
import sh.latent.core.types.TokenId;

/**
 * A token descriptor was registered. No owner exists yet.
 *
 * @param tokenId    the newly issued id
 * @param creator    the caller that prepared the token
 * @param descriptor the metadata pointer
 */
public record TokenPrepared(TokenId tokenId, Address creator, String descriptor) implements LedgerEvent {

    public TokenPrepared {
        Objects.requireNonNull(tokenId, "tokenId");
        Objects.requireNonNull(creator, "creator");
        Objects.requireNonNull(descriptor, "descriptor");
    }
}
