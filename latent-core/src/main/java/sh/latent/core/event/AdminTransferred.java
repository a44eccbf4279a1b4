// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.event;

import java.util.Objects;

import sh.latent.core.types.Address;

/**
 * The ledger administrator changed. {@link Address#ZERO} as {@code next} means renounced.
 */
public record AdminTransferred(Address previous, Address next) implements LedgerEvent {

    public AdminTransferred {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(next, "next");
    }
}
