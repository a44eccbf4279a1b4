// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.Objects;

import sh.latent.core.types.Address;

/**
 * Royalty terms of one token.
 *
 * @param recipient who receives royalty proceeds
 * @param bps       rate in basis points of the sale price
 */
public record RoyaltyTerm(Address recipient, int bps) {

    public RoyaltyTerm {
        Objects.requireNonNull(recipient, "recipient");
        if (bps < 0) {
            throw new IllegalArgumentException("bps must be non-negative, got " + bps);
        }
    }
}
