// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.Objects;

import sh.latent.core.types.Address;
import sh.latent.core.types.Wei;

/**
 * ERC-2981 style royalty report for a given sale price.
 *
 * @param recipient who should receive the royalty ({@link Address#ZERO} when none is configured)
 * @param amount    the royalty owed for the queried sale price
 */
public record RoyaltyInfo(Address recipient, Wei amount) {

    /** Result reported for tokens without royalty terms. */
    public static final RoyaltyInfo NONE = new RoyaltyInfo(Address.ZERO, Wei.ZERO);

    public RoyaltyInfo {
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(amount, "amount");
    }
}
