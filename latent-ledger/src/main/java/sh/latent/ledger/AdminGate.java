// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import sh.latent.core.types.Address;

/**
 * Guards administrative operations such as changing the base descriptor path.
 */
public interface AdminGate {

    /** Returns the current administrator, {@link Address#ZERO} once renounced. */
    Address admin();

    /**
     * @throws sh.latent.core.error.UnauthorizedException if {@code caller} is not the administrator
     */
    void requireAdmin(Address caller);

    /**
     * Hands administration to {@code next}.
     *
     * @throws sh.latent.core.error.UnauthorizedException if {@code caller} is not the administrator
     * @throws IllegalArgumentException                      if {@code next} is the zero address
     */
    void transferAdmin(Address caller, Address next);

    /**
     * Gives up administration permanently.
     *
     * @throws sh.latent.core.error.UnauthorizedException if {@code caller} is not the administrator
     */
    void renounceAdmin(Address caller);
}
