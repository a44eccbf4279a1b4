// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import sh.latent.core.types.Address;
import sh.latent.core.types.TokenId;

/**
 * Invoked by the {@link OwnershipLedger} before it validates and applies a transfer.
 * Throwing aborts the transfer.
 */
@FunctionalInterface
public interface TransferHook {

    /** A hook that does nothing. */
    TransferHook NONE = (id, from, to) -> { };

    void beforeTransfer(TokenId id, Address from, Address to);
}
