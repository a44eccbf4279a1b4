// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import sh.latent.core.event.LedgerEvent;

/**
 * Receives ledger events after the operation that produced them has committed.
 * Events of aborted operations are never delivered.
 */
@FunctionalInterface
public interface EventListener {

    void onEvent(LedgerEvent event);
}
