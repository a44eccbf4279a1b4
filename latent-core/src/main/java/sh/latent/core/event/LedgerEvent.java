// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.event;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A notification appended to the ledger's event log for each state change.
 *
 * <p>Serialized with an {@code "event"} discriminator holding the record's simple
 * name, for example {@code {"event":"TokenMinted","tokenId":1,"owner":"0x..."}}.
 *
 * @since 0.1.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, include = JsonTypeInfo.As.PROPERTY, property = "event")
public sealed interface LedgerEvent
        permits TokenPrepared,
        TokenMinted,
        RoyaltySet,
        Transfer,
        Approval,
        ApprovalForAll,
        AdminTransferred,
        BasePathSet {
}
