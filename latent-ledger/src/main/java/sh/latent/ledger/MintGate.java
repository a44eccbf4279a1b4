// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.latent.core.types.Address;
import sh.latent.core.types.TokenId;

/**
 * Pre-transfer hook that mints a prepared token on its first transfer.
 *
 * <p>When the token is not yet minted, the source of the transfer becomes its owner
 * of record: the registry flips the minted flag and the ownership ledger creates
 * the token under {@code from}. The ownership ledger then moves it to {@code to} as
 * for any other transfer. Both steps belong to the same {@link Journal} unit, so a
 * rejected transfer leaves the token unminted.
 *
 * <p>The minted flag is set before the ownership ledger runs any receiver callback.
 * A callback that transfers the same token again therefore finds it minted and
 * skips minting; minting it directly fails with
 * {@link sh.latent.core.error.AlreadyMintedException}.
 *
 * @since 0.1.0
 */
public final class MintGate implements TransferHook {

    private static final Logger log = LoggerFactory.getLogger(MintGate.class);

    private final TokenRegistry registry;
    private final OwnershipLedger ownership;

    public MintGate(final TokenRegistry registry, final OwnershipLedger ownership) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.ownership = Objects.requireNonNull(ownership, "ownership");
    }

    /**
     * @throws sh.latent.core.error.UnknownTokenException     if {@code id} was never prepared
     * @throws sh.latent.core.error.TransferRejectedException if {@code from} is the zero address
     */
    @Override
    public void beforeTransfer(final TokenId id, final Address from, final Address to) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(from, "from");
        if (registry.isMinted(id)) {
            return;
        }
        log.debug("First transfer of token {}: minting to {}", id.value(), from.value());
        registry.markMinted(id, from);
        ownership.mint(id, from);
    }
}
