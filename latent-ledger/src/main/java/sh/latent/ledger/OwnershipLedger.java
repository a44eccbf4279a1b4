// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import sh.latent.core.types.Address;
import sh.latent.core.types.TokenId;

/**
 * Transferable-ownership bookkeeping: who owns each minted token, balances, approvals
 * and transfer authorization (ERC-721 semantics).
 *
 * <p>The deferred-minting core does not implement these rules; it reaches them only
 * through this interface. {@link StandardOwnershipLedger} is the stock implementation.
 *
 * @see <a href="https://eips.ethereum.org/EIPS/eip-721">EIP-721</a>
 */
public interface OwnershipLedger {

    /** Returns {@code true} if the token has an owner. */
    boolean exists(TokenId id);

    /**
     * @throws sh.latent.core.error.UnknownTokenException if the token has no owner
     */
    Address ownerOf(TokenId id);

    /**
     * @throws IllegalArgumentException for the zero address
     */
    long balanceOf(Address owner);

    /**
     * Creates the token under {@code owner}.
     *
     * @throws sh.latent.core.error.AlreadyMintedException     if the token already has an owner
     * @throws sh.latent.core.error.TransferRejectedException if {@code owner} is the zero address
     */
    void mint(TokenId id, Address owner);

    /**
     * Approves {@code spender} to transfer one token; {@link Address#ZERO} clears it.
     *
     * @throws sh.latent.core.error.UnauthorizedException if {@code caller} is neither owner nor operator
     */
    void approve(Address caller, Address spender, TokenId id);

    /**
     * Returns the approved spender of a token, or {@link Address#ZERO}.
     *
     * @throws sh.latent.core.error.UnknownTokenException if the token has no owner
     */
    Address getApproved(TokenId id);

    void setApprovalForAll(Address caller, Address operator, boolean approved);

    boolean isApprovedForAll(Address owner, Address operator);

    /**
     * Moves a token from {@code from} to {@code to}. The installed {@link TransferHook}
     * runs first.
     *
     * @throws sh.latent.core.error.UnknownTokenException     if the token does not exist
     * @throws sh.latent.core.error.TransferRejectedException if {@code from} is not the owner or {@code to} is zero
     * @throws sh.latent.core.error.UnauthorizedException     if {@code caller} is not owner, approved or operator
     */
    void transfer(Address caller, Address from, Address to, TokenId id);

    /**
     * As {@link #transfer}, then delivers the token to {@code to}'s {@link TokenReceiver},
     * if it has one. The receiver runs after ownership has changed.
     *
     * @throws sh.latent.core.error.TransferRejectedException if the receiver refuses the token
     */
    void safeTransfer(Address caller, Address from, Address to, TokenId id, byte[] data);
}
