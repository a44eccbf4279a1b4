// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import sh.latent.core.types.Address;
import sh.latent.core.types.InterfaceId;
import sh.latent.core.types.TokenId;

/**
 * Code attached to an address that runs when a token is safely transferred to it
 * ({@code IERC721Receiver.onERC721Received}).
 *
 * <p>The receiver sees the transfer already applied: the token is minted and owned
 * by the receiver's address. It may call back into the ledger; such calls join the
 * enclosing operation and are undone with it if the delivery fails.
 */
@FunctionalInterface
public interface TokenReceiver {

    /** {@code bytes4(keccak256("onERC721Received(address,address,uint256,bytes)"))}. */
    InterfaceId ACCEPTED = InterfaceId.of("0x150b7a02");

    /**
     * @param operator the caller that initiated the transfer
     * @param from     the previous owner
     * @param id       the delivered token
     * @param data     opaque data passed by the caller
     * @return {@link #ACCEPTED} to accept the token; anything else rejects it
     */
    InterfaceId onTokenReceived(Address operator, Address from, TokenId id, byte[] data);
}
