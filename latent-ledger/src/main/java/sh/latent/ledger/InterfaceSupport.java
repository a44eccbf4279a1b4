// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import sh.latent.core.types.InterfaceId;

/**
 * ERC-165 capability advertisement.
 *
 * @see <a href="https://eips.ethereum.org/EIPS/eip-165">EIP-165</a>
 */
@FunctionalInterface
public interface InterfaceSupport {

    InterfaceId ERC165 = InterfaceId.of("0x01ffc9a7");
    InterfaceId ERC721 = InterfaceId.of("0x80ac58cd");
    InterfaceId ERC721_METADATA = InterfaceId.of("0x5b5e139f");
    InterfaceId ERC2981 = InterfaceId.of("0x2a55205a");

    /** Never supported, per ERC-165. */
    InterfaceId INVALID = InterfaceId.of("0xffffffff");

    boolean supportsInterface(InterfaceId id);

    /**
     * Support for exactly the given ids. {@link #INVALID} is always rejected.
     */
    static InterfaceSupport of(final InterfaceId... ids) {
        final Set<InterfaceId> supported = Arrays.stream(ids).collect(Collectors.toUnmodifiableSet());
        return id -> !INVALID.equals(id) && supported.contains(id);
    }

    /** ERC-165, ERC-721, ERC-721 Metadata and ERC-2981. */
    static InterfaceSupport standard() {
        return of(ERC165, ERC721, ERC721_METADATA, ERC2981);
    }
}
