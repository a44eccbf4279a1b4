// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.latent.primitives.Hex;

/**
 * ERC-165 interface identifier: the XOR of an interface's 4-byte function selectors.
 *
 * @param value {@code 0x}-prefixed, 8 hex characters, stored lowercase
 * @see <a href="https://eips.ethereum.org/EIPS/eip-165">EIP-165</a>
 * @since 0.1.0
 */
public record InterfaceId(String value) {
    private static final int BYTE_LENGTH = 4;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    public InterfaceId {
        Objects.requireNonNull(value, "interfaceId");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid interface id: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public static InterfaceId of(final String value) {
        return new InterfaceId(value);
    }

    public static InterfaceId fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Interface id must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new InterfaceId(Hex.encode(bytes));
    }
}
