// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.latent.primitives.Hex;

/**
 * Hex-encoded 20-byte account identity.
 * <p>
 * Used for token creators, owners, operators, royalty recipients and the
 * ledger administrator.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase, so two spellings of the same identity are equal.
 *
 * @since 0.1.0
 */
public record Address(@com.fasterxml.jackson.annotation.JsonValue String value) {
    private static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /**
     * The zero address.
     * <p>
     * Reported as the royalty recipient when no royalty is configured, and never
     * accepted as a token owner.
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns {@code true} if this is {@link #ZERO}.
     *
     * @return whether this address is the zero address
     */
    public boolean isZero() {
        return ZERO.equals(this);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address(Hex.encode(bytes));
    }
}
