// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.types;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A non-negative quantity in Wei.
 * <p>
 * Sale prices handed to royalty queries and the royalty amounts they report are
 * expressed in this unit. Arithmetic is arbitrary precision, so products of a
 * {@code uint256}-sized price and a basis-point rate never overflow.
 *
 * @since 0.1.0
 */
public record Wei(BigInteger value) {

    public static final Wei ZERO = new Wei(BigInteger.ZERO);

    private static final BigInteger GWEI_MULTIPLIER = BigInteger.valueOf(1_000_000_000L);

    public Wei {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Wei must be non-negative");
        }
    }

    public static Wei of(final long wei) {
        return new Wei(BigInteger.valueOf(wei));
    }

    public static Wei of(final BigInteger wei) {
        return new Wei(wei);
    }

    public static Wei gwei(final long gwei) {
        return new Wei(BigInteger.valueOf(gwei).multiply(GWEI_MULTIPLIER));
    }

    @com.fasterxml.jackson.annotation.JsonValue
    public String toHexString() {
        return "0x" + value.toString(16);
    }
}
