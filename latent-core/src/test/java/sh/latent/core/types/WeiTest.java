// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.types;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

class WeiTest {

    @Test
    void rejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> Wei.of(-1));
        assertThrows(NullPointerException.class, () -> new Wei(null));
    }

    @Test
    void gweiConversion() {
        assertEquals(BigInteger.valueOf(2_000_000_000L), Wei.gwei(2).value());
    }

    @Test
    void hexString() {
        assertEquals("0x0", Wei.ZERO.toHexString());
        assertEquals("0x2710", Wei.of(10_000).toHexString());
    }
}
