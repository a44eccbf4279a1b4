// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import sh.latent.core.types.Hash;
import sh.latent.core.types.InterfaceId;
import sh.latent.primitives.Hex;

class Keccak256Test {

    @AfterEach
    void cleanup() {
        Keccak256.cleanup();
    }

    @Test
    void emptyInput() {
        assertEquals("0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470",
                Hex.encode(Keccak256.hash(new byte[0])));
    }

    @Test
    void helloVector() {
        assertEquals(new Hash("0x1c8aff950685c2ed4bc3174f3472287b56d9517b9c948127319a09a7a36deac8"),
                Keccak256.hashUtf8("hello"));
    }

    @Test
    void hashUtf8MatchesByteHash() {
        String text = "ipfs://bafybeigdyrzt5sfp7udm7hu76uh7y26nf3efuylqabf3oclgtqy55fbzdi/1.json";
        assertArrayEquals(Keccak256.hash(text.getBytes(StandardCharsets.UTF_8)),
                Keccak256.hashUtf8(text).toBytes());
    }

    @Test
    void selectorsMatchKnownInterfaceIds() {
        assertEquals(InterfaceId.of("0x150b7a02"), selector("onERC721Received(address,address,uint256,bytes)"));
        assertEquals(InterfaceId.of("0x2a55205a"), selector("royaltyInfo(uint256,uint256)"));
    }

    @Test
    void distinctDescriptorsHashDifferently() {
        assertNotEquals(Keccak256.hashUtf8("ipfs://a"), Keccak256.hashUtf8("ipfs://b"));
    }

    @Test
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> Keccak256.hash((byte[]) null));
        assertThrows(NullPointerException.class, () -> Keccak256.hashUtf8(null));
    }

    private static InterfaceId selector(String signature) {
        return InterfaceId.fromBytes(Arrays.copyOf(Keccak256.hash(signature.getBytes(StandardCharsets.UTF_8)), 4));
    }
}
