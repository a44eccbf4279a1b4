// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import sh.latent.core.crypto.Keccak256;
import sh.latent.core.error.DuplicateMetadataException;
import sh.latent.core.types.Hash;
import sh.latent.core.types.TokenId;

class MetadataUniquenessIndexTest {

    private static final Hash A = Keccak256.hashUtf8("ipfs://a");
    private static final Hash B = Keccak256.hashUtf8("ipfs://b");

    private final Journal journal = new Journal();
    private final MetadataUniquenessIndex index = new MetadataUniquenessIndex(journal);

    @Test
    void registersAndLooksUp() {
        index.register(A, TokenId.of(1));
        index.register(B, TokenId.of(2));

        assertEquals(Optional.of(TokenId.of(1)), index.lookup(A));
        assertEquals(Optional.of(TokenId.of(2)), index.lookup(B));
        assertEquals(2, index.size());
    }

    @Test
    void duplicateFailsWithoutMutation() {
        index.register(A, TokenId.of(1));

        var e = assertThrows(DuplicateMetadataException.class, () -> index.register(A, TokenId.of(2)));

        assertEquals(TokenId.of(1), e.existingId());
        assertEquals(A, e.descriptorHash());
        assertEquals(Optional.of(TokenId.of(1)), index.lookup(A));
        assertEquals(1, index.size());
    }

    @Test
    void abortedClaimIsReleased() {
        assertThrows(IllegalStateException.class, () -> journal.atomically("aborted", () -> {
            index.register(A, TokenId.of(1));
            throw new IllegalStateException();
        }));

        assertFalse(index.contains(A));
        index.register(A, TokenId.of(1));
        assertTrue(index.contains(A));
    }
}
