// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import sh.latent.core.error.DuplicateMetadataException;
import sh.latent.core.types.Hash;
import sh.latent.core.types.TokenId;

/**
 * Maps descriptor content hashes to the token that claimed them.
 *
 * <p>A hash can be claimed once; the mapping is injective for the life of the ledger.
 *
 * @since 0.1.0
 */
public final class MetadataUniquenessIndex {

    private final Journal journal;
    private final Map<Hash, TokenId> claims = new HashMap<>();

    public MetadataUniquenessIndex(final Journal journal) {
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    /**
     * Claims {@code hash} for {@code id}.
     *
     * @param hash the descriptor content hash
     * @param id   the token claiming it
     * @throws DuplicateMetadataException if the hash is already claimed; nothing is changed
     */
    public void register(final Hash hash, final TokenId id) {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(id, "id");
        final TokenId existing = claims.get(hash);
        if (existing != null) {
            throw new DuplicateMetadataException(hash, existing);
        }
        claims.put(hash, id);
        journal.record(() -> claims.remove(hash));
    }

    /**
     * Returns the token that claimed {@code hash}, if any.
     */
    public Optional<TokenId> lookup(final Hash hash) {
        return Optional.ofNullable(claims.get(hash));
    }

    public boolean contains(final Hash hash) {
        return claims.containsKey(hash);
    }

    public int size() {
        return claims.size();
    }
}
