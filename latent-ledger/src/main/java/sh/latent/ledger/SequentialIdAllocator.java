// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.Objects;

import sh.latent.core.types.TokenId;

/**
 * Issues token ids 1, 2, 3, ... with no gaps and no reuse.
 *
 * <p>Each issuance is journaled, so an id taken by an operation that later aborts
 * is handed out again by the next successful one. The last issued id therefore
 * always equals the number of prepared tokens.
 *
 * @since 0.1.0
 */
public final class SequentialIdAllocator {

    private final Journal journal;
    private TokenId current = TokenId.of(0);

    public SequentialIdAllocator(final Journal journal) {
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    /**
     * Issues the next id.
     *
     * @return an id one greater than the previously issued one (1 on first call)
     */
    public TokenId next() {
        final TokenId previous = current;
        current = previous.next();
        journal.record(() -> current = previous);
        return current;
    }

    /**
     * Returns the last issued id, or {@code TokenId(0)} if none has been issued.
     */
    public TokenId current() {
        return current;
    }
}
