// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.latent.core.DebugLogger;
import sh.latent.core.LogFormatter;
import sh.latent.core.error.RoyaltyTooHighException;
import sh.latent.core.error.UnauthorizedException;
import sh.latent.core.event.RoyaltySet;
import sh.latent.core.types.Address;
import sh.latent.core.types.TokenId;
import sh.latent.core.types.Wei;

/**
 * Per-token royalty terms, writable only by the token's creator.
 *
 * <p>Authority comes from {@link TokenRegistry#creatorOf(TokenId)}, never from current
 * ownership, and does not depend on mint status. A new term replaces the old one.
 * Rates are basis points: at most {@value #MAX_BPS}, and the royalty owed is computed
 * against that same denominator.
 *
 * @since 0.1.0
 */
public final class RoyaltyLedger {

    /** Highest accepted rate, 100%. */
    public static final int MAX_BPS = 10_000;

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(MAX_BPS);

    private static final Logger log = LoggerFactory.getLogger(RoyaltyLedger.class);

    private final Journal journal;
    private final EventLog events;
    private final TokenRegistry registry;
    private final Map<TokenId, RoyaltyTerm> terms = new HashMap<>();

    public RoyaltyLedger(
            final Journal journal,
            final EventLog events,
            final TokenRegistry registry) {
        this.journal = Objects.requireNonNull(journal, "journal");
        this.events = Objects.requireNonNull(events, "events");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Sets the royalty terms of a token, replacing any previous terms.
     *
     * @param caller    the invoking identity; must be the token's creator
     * @param id        the token
     * @param recipient who receives royalties
     * @param bps       rate in basis points, at most {@value #MAX_BPS}
     * @throws sh.latent.core.error.UnknownTokenException if {@code id} was never prepared
     * @throws UnauthorizedException                         if {@code caller} is not the creator
     * @throws RoyaltyTooHighException                       if {@code bps} exceeds {@value #MAX_BPS}
     * @throws IllegalArgumentException                      if {@code bps} is negative
     */
    public void setRoyalty(final Address caller, final TokenId id, final Address recipient, final int bps) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(recipient, "recipient");
        journal.atomically("setRoyalty", () -> apply(caller, id, recipient, bps));
    }

    private void apply(final Address caller, final TokenId id, final Address recipient, final int bps) {
        final Address creator = registry.creatorOf(id);
        if (!creator.equals(caller)) {
            throw new UnauthorizedException(caller, id,
                    "only the creator of token " + id.value() + " may set its royalty");
        }
        if (bps > MAX_BPS) {
            throw new RoyaltyTooHighException(id, bps, MAX_BPS);
        }

        final RoyaltyTerm term = new RoyaltyTerm(recipient, bps);
        final RoyaltyTerm previous = terms.put(id, term);
        journal.record(() -> {
            if (previous == null) {
                terms.remove(id);
            } else {
                terms.put(id, previous);
            }
        });
        events.append(new RoyaltySet(id, recipient, bps));

        log.debug("Royalty for token {} set to {} bps for {}", id.value(), bps, recipient.value());
        DebugLogger.logLedger(LogFormatter.formatRoyalty(id, recipient, bps));
    }

    /**
     * Reports the royalty owed on a sale: {@code floor(salePrice * bps / 10000)}.
     * Tokens without terms, including unknown ids, report {@link RoyaltyInfo#NONE}.
     *
     * @param id        the token
     * @param salePrice the sale price
     * @return recipient and amount
     */
    public RoyaltyInfo royaltyInfo(final TokenId id, final Wei salePrice) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(salePrice, "salePrice");
        final RoyaltyTerm term = terms.get(id);
        if (term == null) {
            return RoyaltyInfo.NONE;
        }
        final BigInteger amount = salePrice.value()
                .multiply(BigInteger.valueOf(term.bps()))
                .divide(BPS_DENOMINATOR);
        return new RoyaltyInfo(term.recipient(), Wei.of(amount));
    }

    public Optional<RoyaltyTerm> termOf(final TokenId id) {
        return Optional.ofNullable(terms.get(Objects.requireNonNull(id, "id")));
    }
}
