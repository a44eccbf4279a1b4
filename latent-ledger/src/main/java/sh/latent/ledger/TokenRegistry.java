// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.latent.core.DebugLogger;
import sh.latent.core.LogFormatter;
import sh.latent.core.crypto.Keccak256;
import sh.latent.core.error.AlreadyMintedException;
import sh.latent.core.error.DuplicateMetadataException;
import sh.latent.core.error.EmptyDescriptorException;
import sh.latent.core.error.UnknownTokenException;
import sh.latent.core.event.TokenMinted;
import sh.latent.core.event.TokenPrepared;
import sh.latent.core.types.Address;
import sh.latent.core.types.Hash;
import sh.latent.core.types.TokenId;

/**
 * Authoritative record of prepared tokens: creator, descriptor and mint status.
 *
 * <p>Preparation claims the descriptor hash in the {@link MetadataUniquenessIndex}
 * before an id is taken from the {@link SequentialIdAllocator}. A duplicate therefore
 * fails before any id is consumed; any later failure is undone by the {@link Journal}.
 *
 * <p>{@link #markMinted(TokenId, Address)} is the only writer of the minted flag and
 * is reachable only from {@link MintGate}, which is what keeps every token minted at
 * most once.
 *
 * @since 0.1.0
 */
public final class TokenRegistry {

    private static final Logger log = LoggerFactory.getLogger(TokenRegistry.class);

    private final Journal journal;
    private final EventLog events;
    private final SequentialIdAllocator allocator;
    private final MetadataUniquenessIndex index;
    private final Map<TokenId, PreparedToken> tokens = new HashMap<>();

    public TokenRegistry(
            final Journal journal,
            final EventLog events,
            final SequentialIdAllocator allocator,
            final MetadataUniquenessIndex index) {
        this.journal = Objects.requireNonNull(journal, "journal");
        this.events = Objects.requireNonNull(events, "events");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.index = Objects.requireNonNull(index, "index");
    }

    /**
     * Registers a new token descriptor on behalf of {@code creator}.
     *
     * <p>Runs as its own {@link Journal} unit. When called inside a larger unit, the id
     * allocation, the hash claim and the record are rolled back together if anything
     * later in that unit fails.
     *
     * @param creator    the identity preparing the token
     * @param descriptor the metadata pointer, non-empty
     * @return the newly issued id
     * @throws EmptyDescriptorException    if {@code descriptor} is empty
     * @throws DuplicateMetadataException if the descriptor was already prepared; no id is consumed
     */
    public TokenId prepare(final Address creator, final String descriptor) {
        Objects.requireNonNull(creator, "creator");
        Objects.requireNonNull(descriptor, "descriptor");
        if (descriptor.isEmpty()) {
            throw new EmptyDescriptorException();
        }
        return journal.atomically("prepare", () -> register(creator, descriptor));
    }

    private TokenId register(final Address creator, final String descriptor) {
        final Hash descriptorHash = Keccak256.hashUtf8(descriptor);
        final Optional<TokenId> claimed = index.lookup(descriptorHash);
        if (claimed.isPresent()) {
            throw new DuplicateMetadataException(descriptorHash, claimed.get());
        }
        final TokenId id = allocator.next();
        index.register(descriptorHash, id);

        tokens.put(id, new PreparedToken(id, creator, descriptor, descriptorHash, null));
        journal.record(() -> tokens.remove(id));
        events.append(new TokenPrepared(id, creator, descriptor));

        log.debug("Prepared token {} for creator {}", id.value(), creator.value());
        DebugLogger.logLedger(LogFormatter.formatPrepare(id, creator, descriptor));
        return id;
    }

    /**
     * Returns {@code true} iff {@code 1 <= id <= currentTokenId()}.
     */
    public boolean exists(final TokenId id) {
        Objects.requireNonNull(id, "id");
        return id.value().signum() > 0 && id.compareTo(allocator.current()) <= 0;
    }

    /**
     * Records the first owner of a prepared token and flips its minted flag.
     *
     * @param id    the token
     * @param owner the initial owner of record
     * @throws UnknownTokenException  if {@code id} was never prepared
     * @throws AlreadyMintedException if the token is already minted
     */
    void markMinted(final TokenId id, final Address owner) {
        Objects.requireNonNull(owner, "owner");
        final PreparedToken token = require(id);
        if (token.minted()) {
            throw new AlreadyMintedException(id);
        }

        tokens.put(id, token.mintedTo(owner));
        journal.record(() -> tokens.put(id, token));
        events.append(new TokenMinted(id, owner));

        log.debug("Minted token {} to {}", id.value(), owner.value());
        DebugLogger.logLedger(LogFormatter.formatMint(id, owner));
    }

    /**
     * Returns whether the token has been minted. Unknown ids report {@code false}.
     */
    public boolean isMinted(final TokenId id) {
        final PreparedToken token = tokens.get(Objects.requireNonNull(id, "id"));
        return token != null && token.minted();
    }

    /**
     * @throws UnknownTokenException if {@code id} was never prepared
     */
    public Address creatorOf(final TokenId id) {
        return require(id).creator();
    }

    /**
     * @throws UnknownTokenException if {@code id} was never prepared
     */
    public String descriptorOf(final TokenId id) {
        return require(id).descriptor();
    }

    /**
     * @throws UnknownTokenException if {@code id} was never prepared
     */
    public Hash descriptorHashOf(final TokenId id) {
        return require(id).descriptorHash();
    }

    public Optional<PreparedToken> find(final TokenId id) {
        return Optional.ofNullable(tokens.get(Objects.requireNonNull(id, "id")));
    }

    /**
     * Returns the token that prepared {@code descriptor}, if any.
     */
    public Optional<TokenId> findByDescriptor(final String descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        return index.lookup(Keccak256.hashUtf8(descriptor));
    }

    /**
     * Returns the highest issued id, which is also the number of prepared tokens.
     */
    public TokenId currentTokenId() {
        return allocator.current();
    }

    private PreparedToken require(final TokenId id) {
        final PreparedToken token = tokens.get(Objects.requireNonNull(id, "id"));
        if (token == null) {
            throw new UnknownTokenException(id);
        }
        return token;
    }
}
