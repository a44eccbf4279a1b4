// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.latent.core.event.LedgerEvent;
import sh.latent.core.types.Address;
import sh.latent.core.types.InterfaceId;
import sh.latent.core.types.TokenId;
import sh.latent.core.types.Wei;

/**
 * Token ledger with deferred minting.
 *
 * <p>Creators {@link #prepare prepare} token descriptors without creating ownership.
 * A prepared token is minted on its first {@link #transfer transfer}: the transfer's
 * source becomes the owner of record and the token moves on to the recipient in the
 * same operation.
 *
 * <p>Example:
 * <pre>{@code
 * var ledger = DeferredMintLedger.create(LedgerOptions.defaults());
 * TokenId id = ledger.prepare(creator, "ipfs://bafy.../1.json");
 * ledger.setRoyalty(creator, id, creator, 500);           // 5%
 * ledger.transfer(creator, creator, buyer, id);            // mints to creator, delivers to buyer
 * RoyaltyInfo info = ledger.royaltyInfo(id, Wei.of(10_000)); // (creator, 500)
 * }</pre>
 *
 * <p>Every write runs as one {@link Journal} unit: it either completes with all of its
 * events, or fails with a {@link sh.latent.core.error.LedgerException} and changes
 * nothing. The {@code caller} argument is the authenticated invoker; establishing it
 * is the embedding environment's job.
 *
 * <p>Instances are independent; nothing is shared between ledgers. Not thread-safe:
 * operations must be sequenced by the caller.
 *
 * @since 0.1.0
 */
public final class DeferredMintLedger {

    private static final Logger log = LoggerFactory.getLogger(DeferredMintLedger.class);

    private static final byte[] NO_DATA = new byte[0];

    private final LedgerOptions options;
    private final Journal journal;
    private final EventLog events;
    private final TokenRegistry registry;
    private final RoyaltyLedger royalties;
    private final OwnershipLedger ownership;
    private final DescriptorStore descriptors;
    private final AdminGate adminGate;
    private final InterfaceSupport interfaces;
    private final ReceiverDirectory receivers;

    private DeferredMintLedger(final LedgerOptions options) {
        this.options = options;
        this.journal = new Journal();
        this.events = new EventLog(journal);
        this.registry = new TokenRegistry(
                journal, events, new SequentialIdAllocator(journal), new MetadataUniquenessIndex(journal));
        this.receivers = new ReceiverDirectory();

        final StandardOwnershipLedger standardOwnership = new StandardOwnershipLedger(journal, events, receivers);
        standardOwnership.setTransferHook(new MintGate(registry, standardOwnership));
        this.ownership = standardOwnership;

        this.royalties = new RoyaltyLedger(journal, events, registry);
        this.descriptors = new StandardDescriptorStore(journal, events, options.baseDescriptorPath());
        this.adminGate = new SingleAdminGate(journal, events, options.admin());
        this.interfaces = InterfaceSupport.standard();
    }

    /**
     * Creates a ledger with default options (no administrator, no base path).
     */
    public static DeferredMintLedger create() {
        return create(LedgerOptions.defaults());
    }

    public static DeferredMintLedger create(final LedgerOptions options) {
        Objects.requireNonNull(options, "options");
        log.debug("Creating ledger with {}", options);
        return new DeferredMintLedger(options);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Writes
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Registers a token descriptor; {@code caller} becomes the token's creator.
     *
     * @return the new token id (1 for the first token, then consecutive)
     * @throws sh.latent.core.error.EmptyDescriptorException   if {@code descriptor} is empty
     * @throws sh.latent.core.error.DuplicateMetadataException if the same descriptor was prepared before
     */
    public TokenId prepare(final Address caller, final String descriptor) {
        return journal.atomically("prepare", () -> registry.prepare(caller, descriptor));
    }

    /**
     * Sets the royalty terms of a token. Only its creator may do so, whoever owns it.
     *
     * @throws sh.latent.core.error.UnknownTokenException    if {@code id} was never prepared
     * @throws sh.latent.core.error.UnauthorizedException    if {@code caller} is not the creator
     * @throws sh.latent.core.error.RoyaltyTooHighException  if {@code bps} exceeds 10000
     */
    public void setRoyalty(final Address caller, final TokenId id, final Address recipient, final int bps) {
        journal.atomically("setRoyalty", () -> royalties.setRoyalty(caller, id, recipient, bps));
    }

    /**
     * Transfers a token, minting it to {@code from} first if this is its first transfer.
     *
     * @throws sh.latent.core.error.UnknownTokenException     if {@code id} was never prepared
     * @throws sh.latent.core.error.UnauthorizedException     if {@code caller} may not move the token
     * @throws sh.latent.core.error.TransferRejectedException if {@code from} is not the owner or {@code to} is zero
     */
    public void transfer(final Address caller, final Address from, final Address to, final TokenId id) {
        journal.atomically("transfer", () -> ownership.transfer(caller, from, to, id));
    }

    /**
     * As {@link #transfer}, then notifies {@code to}'s {@link TokenReceiver}, if any.
     */
    public void safeTransfer(final Address caller, final Address from, final Address to, final TokenId id) {
        safeTransfer(caller, from, to, id, NO_DATA);
    }

    public void safeTransfer(
            final Address caller, final Address from, final Address to, final TokenId id, final byte[] data) {
        journal.atomically("safeTransfer", () -> ownership.safeTransfer(caller, from, to, id, data));
    }

    public void approve(final Address caller, final Address spender, final TokenId id) {
        journal.atomically("approve", () -> ownership.approve(caller, spender, id));
    }

    public void setApprovalForAll(final Address caller, final Address operator, final boolean approved) {
        journal.atomically("setApprovalForAll", () -> ownership.setApprovalForAll(caller, operator, approved));
    }

    /**
     * Replaces the path prepended to descriptors by {@link #descriptorUri}.
     *
     * @throws sh.latent.core.error.UnauthorizedException if {@code caller} is not the administrator
     */
    public void setBaseDescriptorPath(final Address caller, final String path) {
        journal.atomically("setBaseDescriptorPath", () -> {
            adminGate.requireAdmin(caller);
            descriptors.setBasePath(path);
        });
    }

    public void transferAdmin(final Address caller, final Address next) {
        journal.atomically("transferAdmin", () -> adminGate.transferAdmin(caller, next));
    }

    public void renounceAdmin(final Address caller) {
        journal.atomically("renounceAdmin", () -> adminGate.renounceAdmin(caller));
    }

    /**
     * Attaches receiver code to an address; {@link #safeTransfer} calls it on delivery.
     */
    public void registerReceiver(final Address address, final TokenReceiver receiver) {
        receivers.register(address, receiver);
    }

    public void addListener(final EventListener listener) {
        events.addListener(listener);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Reads
    // ═══════════════════════════════════════════════════════════════════

    public boolean isMinted(final TokenId id) {
        return registry.isMinted(id);
    }

    /**
     * @throws sh.latent.core.error.UnknownTokenException if {@code id} was never prepared
     */
    public Address creatorOf(final TokenId id) {
        return registry.creatorOf(id);
    }

    /**
     * @throws sh.latent.core.error.UnknownTokenException if the token is not minted
     */
    public Address ownerOf(final TokenId id) {
        return ownership.ownerOf(id);
    }

    public long balanceOf(final Address owner) {
        return ownership.balanceOf(owner);
    }

    public Address getApproved(final TokenId id) {
        return ownership.getApproved(id);
    }

    public boolean isApprovedForAll(final Address owner, final Address operator) {
        return ownership.isApprovedForAll(owner, operator);
    }

    /**
     * Reports the royalty owed on a sale, or {@link RoyaltyInfo#NONE} when no terms are set.
     */
    public RoyaltyInfo royaltyInfo(final TokenId id, final Wei salePrice) {
        return royalties.royaltyInfo(id, salePrice);
    }

    /**
     * Returns the highest issued id: {@code TokenId(0)} before the first prepare.
     */
    public TokenId currentTokenId() {
        return registry.currentTokenId();
    }

    /**
     * Returns the metadata location of a prepared token ({@code tokenURI}), minted or not.
     *
     * @throws sh.latent.core.error.UnknownTokenException if {@code id} was never prepared
     */
    public String descriptorUri(final TokenId id) {
        return descriptors.resolve(registry.descriptorOf(id));
    }

    public String baseDescriptorPath() {
        return descriptors.basePath();
    }

    public Optional<PreparedToken> token(final TokenId id) {
        return registry.find(id);
    }

    public Optional<TokenId> findByDescriptor(final String descriptor) {
        return registry.findByDescriptor(descriptor);
    }

    public boolean supportsInterface(final InterfaceId id) {
        return interfaces.supportsInterface(Objects.requireNonNull(id, "id"));
    }

    public Address admin() {
        return adminGate.admin();
    }

    public List<LedgerEvent> events() {
        return events.events();
    }

    public <T extends LedgerEvent> List<T> events(final Class<T> type) {
        return events.ofType(type);
    }

    public LedgerOptions options() {
        return options;
    }
}
