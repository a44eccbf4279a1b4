// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.latent.core.error.AlreadyMintedException;
import sh.latent.core.error.LedgerException;
import sh.latent.core.error.TransferRejectedException;
import sh.latent.core.event.TokenMinted;
import sh.latent.core.types.Address;
import sh.latent.core.types.TokenId;

/**
 * Receiver callbacks that call back into the ledger while a first transfer is in flight.
 */
class ReentrancyTest {

    private static final Address CREATOR = new Address("0x" + "c".repeat(40));
    private static final Address RECEIVER = new Address("0x" + "1".repeat(40));
    private static final Address NEXT = new Address("0x" + "2".repeat(40));

    private Journal journal;
    private EventLog events;
    private TokenRegistry registry;
    private ReceiverDirectory receivers;
    private StandardOwnershipLedger ownership;
    private TokenId id;

    @BeforeEach
    void setUp() {
        journal = new Journal();
        events = new EventLog(journal);
        registry = new TokenRegistry(
                journal, events, new SequentialIdAllocator(journal), new MetadataUniquenessIndex(journal));
        receivers = new ReceiverDirectory();
        ownership = new StandardOwnershipLedger(journal, events, receivers);
        ownership.setTransferHook(new MintGate(registry, ownership));
        id = journal.atomically("prepare", () -> registry.prepare(CREATOR, "ipfs://1"));
    }

    private void safeTransfer(Address caller, Address from, Address to) {
        journal.atomically("safeTransfer", () -> ownership.safeTransfer(caller, from, to, id, new byte[0]));
    }

    @Test
    void callbackObservesMintedStateAndPassesTokenOn() {
        List<Object> observed = new ArrayList<>();
        receivers.register(RECEIVER, (operator, from, tokenId, data) -> {
            observed.add(registry.isMinted(tokenId));
            observed.add(ownership.ownerOf(tokenId));
            journal.atomically("transfer", () -> ownership.transfer(RECEIVER, RECEIVER, NEXT, tokenId));
            return TokenReceiver.ACCEPTED;
        });

        safeTransfer(CREATOR, CREATOR, RECEIVER);

        assertEquals(List.of(true, RECEIVER), observed);
        assertEquals(NEXT, ownership.ownerOf(id));
        assertEquals(List.of(new TokenMinted(id, CREATOR)), events.ofType(TokenMinted.class));
    }

    @Test
    void directMintFromCallbackFails() {
        List<LedgerException> caught = new ArrayList<>();
        receivers.register(RECEIVER, (operator, from, tokenId, data) -> {
            try {
                registry.markMinted(tokenId, RECEIVER);
            } catch (AlreadyMintedException e) {
                caught.add(e);
            }
            return TokenReceiver.ACCEPTED;
        });

        safeTransfer(CREATOR, CREATOR, RECEIVER);

        assertEquals(1, caught.size());
        assertEquals(CREATOR, registry.find(id).orElseThrow().initialOwner());
        assertEquals(1, events.ofType(TokenMinted.class).size());
    }

    @Test
    void propagatedCallbackFailureUndoesTheMint() {
        receivers.register(RECEIVER, (operator, from, tokenId, data) -> {
            registry.markMinted(tokenId, RECEIVER);
            return TokenReceiver.ACCEPTED;
        });

        assertThrows(AlreadyMintedException.class, () -> safeTransfer(CREATOR, CREATOR, RECEIVER));

        assertFalse(registry.isMinted(id));
        assertFalse(ownership.exists(id));
        assertEquals(1, events.size());
    }

    @Test
    void failedNestedTransferIsUndoneAloneWhenCaught() {
        receivers.register(RECEIVER, (operator, from, tokenId, data) -> {
            assertThrows(TransferRejectedException.class, () -> journal.atomically("transfer",
                    () -> ownership.transfer(RECEIVER, RECEIVER, Address.ZERO, tokenId)));
            return TokenReceiver.ACCEPTED;
        });

        safeTransfer(CREATOR, CREATOR, RECEIVER);

        assertEquals(RECEIVER, ownership.ownerOf(id));
        assertTrue(registry.isMinted(id));
    }
}
