// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.latent.core.error.AlreadyMintedException;
import sh.latent.core.error.TransferRejectedException;
import sh.latent.core.error.UnauthorizedException;
import sh.latent.core.error.UnknownTokenException;
import sh.latent.core.event.Approval;
import sh.latent.core.event.ApprovalForAll;
import sh.latent.core.event.Transfer;
import sh.latent.core.types.Address;
import sh.latent.core.types.InterfaceId;
import sh.latent.core.types.TokenId;

class StandardOwnershipLedgerTest {

    private static final Address ALICE = new Address("0x" + "a".repeat(40));
    private static final Address BOB = new Address("0x" + "b".repeat(40));
    private static final Address CAROL = new Address("0x" + "c".repeat(40));
    private static final TokenId ID = TokenId.of(1);

    private Journal journal;
    private EventLog events;
    private ReceiverDirectory receivers;
    private StandardOwnershipLedger ledger;

    @BeforeEach
    void setUp() {
        journal = new Journal();
        events = new EventLog(journal);
        receivers = new ReceiverDirectory();
        ledger = new StandardOwnershipLedger(journal, events, receivers);
        ledger.mint(ID, ALICE);
    }

    @Test
    void mintCreatesOwnershipAndEmitsTransferFromZero() {
        assertTrue(ledger.exists(ID));
        assertEquals(ALICE, ledger.ownerOf(ID));
        assertEquals(1, ledger.balanceOf(ALICE));
        assertEquals(new Transfer(Address.ZERO, ALICE, ID), events.events().get(0));
    }

    @Test
    void mintRejectsZeroOwnerAndExistingToken() {
        assertThrows(TransferRejectedException.class, () -> ledger.mint(TokenId.of(2), Address.ZERO));
        assertThrows(AlreadyMintedException.class, () -> ledger.mint(ID, BOB));
        assertEquals(ALICE, ledger.ownerOf(ID));
    }

    @Test
    void queriesOnUnownedTokens() {
        assertThrows(UnknownTokenException.class, () -> ledger.ownerOf(TokenId.of(2)));
        assertThrows(UnknownTokenException.class, () -> ledger.getApproved(TokenId.of(2)));
        assertThrows(IllegalArgumentException.class, () -> ledger.balanceOf(Address.ZERO));
        assertEquals(0, ledger.balanceOf(BOB));
    }

    @Test
    void ownerTransfers() {
        ledger.transfer(ALICE, ALICE, BOB, ID);

        assertEquals(BOB, ledger.ownerOf(ID));
        assertEquals(0, ledger.balanceOf(ALICE));
        assertEquals(1, ledger.balanceOf(BOB));
        assertEquals(new Transfer(ALICE, BOB, ID), events.events().get(events.size() - 1));
    }

    @Test
    void approvedSpenderTransfersOnceAndApprovalIsCleared() {
        ledger.approve(ALICE, BOB, ID);
        assertEquals(BOB, ledger.getApproved(ID));
        assertEquals(new Approval(ALICE, BOB, ID), events.events().get(events.size() - 1));

        ledger.transfer(BOB, ALICE, CAROL, ID);

        assertEquals(CAROL, ledger.ownerOf(ID));
        assertEquals(Address.ZERO, ledger.getApproved(ID));
    }

    @Test
    void operatorTransfersAndApproves() {
        ledger.setApprovalForAll(ALICE, BOB, true);
        assertTrue(ledger.isApprovedForAll(ALICE, BOB));
        assertEquals(new ApprovalForAll(ALICE, BOB, true), events.events().get(events.size() - 1));

        ledger.approve(BOB, CAROL, ID);
        assertEquals(CAROL, ledger.getApproved(ID));

        ledger.transfer(BOB, ALICE, BOB, ID);
        assertEquals(BOB, ledger.ownerOf(ID));

        ledger.setApprovalForAll(ALICE, BOB, false);
        assertFalse(ledger.isApprovedForAll(ALICE, BOB));
    }

    @Test
    void strangerCannotTransferOrApprove() {
        var e = assertThrows(UnauthorizedException.class, () -> ledger.transfer(BOB, ALICE, BOB, ID));
        assertEquals(BOB, e.caller());
        assertEquals(ID, e.tokenId());
        assertThrows(UnauthorizedException.class, () -> ledger.approve(BOB, CAROL, ID));
        assertEquals(ALICE, ledger.ownerOf(ID));
    }

    @Test
    void wrongSourceAndZeroDestinationAreRejected() {
        assertThrows(TransferRejectedException.class, () -> ledger.transfer(ALICE, BOB, CAROL, ID));
        assertThrows(TransferRejectedException.class, () -> ledger.transfer(ALICE, ALICE, Address.ZERO, ID));
        assertEquals(ALICE, ledger.ownerOf(ID));
    }

    @Test
    void selfApprovalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ledger.approve(ALICE, ALICE, ID));
        assertThrows(IllegalArgumentException.class, () -> ledger.setApprovalForAll(ALICE, ALICE, true));
    }

    @Test
    void hookRunsBeforeOwnershipChecks() {
        List<TokenId> seen = new ArrayList<>();
        ledger.setTransferHook((id, from, to) -> {
            seen.add(id);
            throw new UnknownTokenException(id);
        });

        assertThrows(UnknownTokenException.class, () -> ledger.transfer(BOB, BOB, CAROL, ID));
        assertEquals(List.of(ID), seen);
        assertEquals(ALICE, ledger.ownerOf(ID));
    }

    @Test
    void abortedTransferRestoresBalancesAndApproval() {
        ledger.approve(ALICE, BOB, ID);

        assertThrows(IllegalStateException.class, () -> journal.atomically("transfer", () -> {
            ledger.transfer(BOB, ALICE, CAROL, ID);
            throw new IllegalStateException();
        }));

        assertEquals(ALICE, ledger.ownerOf(ID));
        assertEquals(BOB, ledger.getApproved(ID));
        assertEquals(1, ledger.balanceOf(ALICE));
        assertEquals(0, ledger.balanceOf(CAROL));
    }

    @Test
    void safeTransferWithoutReceiverBehavesLikeTransfer() {
        ledger.safeTransfer(ALICE, ALICE, BOB, ID, new byte[0]);
        assertEquals(BOB, ledger.ownerOf(ID));
    }

    @Test
    void receiverGetsOperatorSourceAndData() {
        List<Object> calls = new ArrayList<>();
        receivers.register(CAROL, (operator, from, id, data) -> {
            calls.add(operator);
            calls.add(from);
            calls.add(id);
            calls.add(new String(data, StandardCharsets.UTF_8));
            return TokenReceiver.ACCEPTED;
        });
        ledger.setApprovalForAll(ALICE, BOB, true);

        ledger.safeTransfer(BOB, ALICE, CAROL, ID, "hi".getBytes(StandardCharsets.UTF_8));

        assertEquals(List.of(BOB, ALICE, ID, "hi"), calls);
        assertEquals(CAROL, ledger.ownerOf(ID));
    }

    @Test
    void refusingReceiverAbortsTheWholeTransfer() {
        receivers.register(BOB, (operator, from, id, data) -> InterfaceId.of("0xdeadbeef"));

        assertThrows(TransferRejectedException.class,
                () -> journal.atomically("safeTransfer", () -> ledger.safeTransfer(ALICE, ALICE, BOB, ID, new byte[0])));

        assertEquals(ALICE, ledger.ownerOf(ID));
        assertEquals(0, ledger.balanceOf(BOB));
    }

    @Test
    void failingReceiverIsWrapped() {
        IllegalStateException failure = new IllegalStateException("no");
        receivers.register(BOB, (operator, from, id, data) -> {
            throw failure;
        });

        var e = assertThrows(TransferRejectedException.class,
                () -> journal.atomically("safeTransfer", () -> ledger.safeTransfer(ALICE, ALICE, BOB, ID, new byte[0])));

        assertSame(failure, e.getCause());
        assertEquals(ALICE, ledger.ownerOf(ID));
    }

    @Test
    void ledgerErrorsFromReceiverPropagateUnchanged() {
        UnauthorizedException failure = new UnauthorizedException(BOB, ID, "nested");
        receivers.register(BOB, (operator, from, id, data) -> {
            throw failure;
        });

        var e = assertThrows(UnauthorizedException.class,
                () -> journal.atomically("safeTransfer", () -> ledger.safeTransfer(ALICE, ALICE, BOB, ID, new byte[0])));

        assertSame(failure, e);
    }
}
