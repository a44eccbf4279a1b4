// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.latent.core.error.UnauthorizedException;
import sh.latent.core.event.AdminTransferred;
import sh.latent.core.types.Address;

class SingleAdminGateTest {

    private static final Address ADMIN = new Address("0x" + "a".repeat(40));
    private static final Address OTHER = new Address("0x" + "b".repeat(40));

    private final Journal journal = new Journal();
    private final EventLog events = new EventLog(journal);

    @Test
    void zeroAdminAdmitsNobody() {
        SingleAdminGate gate = new SingleAdminGate(journal, events, Address.ZERO);
        assertThrows(UnauthorizedException.class, () -> gate.requireAdmin(Address.ZERO));
    }

    @Test
    void transferToZeroIsRejected() {
        SingleAdminGate gate = new SingleAdminGate(journal, events, ADMIN);
        assertThrows(IllegalArgumentException.class, () -> gate.transferAdmin(ADMIN, Address.ZERO));
        assertEquals(ADMIN, gate.admin());
    }

    @Test
    void abortedHandOverRestoresAdmin() {
        SingleAdminGate gate = new SingleAdminGate(journal, events, ADMIN);

        assertThrows(IllegalStateException.class, () -> journal.atomically("transferAdmin", () -> {
            gate.transferAdmin(ADMIN, OTHER);
            throw new IllegalStateException();
        }));

        assertEquals(ADMIN, gate.admin());
        assertTrue(events.ofType(AdminTransferred.class).isEmpty());
        gate.requireAdmin(ADMIN);
    }
}
