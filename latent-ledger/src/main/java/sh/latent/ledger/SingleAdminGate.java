// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.latent.core.error.UnauthorizedException;
import sh.latent.core.event.AdminTransferred;
import sh.latent.core.types.Address;

/**
 * {@link AdminGate} with one administrator ({@code Ownable}). An administrator of
 * {@link Address#ZERO} means nobody can pass the gate.
 */
public final class SingleAdminGate implements AdminGate {

    private static final Logger log = LoggerFactory.getLogger(SingleAdminGate.class);

    private final Journal journal;
    private final EventLog events;
    private Address admin;

    public SingleAdminGate(final Journal journal, final EventLog events, final Address admin) {
        this.journal = Objects.requireNonNull(journal, "journal");
        this.events = Objects.requireNonNull(events, "events");
        this.admin = Objects.requireNonNull(admin, "admin");
    }

    @Override
    public Address admin() {
        return admin;
    }

    @Override
    public void requireAdmin(final Address caller) {
        Objects.requireNonNull(caller, "caller");
        if (admin.isZero() || !admin.equals(caller)) {
            throw new UnauthorizedException(caller, null, "caller is not the ledger administrator");
        }
    }

    @Override
    public void transferAdmin(final Address caller, final Address next) {
        Objects.requireNonNull(next, "next");
        requireAdmin(caller);
        if (next.isZero()) {
            throw new IllegalArgumentException("new administrator is the zero address");
        }
        change(next);
    }

    @Override
    public void renounceAdmin(final Address caller) {
        requireAdmin(caller);
        change(Address.ZERO);
    }

    private void change(final Address next) {
        final Address previous = admin;
        admin = next;
        journal.record(() -> admin = previous);
        events.append(new AdminTransferred(previous, next));
        log.info("Ledger administrator changed from {} to {}", previous.value(), next.value());
    }
}
