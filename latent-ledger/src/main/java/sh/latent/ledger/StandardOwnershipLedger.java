// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.latent.core.DebugLogger;
import sh.latent.core.LogFormatter;
import sh.latent.core.error.AlreadyMintedException;
import sh.latent.core.error.LedgerException;
import sh.latent.core.error.TransferRejectedException;
import sh.latent.core.error.UnauthorizedException;
import sh.latent.core.error.UnknownTokenException;
import sh.latent.core.event.Approval;
import sh.latent.core.event.ApprovalForAll;
import sh.latent.core.event.Transfer;
import sh.latent.core.types.Address;
import sh.latent.core.types.InterfaceId;
import sh.latent.core.types.TokenId;

/**
 * In-memory {@link OwnershipLedger} with ERC-721 rules. Every mutation is journaled
 * and every state change appends the matching ERC-721 event.
 *
 * <p>Each write runs as its own {@link Journal} unit, so the {@link TransferHook}'s
 * work is undone together with a transfer that fails after it.
 *
 * @since 0.1.0
 */
public final class StandardOwnershipLedger implements OwnershipLedger {

    private static final Logger log = LoggerFactory.getLogger(StandardOwnershipLedger.class);

    private final Journal journal;
    private final EventLog events;
    private final ReceiverDirectory receivers;
    private final Map<TokenId, Address> owners = new HashMap<>();
    private final Map<Address, Long> balances = new HashMap<>();
    private final Map<TokenId, Address> tokenApprovals = new HashMap<>();
    private final Map<Address, Set<Address>> operators = new HashMap<>();
    private TransferHook hook = TransferHook.NONE;

    public StandardOwnershipLedger(final Journal journal, final EventLog events, final ReceiverDirectory receivers) {
        this.journal = Objects.requireNonNull(journal, "journal");
        this.events = Objects.requireNonNull(events, "events");
        this.receivers = Objects.requireNonNull(receivers, "receivers");
    }

    /**
     * Installs the hook run at the start of every transfer.
     *
     * @param hook the hook, {@link TransferHook#NONE} to remove
     */
    public void setTransferHook(final TransferHook hook) {
        this.hook = Objects.requireNonNull(hook, "hook");
    }

    @Override
    public boolean exists(final TokenId id) {
        return owners.containsKey(Objects.requireNonNull(id, "id"));
    }

    @Override
    public Address ownerOf(final TokenId id) {
        final Address owner = owners.get(Objects.requireNonNull(id, "id"));
        if (owner == null) {
            throw new UnknownTokenException(id, "token " + id.value() + " has no owner");
        }
        return owner;
    }

    @Override
    public long balanceOf(final Address owner) {
        Objects.requireNonNull(owner, "owner");
        if (owner.isZero()) {
            throw new IllegalArgumentException("zero address is not a valid owner");
        }
        return balances.getOrDefault(owner, 0L);
    }

    @Override
    public void mint(final TokenId id, final Address owner) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(owner, "owner");
        if (owner.isZero()) {
            throw new TransferRejectedException(id, "cannot mint token " + id.value() + " to the zero address");
        }
        if (owners.containsKey(id)) {
            throw new AlreadyMintedException(id);
        }
        journal.atomically("mint", () -> {
            write(owners, id, owner);
            adjustBalance(owner, 1);
            events.append(new Transfer(Address.ZERO, owner, id));
        });
    }

    @Override
    public void approve(final Address caller, final Address spender, final TokenId id) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(spender, "spender");
        final Address owner = ownerOf(id);
        if (spender.equals(owner)) {
            throw new IllegalArgumentException("approval to current owner");
        }
        if (!caller.equals(owner) && !isApprovedForAll(owner, caller)) {
            throw new UnauthorizedException(caller, id, "caller is neither owner nor operator of token " + id.value());
        }
        journal.atomically("approve", () -> {
            write(tokenApprovals, id, spender.isZero() ? null : spender);
            events.append(new Approval(owner, spender, id));
        });
    }

    @Override
    public Address getApproved(final TokenId id) {
        ownerOf(id);
        return tokenApprovals.getOrDefault(id, Address.ZERO);
    }

    @Override
    public void setApprovalForAll(final Address caller, final Address operator, final boolean approved) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(operator, "operator");
        if (caller.equals(operator)) {
            throw new IllegalArgumentException("cannot approve self as operator");
        }
        journal.atomically("setApprovalForAll", () -> {
            final Set<Address> granted = operators.computeIfAbsent(caller, k -> new HashSet<>());
            final boolean changed = approved ? granted.add(operator) : granted.remove(operator);
            if (changed) {
                journal.record(() -> {
                    if (approved) {
                        granted.remove(operator);
                    } else {
                        granted.add(operator);
                    }
                });
            }
            events.append(new ApprovalForAll(caller, operator, approved));
        });
    }

    @Override
    public boolean isApprovedForAll(final Address owner, final Address operator) {
        final Set<Address> granted = operators.get(owner);
        return granted != null && granted.contains(operator);
    }

    @Override
    public void transfer(final Address caller, final Address from, final Address to, final TokenId id) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(id, "id");
        journal.atomically("transfer", () -> move(caller, from, to, id));
    }

    private void move(final Address caller, final Address from, final Address to, final TokenId id) {
        hook.beforeTransfer(id, from, to);

        final Address owner = ownerOf(id);
        if (!owner.equals(from)) {
            throw new TransferRejectedException(id, "transfer of token " + id.value() + " from incorrect owner");
        }
        if (to.isZero()) {
            throw new TransferRejectedException(id, "transfer of token " + id.value() + " to the zero address");
        }
        if (!isApprovedOrOwner(caller, owner, id)) {
            throw new UnauthorizedException(caller, id,
                    "caller is not owner, approved or operator of token " + id.value());
        }

        write(tokenApprovals, id, null);
        adjustBalance(from, -1);
        adjustBalance(to, 1);
        write(owners, id, to);
        events.append(new Transfer(from, to, id));

        log.debug("Transferred token {} from {} to {}", id.value(), from.value(), to.value());
        DebugLogger.logLedger(LogFormatter.formatTransfer(id, from, to));
    }

    @Override
    public void safeTransfer(
            final Address caller, final Address from, final Address to, final TokenId id, final byte[] data) {
        Objects.requireNonNull(data, "data");
        journal.atomically("safeTransfer", () -> deliver(caller, from, to, id, data));
    }

    private void deliver(
            final Address caller, final Address from, final Address to, final TokenId id, final byte[] data) {
        transfer(caller, from, to, id);

        final Optional<TokenReceiver> receiver = receivers.find(to);
        if (receiver.isEmpty()) {
            return;
        }
        final InterfaceId answer;
        try {
            answer = receiver.get().onTokenReceived(caller, from, id, data.clone());
        } catch (LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransferRejectedException(id, "receiver " + to.value() + " failed: " + e.getMessage(), e);
        }
        if (!TokenReceiver.ACCEPTED.equals(answer)) {
            throw new TransferRejectedException(id, "receiver " + to.value() + " refused token " + id.value());
        }
    }

    private boolean isApprovedOrOwner(final Address spender, final Address owner, final TokenId id) {
        return spender.equals(owner)
                || isApprovedForAll(owner, spender)
                || spender.equals(tokenApprovals.get(id));
    }

    private void adjustBalance(final Address account, final long delta) {
        final long current = balances.getOrDefault(account, 0L);
        write(balances, account, current + delta == 0 ? null : current + delta);
    }

    private <K, V> void write(final Map<K, V> map, final K key, final @Nullable V value) {
        final V previous = value == null ? map.remove(key) : map.put(key, value);
        journal.record(() -> {
            if (previous == null) {
                map.remove(key);
            } else {
                map.put(key, previous);
            }
        });
    }
}
