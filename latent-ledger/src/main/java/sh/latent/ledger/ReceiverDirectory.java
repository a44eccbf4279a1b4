// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import sh.latent.core.types.Address;

/**
 * Which addresses carry {@link TokenReceiver} code. Addresses without an entry are
 * plain accounts that accept tokens unconditionally.
 */
public final class ReceiverDirectory {

    private final Map<Address, TokenReceiver> receivers = new ConcurrentHashMap<>();

    public void register(final Address address, final TokenReceiver receiver) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(receiver, "receiver");
        receivers.put(address, receiver);
    }

    public void unregister(final Address address) {
        receivers.remove(address);
    }

    public Optional<TokenReceiver> find(final Address address) {
        return Optional.ofNullable(receivers.get(address));
    }
}
