// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.event;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import sh.latent.core.error.EventEncodingException;

/**
 * JSON export of ledger events.
 *
 * <p>Identities and hashes are written as lowercase {@code 0x} strings and token ids
 * as JSON numbers:
 * <pre>{@code
 * {"event":"TokenPrepared","tokenId":1,"creator":"0x11...11","descriptor":"ipfs://a"}
 * }</pre>
 *
 * @since 0.1.0
 */
public final class LedgerEventCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectWriter WRITER = MAPPER.writerFor(LedgerEvent.class);

    private LedgerEventCodec() {}

    /**
     * Encodes a single event as a JSON object.
     *
     * @param event the event
     * @return the JSON text
     * @throws EventEncodingException if Jackson fails to serialize the event
     */
    public static String toJson(final LedgerEvent event) {
        Objects.requireNonNull(event, "event");
        try {
            return WRITER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventEncodingException("Failed to encode " + event.getClass().getSimpleName(), e);
        }
    }

    /**
     * Encodes events as JSON Lines: one object per line, in log order.
     *
     * @param events the events
     * @return newline-terminated JSON objects (empty string for no events)
     */
    public static String toJsonLines(final List<? extends LedgerEvent> events) {
        Objects.requireNonNull(events, "events");
        final StringBuilder out = new StringBuilder();
        for (LedgerEvent event : events) {
            out.append(toJson(event)).append('\n');
        }
        return out.toString();
    }
}
