// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.error;

/**
 * Thrown when ledger events cannot be serialized for export.
 *
 * @since 0.1.0
 */
public final class EventEncodingException extends LatentException {

    public EventEncodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
