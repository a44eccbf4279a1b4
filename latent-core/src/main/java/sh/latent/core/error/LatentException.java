// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.error;

/**
 * Base runtime exception for all latent failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * LatentException
 * ├── {@link EventEncodingException} - event export failures
 * └── {@link LedgerException} - a ledger operation was rejected (tagged with a {@link LedgerException.Reason})
 *     ├── {@link EmptyDescriptorException}
 *     ├── {@link DuplicateMetadataException}
 *     ├── {@link UnknownTokenException}
 *     ├── {@link AlreadyMintedException}
 *     ├── {@link UnauthorizedException}
 *     ├── {@link RoyaltyTooHighException}
 *     └── {@link TransferRejectedException}
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     ledger.prepare(creator, descriptor);
 * } catch (DuplicateMetadataException e) {
 *     // descriptor already claimed by e.existingId()
 * } catch (LedgerException e) {
 *     log.warn("rejected: {}", e.reason());
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class LatentException extends RuntimeException
        permits EventEncodingException,
        LedgerException {

    public LatentException(final String message) {
        super(message);
    }

    public LatentException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
