// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.error;

/**
 * Thrown when a token is prepared with an empty descriptor.
 *
 * @since 0.1.0
 */
public final class EmptyDescriptorException extends LedgerException {

    public EmptyDescriptorException() {
        super(Reason.EMPTY_DESCRIPTOR, null, "descriptor must not be empty");
    }
}
