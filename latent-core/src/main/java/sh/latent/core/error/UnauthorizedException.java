// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.error;

import org.jspecify.annotations.Nullable;

import sh.latent.core.types.Address;
import sh.latent.core.types.TokenId;

/**
 * Thrown when the caller is not permitted to perform an operation.
 *
 * @since 0.1.0
 */
public final class UnauthorizedException extends LedgerException {

    private final Address caller;

    public UnauthorizedException(final Address caller, final @Nullable TokenId tokenId, final String message) {
        super(Reason.UNAUTHORIZED, tokenId, message);
        this.caller = caller;
    }

    public Address caller() {
        return caller;
    }
}
