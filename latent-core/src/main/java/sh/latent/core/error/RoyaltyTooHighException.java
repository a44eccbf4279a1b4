// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.error;

import sh.latent.core.types.TokenId;

/**
 * Thrown when a royalty rate exceeds 10000 basis points.
 *
 * @since 0.1.0
 */
public final class RoyaltyTooHighException extends LedgerException {

    private final int bps;
    private final int maximum;

    public RoyaltyTooHighException(final TokenId tokenId, final int bps, final int maximum) {
        super(Reason.ROYALTY_TOO_HIGH, tokenId, "royalty " + bps + " bps exceeds " + maximum);
        this.bps = bps;
        this.maximum = maximum;
    }

    public int bps() {
        return bps;
    }

    public int maximum() {
        return maximum;
    }
}
