// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.types;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Token identifier ({@code uint256}).
 *
 * <p>Ids issued by the ledger start at 1 and increase by one per prepared token.
 * Zero is a representable value but never issued, so lookups with it report an
 * unknown token rather than failing validation.
 *
 * @param value the token id (must be non-negative)
 * @throws NullPointerException     if value is null
 * @throws IllegalArgumentException if value is negative
 */
public record TokenId(@com.fasterxml.jackson.annotation.JsonValue BigInteger value)
        implements Comparable<TokenId> {

    public TokenId {
        Objects.requireNonNull(value, "tokenId");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("tokenId must be non-negative");
        }
    }

    public static TokenId of(long id) {
        return new TokenId(BigInteger.valueOf(id));
    }

    /** Returns the id that follows this one. */
    public TokenId next() {
        return new TokenId(value.add(BigInteger.ONE));
    }

    @Override
    public int compareTo(TokenId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return "TokenId(" + value + ")";
    }
}
