// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import sh.latent.core.types.Hash;

/**
 * Keccak-256 hashing (the original Keccak padding, not FIPS SHA3-256).
 *
 * <p>Descriptor content hashes are computed over the UTF-8 bytes of the descriptor:
 * <pre>{@code
 * Hash h = Keccak256.hashUtf8("ipfs://bafy.../1.json");
 * }</pre>
 *
 * <p>Digest instances are cached per thread. Call {@link #cleanup()} before a pooled
 * thread is handed back to a container that may unload this class loader.
 *
 * @since 0.1.0
 */
public final class Keccak256 {

    private static final ThreadLocal<Keccak.Digest256> DIGEST = ThreadLocal.withInitial(Keccak.Digest256::new);

    private Keccak256() {
        // Utility class
    }

    /**
     * Computes the Keccak-256 digest of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte digest
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Computes the Keccak-256 digest of the UTF-8 encoding of {@code text}.
     *
     * @param text the text to hash
     * @return the digest as a {@link Hash}
     * @throws NullPointerException if text is null
     */
    public static Hash hashUtf8(final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return Hash.fromBytes(hash(text.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Removes the cached digest from the current thread. Safe to call when none exists.
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
