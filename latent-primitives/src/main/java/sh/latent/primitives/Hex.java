// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.primitives;

import java.util.Arrays;

/**
 * Hex encoding and decoding for identities, digests and interface ids.
 *
 * <p>Decoding accepts an optional {@code 0x}/{@code 0X} prefix and mixed case.
 * Encoding always produces lowercase output.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLES = new int[128];

    static {
        Arrays.fill(NIBBLES, -1);
        for (int i = 0; i <= 9; i++) {
            NIBBLES['0' + i] = i;
        }
        for (int i = 0; i < 6; i++) {
            NIBBLES['a' + i] = 10 + i;
            NIBBLES['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decodes a hex string, with or without {@code 0x} prefix, into bytes.
     *
     * @param hexString the string to decode
     * @return the decoded bytes (empty for {@code "0x"} or {@code ""})
     * @throws IllegalArgumentException if the input is null, has odd length, or
     *                                  contains a non-hex character
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final int start = hasPrefix(hexString) ? 2 : 0;
        final int hexLength = hexString.length() - start;
        if ((hexLength & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }

        final byte[] result = new byte[hexLength / 2];
        for (int i = 0; i < result.length; i++) {
            final int high = toNibble(hexString.charAt(start + i * 2), hexString);
            final int low = toNibble(hexString.charAt(start + i * 2 + 1), hexString);
            result[i] = (byte) ((high << 4) | low);
        }
        return result;
    }

    /**
     * Encodes bytes as a lowercase hex string with a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return the prefixed hex string
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    /**
     * Encodes bytes as a lowercase hex string without prefix.
     *
     * @param bytes the bytes to encode
     * @return the unprefixed hex string
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Strips a leading {@code 0x} if present.
     *
     * @param hexString the string to clean
     * @return the string without prefix
     * @throws IllegalArgumentException if {@code hexString} is null
     */
    public static String cleanPrefix(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        return hasPrefix(hexString) ? hexString.substring(2) : hexString;
    }

    /**
     * Returns {@code true} if the string starts with {@code 0x} (case-insensitive).
     *
     * @param hexString the string to check, may be null
     * @return whether the prefix is present
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static int toNibble(final char c, final String originalInput) {
        if (c >= NIBBLES.length || NIBBLES[c] == -1) {
            throw new IllegalArgumentException("invalid hex character in: " + originalInput);
        }
        return NIBBLES[c];
    }
}
