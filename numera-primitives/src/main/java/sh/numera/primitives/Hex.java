// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.primitives;

import java.util.Arrays;

/**
 * Hex encoding and decoding for unsigned magnitude buffers.
 *
 * <p>Output is always lowercase and never carries a {@code 0x} prefix; a
 * {@code 0x}/{@code 0X} prefix is tolerated on input.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decode an even-length hex string into bytes.
     *
     * @param hexString the string to decode, with or without {@code 0x} prefix
     * @return the decoded bytes; empty for an empty string
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  digits, or contains a non-hex character
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }

        final int start = hasPrefix(hexString) ? 2 : 0;
        final int hexLength = hexString.length() - start;

        if (hexLength == 0) {
            return new byte[0];
        }

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
     * Encode bytes as lowercase hex, two digits per byte.
     *
     * @param bytes the bytes to encode
     * @return hex string without prefix; empty for an empty array
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
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
     * Left-pad a digit string with a single {@code 0} when its length is odd, so that
     * it packs into whole bytes.
     *
     * @param digits hex digits without prefix
     * @return {@code digits} unchanged if already even, otherwise {@code "0" + digits}
     * @throws IllegalArgumentException if {@code digits} is {@code null}
     */
    public static String padToWholeBytes(final String digits) {
        if (digits == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        return (digits.length() & 1) == 1 ? "0" + digits : digits;
    }

    /**
     * Returns {@code true} if the provided string starts with {@code 0x}
     * (case-insensitive).
     *
     * @param hexString the string to check
     * @return {@code true} when the prefix is present
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static int toNibble(final char c, final String originalInput) {
        if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
            throw new IllegalArgumentException("invalid hex character in: " + originalInput);
        }
        return NIBBLE_LOOKUP[c];
    }
}
