// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.primitives;

import java.util.Objects;

/**
 * Byte-order and trimming helpers for unsigned magnitude buffers.
 *
 * <p>None of these methods mutate their input.
 *
 * @since 0.1.0
 */
public final class Bytes {

    private Bytes() {
        // Utility class
    }

    /**
     * Returns a copy of {@code bytes} with the byte order reversed
     * (little-endian to big-endian and back).
     *
     * @param bytes the source bytes
     * @return a new reversed array
     */
    public static byte[] reverse(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        final byte[] out = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            out[i] = bytes[bytes.length - 1 - i];
        }
        return out;
    }

    /**
     * Drops all leading {@code 0x00} bytes.
     *
     * <p>An all-zero input becomes an empty array. When there is nothing to strip
     * the input array itself is returned.
     *
     * @param bytes big-endian bytes
     * @return the minimal big-endian representation
     */
    public static byte[] stripLeadingZeros(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        int offset = 0;
        while (offset < bytes.length && bytes[offset] == 0) {
            offset++;
        }
        if (offset == 0) {
            return bytes;
        }
        if (offset == bytes.length) {
            return new byte[0];
        }
        final byte[] raw = new byte[bytes.length - offset];
        System.arraycopy(bytes, offset, raw, 0, raw.length);
        return raw;
    }
}
