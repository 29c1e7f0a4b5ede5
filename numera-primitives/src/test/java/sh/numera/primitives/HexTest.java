// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HexTest {
    @Test
    @DisplayName("Encoding empty and single bytes")
    void testEncodeBasic() {
        assertEquals("", Hex.encodeNoPrefix(new byte[] {}));
        assertEquals("00", Hex.encodeNoPrefix(new byte[] {0x00}));
        assertEquals("ff", Hex.encodeNoPrefix(new byte[] {(byte) 0xFF}));
    }

    @Test
    void testEncodeMultipleBytes() {
        byte[] bytes = new byte[] {0x01, 0x23, (byte) 0xAB, (byte) 0xCD};
        assertEquals("0123abcd", Hex.encodeNoPrefix(bytes));
    }

    @Test
    void testDecodeBasic() {
        assertArrayEquals(new byte[] {}, Hex.decode(""));
        assertArrayEquals(new byte[] {0}, Hex.decode("00"));
        assertArrayEquals(new byte[] {(byte) 0xFF}, Hex.decode("ff"));
    }

    @Test
    void testDecodeCaseInsensitivity() {
        byte[] expected = new byte[] {0x0A, (byte) 0xBC, (byte) 0xDE, (byte) 0xF0};
        assertArrayEquals(expected, Hex.decode("0x0AbCdEf0"));
        assertArrayEquals(expected, Hex.decode("0X0aBcDeF0"));
        assertArrayEquals(expected, Hex.decode("0aBcDeF0"));
    }

    @Test
    @DisplayName("padToWholeBytes adds one leading zero to odd-length digits only")
    void testPadToWholeBytes() {
        assertEquals("0abc", Hex.padToWholeBytes("abc"));
        assertEquals("0f", Hex.padToWholeBytes("f"));
        assertEquals("abcd", Hex.padToWholeBytes("abcd"));
        assertEquals("", Hex.padToWholeBytes(""));
    }

    @Test
    void testHasPrefix() {
        assertTrue(Hex.hasPrefix("0x1"));
        assertTrue(Hex.hasPrefix("0Xff"));
        assertFalse(Hex.hasPrefix("1"));
        assertFalse(Hex.hasPrefix(""));
        assertFalse(Hex.hasPrefix(null));
    }

    @Test
    void testDecodeInvalidInputs() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xz1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("١٢"));
        assertThrows(IllegalArgumentException.class, () -> Hex.encodeNoPrefix(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.padToWholeBytes(null));
    }

    @Test
    @DisplayName("padded digits always decode")
    void testPaddedDigitsDecode() {
        assertArrayEquals(new byte[] {0x0A, (byte) 0xBC}, Hex.decode(Hex.padToWholeBytes("abc")));
    }
}
