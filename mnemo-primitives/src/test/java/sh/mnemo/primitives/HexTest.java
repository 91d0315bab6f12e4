// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HexTest {
    @Test
    @DisplayName("Encoding empty and single bytes")
    void testEncodeBasic() {
        assertEquals("0x", Hex.encode(new byte[] {}));
        assertEquals("0x00", Hex.encode(new byte[] {0x00}));
        assertEquals("0xff", Hex.encode(new byte[] {(byte) 0xFF}));
    }

    @Test
    void testEncodeNoPrefix() {
        byte[] bytes = new byte[] {0x01, 0x23, (byte) 0xAB, (byte) 0xCD};
        assertEquals("0123abcd", Hex.encodeNoPrefix(bytes));
        assertEquals("", Hex.encodeNoPrefix(new byte[0]));
    }

    @Test
    @DisplayName("decode accepts both cases and an optional prefix")
    void testDecodeCaseInsensitivity() {
        byte[] expected = new byte[] {0x0A, (byte) 0xBC, (byte) 0xDE, (byte) 0xF0};
        assertArrayEquals(expected, Hex.decode("0x0AbCdEf0"));
        assertArrayEquals(expected, Hex.decode("0X0aBcDeF0"));
        assertArrayEquals(expected, Hex.decode("0aBcDeF0"));
    }

    @Test
    void testDecodeSeedLengthValue() {
        // 16 bytes of 0x7f, the entropy of a published 12-word vector
        byte[] decoded = Hex.decode("7f7f7f7f7f7f7f7f7f7f7f7f7f7f7f7f");
        assertEquals(16, decoded.length);
        for (byte b : decoded) {
            assertEquals((byte) 0x7F, b);
        }
    }

    @Test
    @DisplayName("decode handles empty input")
    void testDecodeEmpty() {
        assertArrayEquals(new byte[] {}, Hex.decode(""));
        assertArrayEquals(new byte[] {}, Hex.decode("0x"));
        assertArrayEquals(new byte[] {}, Hex.decode("0X"));
    }

    @Test
    @DisplayName("decode rejects malformed input")
    void testDecodeInvalidInputs() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0x1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("123"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xz1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xéé"));
        assertThrows(IllegalArgumentException.class, () -> Hex.encodeNoPrefix(null));
    }

    @Test
    void testDecodeAcceptsEitherPrefixCase() {
        assertArrayEquals(new byte[] {0x12, 0x34}, Hex.decode("0x1234"));
        assertArrayEquals(new byte[] {(byte) 0xff}, Hex.decode("0Xff"));
        assertArrayEquals(new byte[0], Hex.decode("0x"));
    }

    @Test
    void testRoundTrip() {
        byte[] values = new byte[] {0x00, 0x01, 0x7F, (byte) 0x80, (byte) 0xFF};
        assertArrayEquals(values, Hex.decode(Hex.encode(values)));
        assertArrayEquals(values, Hex.decode(Hex.encodeNoPrefix(values)));
    }
}
