// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives.rlp;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import sh.tessera.primitives.Hex;

/**
 * Vectors from the Ethereum RLP documentation.
 */
class RlpTest {

    @Test
    void encodesShortString() {
        assertEquals("0x83646f67", Hex.encode(RlpString.of("dog".getBytes(StandardCharsets.US_ASCII)).encode()));
    }

    @Test
    void encodesEmptyStringAndZero() {
        assertEquals("0x80", Hex.encode(RlpString.of(new byte[0]).encode()));
        assertEquals("0x80", Hex.encode(RlpString.of(0).encode()));
    }

    @Test
    void singleLowByteIsItsOwnEncoding() {
        assertEquals("0x0f", Hex.encode(RlpString.of(15).encode()));
        assertEquals("0x8180", Hex.encode(RlpString.of(0x80).encode()));
    }

    @Test
    void encodesScalarsMinimally() {
        assertEquals("0x820400", Hex.encode(RlpString.of(1024).encode()));
        assertEquals("0x8504a817c800", Hex.encode(RlpString.of(BigInteger.valueOf(20_000_000_000L)).encode()));
    }

    @Test
    void rejectsNegativeScalars() {
        assertThrows(IllegalArgumentException.class, () -> RlpString.of(-1));
    }

    @Test
    void encodesLongString() {
        String lorem = "Lorem ipsum dolor sit amet, consectetur adipisicing elit";
        byte[] encoded = RlpString.of(lorem.getBytes(StandardCharsets.US_ASCII)).encode();
        assertEquals((byte) 0xb8, encoded[0]);
        assertEquals(56, encoded[1]);
        assertEquals(58, encoded.length);
    }

    @Test
    void encodesLists() {
        RlpList catDog = RlpList.of(RlpString.of("0x636174"), RlpString.of("0x646f67"));
        assertEquals("0xc88363617483646f67", Hex.encode(catDog.encode()));
        assertEquals("0xc0", Hex.encode(Rlp.encodeList(List.of())));
    }

    @Test
    void encodesNestedSetTheoreticRepresentation() {
        // [ [], [[]], [ [], [[]] ] ]
        RlpList empty = RlpList.of();
        RlpList three = RlpList.of(empty, RlpList.of(empty), RlpList.of(empty, RlpList.of(empty)));
        assertEquals("0xc7c0c1c0c3c0c1c0", Hex.encode(Rlp.encode(three)));
    }

    @Test
    void stringBytesAreDefensivelyCopied() {
        byte[] raw = { 1, 2, 3 };
        RlpString s = RlpString.of(raw);
        raw[0] = 9;
        assertArrayEquals(new byte[] { 1, 2, 3 }, s.bytes());
    }
}
