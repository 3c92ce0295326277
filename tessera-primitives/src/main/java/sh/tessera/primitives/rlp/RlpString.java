// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives.rlp;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import sh.tessera.primitives.Hex;

/**
 * RLP byte string.
 *
 * @param bytes the raw payload (copied on construction)
 */
public record RlpString(byte[] bytes) implements RlpItem {

    public RlpString {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        bytes = bytes.clone();
    }

    public static RlpString of(final byte[] bytes) {
        return new RlpString(bytes);
    }

    /**
     * Wraps the bytes of a hex string, with or without {@code 0x} prefix.
     *
     * @param hex the hex to decode
     * @return the RLP string
     */
    public static RlpString of(final String hex) {
        return new RlpString(Hex.decode(hex));
    }

    /**
     * Encodes a non-negative scalar using its minimal big-endian form; zero is the empty string.
     *
     * @param value the scalar
     * @return the RLP string
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpString of(final long value) {
        return of(BigInteger.valueOf(value));
    }

    /**
     * Encodes a non-negative scalar using its minimal big-endian form; zero is the empty string.
     *
     * @param value the scalar
     * @return the RLP string
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpString of(final BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("RLP scalars must be non-negative: " + value);
        }
        if (value.signum() == 0) {
            return new RlpString(new byte[0]);
        }
        final byte[] raw = value.toByteArray();
        return new RlpString(raw[0] == 0 ? Arrays.copyOfRange(raw, 1, raw.length) : raw);
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    @Override
    public byte[] encode() {
        return Rlp.encodeString(bytes);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RlpString other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RlpString[" + Hex.encode(bytes) + "]";
    }
}
