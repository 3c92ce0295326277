// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import sh.tessera.core.types.Address;

/**
 * Affine coordinates of a secp256k1 public key.
 *
 * @param x the x coordinate
 * @param y the y coordinate
 * @since 0.1.0
 */
public record PublicKey(BigInteger x, BigInteger y) {

    public PublicKey {
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
    }

    /**
     * Returns the 64-byte uncompressed encoding without the {@code 0x04} marker.
     *
     * @return {@code x || y}, each left-padded to 32 bytes
     */
    public byte[] toBytes() {
        final byte[] out = new byte[64];
        copyUnsigned(x, out, 0);
        copyUnsigned(y, out, 32);
        return out;
    }

    /**
     * Derives the account address: the last 20 bytes of the Keccak-256 of {@link #toBytes()}.
     *
     * @return the address controlled by this key
     */
    public Address toAddress() {
        final byte[] hash = Keccak256.hash(toBytes());
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    private static void copyUnsigned(final BigInteger value, final byte[] dest, final int offset) {
        final byte[] raw = value.toByteArray();
        final int start = raw.length > 32 ? raw.length - 32 : 0;
        final int len = raw.length - start;
        System.arraycopy(raw, start, dest, offset + 32 - len, len);
    }
}
