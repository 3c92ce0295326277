// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

import sh.tessera.core.types.Address;
import sh.tessera.primitives.Hex;

/**
 * secp256k1 private key used to derive a public key and account address.
 *
 * <p>
 * Tessera does not sign. The key exists so that callers can validate key input and
 * learn which address it controls before handing it to a signer.
 *
 * <pre>{@code
 * PrivateKey key = PrivateKey.fromHex("0x4c0883a6...");
 * Address from = key.toAddress();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class PrivateKey {

    private static final int PRIVATE_KEY_SIZE = 32;
    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());

    private final BigInteger privateKeyValue;
    private final ECPoint publicKey;

    private PrivateKey(final byte[] keyBytes) {
        if (keyBytes.length != PRIVATE_KEY_SIZE) {
            throw new IllegalArgumentException("Private key must be " + PRIVATE_KEY_SIZE + " bytes, got " + keyBytes.length);
        }
        try {
            final BigInteger value = new BigInteger(1, keyBytes);
            if (!inRange(value)) {
                throw new IllegalArgumentException("Private key must be in [1, n-1]");
            }
            this.privateKeyValue = value;
            this.publicKey = new FixedPointCombMultiplier().multiply(CURVE.getG(), value).normalize();
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * Creates a private key from a hex string.
     *
     * @param hexString 64 hex characters, with or without {@code 0x}
     * @return private key instance
     * @throws IllegalArgumentException if the string is not valid hex or the key is out of range
     */
    public static PrivateKey fromHex(final String hexString) {
        Objects.requireNonNull(hexString, "hex string cannot be null");
        return new PrivateKey(Hex.decode(hexString));
    }

    /**
     * Returns whether {@code hexString} is a usable private key.
     *
     * @param hexString candidate key, may be null
     * @return true if it is 64 hex characters (optionally {@code 0x}-prefixed) encoding a
     *         scalar in {@code [1, n-1]}
     */
    public static boolean isValid(final String hexString) {
        if (hexString == null) {
            return false;
        }
        final String clean = Hex.cleanPrefix(hexString);
        if (clean.length() != PRIVATE_KEY_SIZE * 2 || !Hex.isValid(clean)) {
            return false;
        }
        return inRange(new BigInteger(clean, 16));
    }

    /**
     * Generates a fresh random key.
     *
     * @param random source of randomness
     * @return a new private key
     */
    public static PrivateKey generate(final SecureRandom random) {
        Objects.requireNonNull(random, "random");
        final byte[] candidate = new byte[PRIVATE_KEY_SIZE];
        while (true) {
            random.nextBytes(candidate);
            if (inRange(new BigInteger(1, candidate))) {
                return new PrivateKey(candidate);
            }
        }
    }

    public PublicKey publicKey() {
        return new PublicKey(
                publicKey.getAffineXCoord().toBigInteger(),
                publicKey.getAffineYCoord().toBigInteger());
    }

    /**
     * Derives the account address from this key's public key.
     *
     * @return account address
     */
    public Address toAddress() {
        return publicKey().toAddress();
    }

    private static boolean inRange(final BigInteger value) {
        return value.signum() > 0 && value.compareTo(CURVE.getN()) < 0;
    }

    /**
     * Shows the derived address only; key material is never printed.
     */
    @Override
    public String toString() {
        return "PrivateKey[address=" + toAddress() + "]";
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof PrivateKey other && privateKeyValue.equals(other.privateKeyValue);
    }

    @Override
    public int hashCode() {
        return privateKeyValue.hashCode();
    }
}
