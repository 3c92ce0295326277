// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.security.SecureRandom;

import org.junit.jupiter.api.Test;

import sh.tessera.core.types.Address;

class PrivateKeyTest {

    private static final String KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    private static final String CURVE_ORDER = "fffffffffffffffffffffffffffffffebaaedce6af48a03bbfd25e8cd0364141";

    @Test
    void derivesKnownAddress() {
        PrivateKey key = PrivateKey.fromHex(KEY);
        assertEquals(new Address("0x2c7536E3605D9C16a7a3D7b1898e529396a65c23"), key.toAddress());
    }

    @Test
    void keyOneMapsToGeneratorAddress() {
        PrivateKey key = PrivateKey.fromHex("0x" + "0".repeat(63) + "1");
        assertEquals(new Address("0x7e5f4552091a69125d5dfcb7b8c2659029395bdf"), key.toAddress());
        assertEquals(key.toAddress(), key.publicKey().toAddress());
    }

    @Test
    void validatesKeyText() {
        assertTrue(PrivateKey.isValid(KEY));
        assertTrue(PrivateKey.isValid(KEY.substring(2)));
        assertFalse(PrivateKey.isValid(null));
        assertFalse(PrivateKey.isValid("0x1234"));
        assertFalse(PrivateKey.isValid("0x" + "zz".repeat(32)));
        assertFalse(PrivateKey.isValid("0x" + "0".repeat(64)));
        assertFalse(PrivateKey.isValid("0x" + CURVE_ORDER));
    }

    @Test
    void rejectsOutOfRangeKeys() {
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromHex("0x" + "0".repeat(64)));
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromHex("0x" + CURVE_ORDER));
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromHex("0x1234"));
    }

    @Test
    void toStringShowsAddressOnly() {
        PrivateKey key = PrivateKey.fromHex(KEY);
        String text = key.toString();
        assertTrue(text.contains("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23"));
        assertFalse(text.contains(KEY.substring(2)));
    }

    @Test
    void generatesDistinctValidKeys() {
        SecureRandom random = new SecureRandom();
        PrivateKey a = PrivateKey.generate(random);
        PrivateKey b = PrivateKey.generate(random);
        assertNotEquals(a, b);
        assertNotEquals(a.toAddress(), b.toAddress());
    }

    @Test
    void publicKeyEncodesSixtyFourBytes() {
        PublicKey pub = PrivateKey.fromHex(KEY).publicKey();
        assertEquals(64, pub.toBytes().length);
    }
}
