// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.core.types.HexData;
import sh.tessera.core.types.Wei;
import sh.tessera.primitives.Hex;

class TransactionTest {

    private static final Address RECIPIENT = new Address("0x3535353535353535353535353535353535353535");

    @Test
    void createAppliesDefaults() {
        Transaction tx = Transaction.create(RECIPIENT, Wei.fromEther(BigDecimal.ONE), HexData.EMPTY);
        assertEquals(21_000L, tx.gasLimit());
        assertEquals(Wei.gwei(20), tx.gasPrice());
        assertEquals(0L, tx.nonce());
    }

    @Test
    void feeIsGasTimesPrice() {
        Transaction tx = Transaction.create(RECIPIENT, Wei.ZERO, HexData.EMPTY);
        assertEquals(Wei.of(new BigInteger("420000000000000")), tx.fee());
    }

    @Test
    void defaultsCanBeOverridden() {
        TransactionDefaults defaults = new TransactionDefaults(null, Wei.gwei(3));
        Transaction tx = Transaction.create(RECIPIENT, Wei.ZERO, new HexData("0x00ff"), defaults);
        assertEquals(21_020L, tx.gasLimit());
        assertEquals(Wei.gwei(3), tx.gasPrice());
    }

    @Test
    void signingHashCoversLegacyRlpPayload() {
        Transaction tx = Transaction.create(RECIPIENT, Wei.fromEther(BigDecimal.ONE), HexData.EMPTY).withNonce(9);
        // rlp([9, 20 gwei, 21000, 0x3535..35, 1 ether, ""])
        byte[] rlp = Hex.decode("0xe9098504a817c800825208943535353535353535353535353535353535353535"
                + "880de0b6b3a764000080");
        assertEquals(Hash.fromBytes(Keccak256.hash(rlp)), tx.signingHash());
    }

    @Test
    void signingHashDependsOnNonce() {
        Transaction tx = Transaction.create(RECIPIENT, Wei.ZERO, HexData.EMPTY);
        assertNotEquals(tx.signingHash(), tx.withNonce(1).signingHash());
    }

    @Test
    void contractCreationHasNoRecipient() {
        Transaction tx = Transaction.create(null, Wei.ZERO, new HexData("0x6080"));
        assertEquals(21_032L, tx.gasLimit());
        assertEquals(32, tx.signingHash().toBytes().length);
    }

    @Test
    void rejectsNegativeNonce() {
        Transaction tx = Transaction.create(RECIPIENT, Wei.ZERO, HexData.EMPTY);
        assertThrows(IllegalArgumentException.class, () -> tx.withNonce(-1));
    }
}
