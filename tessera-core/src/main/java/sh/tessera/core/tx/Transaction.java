// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import java.math.BigInteger;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.DebugLogger;
import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.core.types.HexData;
import sh.tessera.core.types.Wei;
import sh.tessera.primitives.rlp.Rlp;
import sh.tessera.primitives.rlp.RlpList;
import sh.tessera.primitives.rlp.RlpString;

/**
 * An unsigned legacy transaction.
 *
 * <pre>{@code
 * Transaction tx = Transaction.create(recipient, Wei.fromEther(new BigDecimal("0.1")), HexData.EMPTY);
 * Wei maxFee = tx.fee();
 * Hash toSign = tx.signingHash();
 * }</pre>
 *
 * @param to recipient, or null for contract creation
 * @param value amount transferred
 * @param gasLimit gas limit
 * @param gasPrice price per unit of gas
 * @param data call data
 * @param nonce sender nonce
 * @since 0.1.0
 */
public record Transaction(
        @Nullable Address to,
        Wei value,
        long gasLimit,
        Wei gasPrice,
        HexData data,
        long nonce) {

    public Transaction {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(gasPrice, "gasPrice");
        Objects.requireNonNull(data, "data");
        if (gasLimit < 0) {
            throw new IllegalArgumentException("gasLimit must be non-negative");
        }
        if (nonce < 0) {
            throw new IllegalArgumentException("nonce must be non-negative");
        }
    }

    /**
     * Builds a transaction with an estimated gas limit, the default gas price and nonce 0.
     *
     * @param to recipient, or null for contract creation
     * @param value amount transferred
     * @param data call data
     * @return the transaction
     */
    public static Transaction create(final @Nullable Address to, final Wei value, final HexData data) {
        return create(to, value, data, TransactionDefaults.DEFAULT);
    }

    public static Transaction create(
            final @Nullable Address to, final Wei value, final HexData data, final TransactionDefaults defaults) {
        Objects.requireNonNull(data, "data");
        final long gas = GasEstimator.estimate(data.toBytes(), defaults);
        DebugLogger.log("[TX-CREATE] to=%s gas=%d gasPrice=%s", to, gas, defaults.gasPrice().value());
        return new Transaction(to, value, gas, defaults.gasPrice(), data, 0L);
    }

    public Transaction withNonce(final long newNonce) {
        return new Transaction(to, value, gasLimit, gasPrice, data, newNonce);
    }

    /**
     * Returns the maximum fee, {@code gasLimit * gasPrice}.
     *
     * @return the fee in wei
     */
    public Wei fee() {
        return Wei.of(BigInteger.valueOf(gasLimit).multiply(gasPrice.value()));
    }

    /**
     * Computes the pre-EIP-155 signing hash:
     * {@code keccak256(rlp([nonce, gasPrice, gasLimit, to, value, data]))}.
     *
     * @return the hash a signer would sign
     */
    public Hash signingHash() {
        final RlpList payload = RlpList.of(
                RlpString.of(nonce),
                RlpString.of(gasPrice.value()),
                RlpString.of(gasLimit),
                RlpString.of(to == null ? new byte[0] : to.toBytes()),
                RlpString.of(value.value()),
                RlpString.of(data.toBytes()));
        return Hash.fromBytes(Keccak256.hash(Rlp.encode(payload)));
    }
}
