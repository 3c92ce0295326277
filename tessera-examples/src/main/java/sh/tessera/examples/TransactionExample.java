// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.examples;

import java.math.BigInteger;

import sh.tessera.core.TesseraDebug;
import sh.tessera.core.crypto.PrivateKey;
import sh.tessera.core.tx.GasEstimator;
import sh.tessera.core.tx.Transaction;
import sh.tessera.core.tx.TransactionDefaults;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.HexData;
import sh.tessera.core.types.Wei;
import sh.tessera.core.token.Erc20Token;

/**
 * Builds an unsigned legacy transaction that carries ERC-20 call data and prints its
 * gas estimate, fee and signing hash.
 *
 * <p>
 * Usage: pass a hex private key as the first argument to derive the sender address, or
 * omit it to use a well-known development key.
 */
public final class TransactionExample {

    private static final String DEV_KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";

    private TransactionExample() {}

    public static void main(final String[] args) {
        TesseraDebug.setEnabled(true);

        final String keyHex = args.length > 0 ? args[0] : DEV_KEY;
        if (!PrivateKey.isValid(keyHex)) {
            System.err.println("Not a valid secp256k1 private key");
            return;
        }
        final PrivateKey key = PrivateKey.fromHex(keyHex);
        System.out.println("Sender: " + key.toAddress());

        final Erc20Token usdc = new Erc20Token(
                new Address("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48"), "USD Coin", "USDC", 6);
        final HexData data = usdc.encodeTransfer("0x70997970C51812dc3A010C7d01b50e0d17dc79C8", usdc.parseAmount("250"));

        final Transaction tx = Transaction.create(usdc.address(), Wei.ZERO, data,
                        new TransactionDefaults(null, Wei.gwei(25)))
                .withNonce(7);

        System.out.println("Call data: " + data);
        System.out.println("Intrinsic gas: " + GasEstimator.estimate(data));
        System.out.println("Gas limit: " + tx.gasLimit());
        System.out.println("Max fee (ether): " + tx.fee().toEther().stripTrailingZeros().toPlainString());
        System.out.println("Signing hash: " + tx.signingHash());

        final Transaction plain = Transaction.create(new Address("0x" + "3".repeat(40)),
                Wei.of(BigInteger.TEN.pow(18)), HexData.EMPTY);
        System.out.println("Plain transfer gas: " + plain.gasLimit());
    }
}
