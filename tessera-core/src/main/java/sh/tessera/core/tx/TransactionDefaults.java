// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import sh.tessera.core.types.Wei;

/**
 * Fixed parameters used when building transactions.
 *
 * <p>
 * Null components fall back to the defaults: a base gas of 21000 and a gas price of 20 gwei.
 *
 * @param baseGas the intrinsic gas of any transaction
 * @param gasPrice the price applied by {@link Transaction#create}
 * @since 0.1.0
 */
public record TransactionDefaults(Long baseGas, Wei gasPrice) {

    private static final long DEFAULT_BASE_GAS = 21_000L;
    private static final Wei DEFAULT_GAS_PRICE = Wei.gwei(20);

    /** The standard defaults. */
    public static final TransactionDefaults DEFAULT = new TransactionDefaults(null, null);

    public TransactionDefaults {
        baseGas = baseGas == null ? DEFAULT_BASE_GAS : baseGas;
        gasPrice = gasPrice == null ? DEFAULT_GAS_PRICE : gasPrice;
        if (baseGas < 0) {
            throw new IllegalArgumentException("baseGas must be non-negative");
        }
    }
}
