// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import java.util.Objects;

import sh.tessera.core.types.HexData;

/**
 * Offline intrinsic gas estimate.
 *
 * <p>
 * The estimate is the base gas plus calldata cost: 4 gas per zero byte and 16 gas per
 * non-zero byte. Execution cost of the called contract is not included.
 *
 * @since 0.1.0
 */
public final class GasEstimator {

    /** Gas per zero calldata byte. */
    public static final long ZERO_BYTE_GAS = 4L;

    /** Gas per non-zero calldata byte. */
    public static final long NON_ZERO_BYTE_GAS = 16L;

    private GasEstimator() {
    }

    public static long estimate(final byte[] data) {
        return estimate(data, TransactionDefaults.DEFAULT);
    }

    public static long estimate(final HexData data) {
        Objects.requireNonNull(data, "data");
        return estimate(data.toBytes(), TransactionDefaults.DEFAULT);
    }

    /**
     * Estimates the intrinsic gas of a transaction carrying {@code data}.
     *
     * @param data the call data, may be empty
     * @param defaults supplies the base gas
     * @return the gas estimate
     */
    public static long estimate(final byte[] data, final TransactionDefaults defaults) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(defaults, "defaults");
        long gas = defaults.baseGas();
        for (byte b : data) {
            gas += b == 0 ? ZERO_BYTE_GAS : NON_ZERO_BYTE_GAS;
        }
        return gas;
    }
}
