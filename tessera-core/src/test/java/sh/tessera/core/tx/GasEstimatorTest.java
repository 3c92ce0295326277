// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import sh.tessera.core.types.HexData;
import sh.tessera.core.types.Wei;

class GasEstimatorTest {

    @Test
    void plainTransferCostsBaseGas() {
        assertEquals(21_000L, GasEstimator.estimate(new byte[0]));
        assertEquals(21_000L, GasEstimator.estimate(HexData.EMPTY));
    }

    @Test
    void chargesPerZeroAndNonZeroByte() {
        assertEquals(21_000L + 4 + 16 + 4 + 16, GasEstimator.estimate(new byte[] {0, 1, 0, 2}));
    }

    @Test
    void erc20TransferCallData() {
        HexData data = new HexData("0xa9059cbb"
                + "0000000000000000000000000000000000000000000000000000000000000001"
                + "00000000000000000000000000000000000000000000000000000000000f4240");
        // selector 4*16, address word 31*4 + 16, amount word 29*4 + 3*16
        assertEquals(21_000L + 64 + 140 + 164, GasEstimator.estimate(data));
    }

    @Test
    void usesConfiguredBaseGas() {
        TransactionDefaults defaults = new TransactionDefaults(53_000L, Wei.gwei(1));
        assertEquals(53_016L, GasEstimator.estimate(new byte[] {7}, defaults));
    }
}
