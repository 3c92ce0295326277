// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;

import sh.tessera.core.types.HexData;

class AbiTest {

    @Test
    void computesFunctionSelectors() {
        assertEquals("0xa9059cbb", Abi.functionSelector("transfer(address,uint256)").value());
        assertEquals("0x70a08231", Abi.functionSelector("balanceOf(address)").value());
    }

    @Test
    void computesEventTopics() {
        assertEquals("0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef",
                Abi.eventTopic("Transfer(address,address,uint256)").value());
        assertEquals("0x8c5be1e5ebec7d5bd14f71427d1e84f3dd0314c0f7b2291e5b200ac8c7c3b925",
                Abi.eventTopic("Approval(address,address,uint256)").value());
    }

    @Test
    void encodesFromSignatureText() {
        HexData data = Abi.encodeCall("balanceOf(address)",
                AbiValue.address("0x0000000000000000000000000000000000000001"));
        assertEquals("0x70a08231" + "0".repeat(63) + "1", data.value());
    }

    @Test
    void decodesAgainstTypeNames() {
        HexData result = HexData.fromBytes(AbiEncoder.encodeArguments(
                List.of(Param.of("a", "uint256"), Param.of("b", "bool")),
                List.of(AbiValue.uint(BigInteger.valueOf(42)), AbiValue.bool(false))));
        assertEquals(List.of(AbiValue.uint(42), AbiValue.bool(false)), Abi.decodeResult(result, "uint256", "bool"));
    }
}
