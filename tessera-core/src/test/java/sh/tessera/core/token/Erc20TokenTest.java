// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.token;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import sh.tessera.core.error.AbiEncodingException;
import sh.tessera.core.error.AbiException;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.HexData;

class Erc20TokenTest {

    private static final String RECIPIENT = "0x742d35Cc6634C0532925a3b844Bc9e7595f0bEb0";
    private static final String SPENDER = "0x70997970C51812dc3A010C7d01b50e0d17dc79C8";

    private final Erc20Token usdc = new Erc20Token(
            new Address("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48"), "USD Coin", "USDC", 6);

    @Test
    void selectorConstantsMatchSignatures() {
        assertEquals(Erc20Token.TRANSFER_SELECTOR, Erc20Token.TRANSFER.selectorHex());
        assertEquals(Erc20Token.TRANSFER_FROM_SELECTOR, Erc20Token.TRANSFER_FROM.selectorHex());
        assertEquals(Erc20Token.APPROVE_SELECTOR, Erc20Token.APPROVE.selectorHex());
        assertEquals(Erc20Token.BALANCE_OF_SELECTOR, Erc20Token.BALANCE_OF.selectorHex());
        assertEquals(Erc20Token.ALLOWANCE_SELECTOR, Erc20Token.ALLOWANCE.selectorHex());
        assertEquals(Erc20Token.TOTAL_SUPPLY_SELECTOR, Erc20Token.TOTAL_SUPPLY.selectorHex());
        assertEquals(Erc20Token.NAME_SELECTOR, Erc20Token.NAME.selectorHex());
        assertEquals(Erc20Token.SYMBOL_SELECTOR, Erc20Token.SYMBOL.selectorHex());
        assertEquals(Erc20Token.DECIMALS_SELECTOR, Erc20Token.DECIMALS.selectorHex());
    }

    @Test
    void encodesTransfer() {
        HexData data = usdc.encodeTransfer(RECIPIENT, BigInteger.valueOf(1_000_000));

        assertEquals("0xa9059cbb"
                + "000000000000000000000000742d35cc6634c0532925a3b844bc9e7595f0beb0"
                + "00000000000000000000000000000000000000000000000000000000000f4240", data.value());
    }

    @Test
    void encodesAllowanceAndApprove() {
        HexData allowance = usdc.encodeAllowance(RECIPIENT, SPENDER);
        HexData approve = usdc.encodeApprove(SPENDER, BigInteger.ONE);

        assertEquals(68, allowance.byteLength());
        assertTrue(allowance.value().startsWith(Erc20Token.ALLOWANCE_SELECTOR));
        assertTrue(approve.value().startsWith(Erc20Token.APPROVE_SELECTOR));
        assertTrue(approve.value().endsWith("01"));
    }

    @Test
    void zeroArgumentCallsAreSelectorOnly() {
        assertEquals(Erc20Token.TOTAL_SUPPLY_SELECTOR, usdc.encodeTotalSupply().value());
        assertEquals(Erc20Token.NAME_SELECTOR, usdc.encodeName().value());
        assertEquals(Erc20Token.SYMBOL_SELECTOR, usdc.encodeSymbol().value());
        assertEquals(Erc20Token.DECIMALS_SELECTOR, usdc.encodeDecimals().value());
    }

    @Test
    void transferFromHasThreeWords() {
        HexData data = usdc.encodeTransferFrom(SPENDER, RECIPIENT, BigInteger.TEN);
        assertEquals(4 + 3 * 32, data.byteLength());
    }

    @Test
    void rejectsInvalidAddress() {
        AbiEncodingException ex = assertThrows(AbiEncodingException.class,
                () -> usdc.encodeBalanceOf("0x1234"));
        assertEquals(AbiException.Kind.INVALID_ADDRESS, ex.kind());
    }

    @Test
    void decodesBalance() {
        HexData result = new HexData("0x" + String.format("%064x", 12_500_000));
        assertEquals(BigInteger.valueOf(12_500_000), usdc.decodeBalance(result));
    }

    @Test
    void formatsAndParsesWithTokenDecimals() {
        assertEquals("12.5", usdc.formatAmount(BigInteger.valueOf(12_500_000)));
        assertEquals(BigInteger.valueOf(12_500_000), usdc.parseAmount("12.5"));
        assertEquals("0", usdc.formatAmount(BigInteger.ZERO));
    }

    @Test
    void rejectsOutOfRangeDecimals() {
        Address token = usdc.address();
        assertThrows(IllegalArgumentException.class, () -> new Erc20Token(token, "X", "X", 256));
        assertThrows(IllegalArgumentException.class, () -> new Erc20Token(token, "X", "X", -1));
    }
}
