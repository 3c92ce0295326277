// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.token;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import sh.tessera.core.abi.AbiDecoder;
import sh.tessera.core.abi.AbiEncoder;
import sh.tessera.core.abi.AbiValue;
import sh.tessera.core.abi.FunctionSignature;
import sh.tessera.core.abi.TypeTag;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.HexData;
import sh.tessera.core.units.Units;

/**
 * Call-data builders for an ERC-20 token contract.
 *
 * <p>
 * Address arguments are strings so that user input is validated in one place: anything
 * other than {@code 0x} followed by 40 hex characters fails with {@code INVALID_ADDRESS}.
 *
 * <pre>{@code
 * Erc20Token usdc = new Erc20Token(usdcAddress, "USD Coin", "USDC", 6);
 * HexData data = usdc.encodeTransfer(recipient, usdc.parseAmount("12.5"));
 * }</pre>
 *
 * @param address  the token contract
 * @param name     display name
 * @param symbol   ticker symbol
 * @param decimals number of decimals in {@link #formatAmount} and {@link #parseAmount}
 * @since 0.1.0
 */
public record Erc20Token(Address address, String name, String symbol, int decimals) {

    public static final String TRANSFER_SELECTOR = "0xa9059cbb";
    public static final String TRANSFER_FROM_SELECTOR = "0x23b872dd";
    public static final String APPROVE_SELECTOR = "0x095ea7b3";
    public static final String BALANCE_OF_SELECTOR = "0x70a08231";
    public static final String ALLOWANCE_SELECTOR = "0xdd62ed3e";
    public static final String TOTAL_SUPPLY_SELECTOR = "0x18160ddd";
    public static final String NAME_SELECTOR = "0x06fdde03";
    public static final String SYMBOL_SELECTOR = "0x95d89b41";
    public static final String DECIMALS_SELECTOR = "0x313ce567";

    static final FunctionSignature TRANSFER = FunctionSignature.parse("transfer(address,uint256)");
    static final FunctionSignature TRANSFER_FROM = FunctionSignature.parse("transferFrom(address,address,uint256)");
    static final FunctionSignature APPROVE = FunctionSignature.parse("approve(address,uint256)");
    static final FunctionSignature BALANCE_OF = FunctionSignature.parse("balanceOf(address)");
    static final FunctionSignature ALLOWANCE = FunctionSignature.parse("allowance(address,address)");
    static final FunctionSignature TOTAL_SUPPLY = FunctionSignature.parse("totalSupply()");
    static final FunctionSignature NAME = FunctionSignature.parse("name()");
    static final FunctionSignature SYMBOL = FunctionSignature.parse("symbol()");
    static final FunctionSignature DECIMALS = FunctionSignature.parse("decimals()");

    public Erc20Token {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(symbol, "symbol");
        if (decimals < 0 || decimals > 255) {
            throw new IllegalArgumentException("decimals must fit in uint8, got " + decimals);
        }
    }

    public HexData encodeTransfer(final String to, final BigInteger amount) {
        return encode(TRANSFER, AbiValue.address(to), AbiValue.uint(amount));
    }

    public HexData encodeTransferFrom(final String from, final String to, final BigInteger amount) {
        return encode(TRANSFER_FROM, AbiValue.address(from), AbiValue.address(to), AbiValue.uint(amount));
    }

    public HexData encodeApprove(final String spender, final BigInteger amount) {
        return encode(APPROVE, AbiValue.address(spender), AbiValue.uint(amount));
    }

    public HexData encodeBalanceOf(final String owner) {
        return encode(BALANCE_OF, AbiValue.address(owner));
    }

    public HexData encodeAllowance(final String owner, final String spender) {
        return encode(ALLOWANCE, AbiValue.address(owner), AbiValue.address(spender));
    }

    public HexData encodeTotalSupply() {
        return encode(TOTAL_SUPPLY);
    }

    public HexData encodeName() {
        return encode(NAME);
    }

    public HexData encodeSymbol() {
        return encode(SYMBOL);
    }

    public HexData encodeDecimals() {
        return encode(DECIMALS);
    }

    /**
     * Decodes the {@code uint256} returned by {@code balanceOf}, {@code allowance} or
     * {@code totalSupply}.
     *
     * @param result the raw call result
     * @return the amount in base units
     */
    public BigInteger decodeBalance(final HexData result) {
        final List<AbiValue> values = AbiDecoder.decodeResult(List.of(TypeTag.UINT256), result);
        return ((AbiValue.IntValue) values.get(0)).value();
    }

    /**
     * Formats base units with this token's decimals.
     *
     * @param amount the amount in base units
     * @return e.g. {@code "12.5"}
     */
    public String formatAmount(final BigInteger amount) {
        return Units.formatUnits(amount, decimals);
    }

    public BigInteger parseAmount(final String amount) {
        return Units.parseUnits(amount, decimals);
    }

    private static HexData encode(final FunctionSignature signature, final AbiValue... values) {
        return AbiEncoder.encodeCall(signature, List.of(values)).toHexData();
    }
}
