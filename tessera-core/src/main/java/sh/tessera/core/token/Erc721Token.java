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

/**
 * Call-data builders for an ERC-721 token contract.
 *
 * @param address the token contract
 * @param name    collection name
 * @param symbol  collection symbol
 * @since 0.1.0
 */
public record Erc721Token(Address address, String name, String symbol) {

    public static final String TRANSFER_FROM_SELECTOR = "0x23b872dd";
    public static final String SAFE_TRANSFER_FROM_SELECTOR = "0x42842e0e";
    public static final String SAFE_TRANSFER_FROM_WITH_DATA_SELECTOR = "0xb88d4fde";
    public static final String APPROVE_SELECTOR = "0x095ea7b3";
    public static final String SET_APPROVAL_FOR_ALL_SELECTOR = "0xa22cb465";
    public static final String OWNER_OF_SELECTOR = "0x6352211e";
    public static final String BALANCE_OF_SELECTOR = "0x70a08231";
    public static final String GET_APPROVED_SELECTOR = "0x081812fc";
    public static final String IS_APPROVED_FOR_ALL_SELECTOR = "0xe985e9c5";
    public static final String TOKEN_URI_SELECTOR = "0xc87b56dd";

    static final FunctionSignature TRANSFER_FROM = FunctionSignature.parse("transferFrom(address,address,uint256)");
    static final FunctionSignature SAFE_TRANSFER_FROM = FunctionSignature.parse("safeTransferFrom(address,address,uint256)");
    static final FunctionSignature SAFE_TRANSFER_FROM_WITH_DATA =
            FunctionSignature.parse("safeTransferFrom(address,address,uint256,bytes)");
    static final FunctionSignature APPROVE = FunctionSignature.parse("approve(address,uint256)");
    static final FunctionSignature SET_APPROVAL_FOR_ALL = FunctionSignature.parse("setApprovalForAll(address,bool)");
    static final FunctionSignature OWNER_OF = FunctionSignature.parse("ownerOf(uint256)");
    static final FunctionSignature BALANCE_OF = FunctionSignature.parse("balanceOf(address)");
    static final FunctionSignature GET_APPROVED = FunctionSignature.parse("getApproved(uint256)");
    static final FunctionSignature IS_APPROVED_FOR_ALL = FunctionSignature.parse("isApprovedForAll(address,address)");
    static final FunctionSignature TOKEN_URI = FunctionSignature.parse("tokenURI(uint256)");

    public Erc721Token {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(symbol, "symbol");
    }

    public HexData encodeTransferFrom(final String from, final String to, final BigInteger tokenId) {
        return encode(TRANSFER_FROM, AbiValue.address(from), AbiValue.address(to), AbiValue.uint(tokenId));
    }

    public HexData encodeSafeTransferFrom(final String from, final String to, final BigInteger tokenId) {
        return encode(SAFE_TRANSFER_FROM, AbiValue.address(from), AbiValue.address(to), AbiValue.uint(tokenId));
    }

    /**
     * Encodes {@code safeTransferFrom(address,address,uint256,bytes)}; {@code data} is
     * passed to the receiver's {@code onERC721Received}.
     *
     * @param from current owner
     * @param to recipient
     * @param tokenId the token
     * @param data opaque receiver data
     * @return the call data
     */
    public HexData encodeSafeTransferFrom(final String from, final String to, final BigInteger tokenId, final byte[] data) {
        return encode(SAFE_TRANSFER_FROM_WITH_DATA,
                AbiValue.address(from), AbiValue.address(to), AbiValue.uint(tokenId), AbiValue.bytes(data));
    }

    public HexData encodeApprove(final String to, final BigInteger tokenId) {
        return encode(APPROVE, AbiValue.address(to), AbiValue.uint(tokenId));
    }

    public HexData encodeSetApprovalForAll(final String operator, final boolean approved) {
        return encode(SET_APPROVAL_FOR_ALL, AbiValue.address(operator), AbiValue.bool(approved));
    }

    public HexData encodeOwnerOf(final BigInteger tokenId) {
        return encode(OWNER_OF, AbiValue.uint(tokenId));
    }

    public HexData encodeBalanceOf(final String owner) {
        return encode(BALANCE_OF, AbiValue.address(owner));
    }

    public HexData encodeGetApproved(final BigInteger tokenId) {
        return encode(GET_APPROVED, AbiValue.uint(tokenId));
    }

    public HexData encodeIsApprovedForAll(final String owner, final String operator) {
        return encode(IS_APPROVED_FOR_ALL, AbiValue.address(owner), AbiValue.address(operator));
    }

    public HexData encodeTokenUri(final BigInteger tokenId) {
        return encode(TOKEN_URI, AbiValue.uint(tokenId));
    }

    /**
     * Decodes the address returned by {@code ownerOf} or {@code getApproved}.
     *
     * @param result the raw call result
     * @return the address
     */
    public Address decodeOwner(final HexData result) {
        final List<AbiValue> values = AbiDecoder.decodeResult(List.of(TypeTag.ADDRESS), result);
        return ((AbiValue.AddressValue) values.get(0)).toAddress();
    }

    public String decodeTokenUri(final HexData result) {
        final List<AbiValue> values = AbiDecoder.decodeResult(List.of(TypeTag.STRING), result);
        return ((AbiValue.StringValue) values.get(0)).value();
    }

    private static HexData encode(final FunctionSignature signature, final AbiValue... values) {
        return AbiEncoder.encodeCall(signature, List.of(values)).toHexData();
    }
}
