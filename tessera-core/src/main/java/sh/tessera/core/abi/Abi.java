// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.types.Hash;
import sh.tessera.core.types.HexData;

/**
 * Entry point for signature-string based encoding and for selectors and event topics.
 *
 * <pre>{@code
 * HexData selector = Abi.functionSelector("balanceOf(address)");  // 0x70a08231
 * Hash topic = Abi.eventTopic("Transfer(address,address,uint256)");
 * HexData data = Abi.encodeCall("balanceOf(address)", AbiValue.address(owner));
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Abi {

    private Abi() {
    }

    /**
     * Computes a function selector. The signature is hashed exactly as given, so it must
     * already be canonical.
     *
     * @param signature e.g. {@code transfer(address,uint256)}
     * @return {@code 0x} followed by 8 hex characters
     */
    public static HexData functionSelector(final String signature) {
        Objects.requireNonNull(signature, "signature");
        return HexData.fromBytes(Arrays.copyOf(Keccak256.hash(signature), 4));
    }

    /**
     * Computes an event topic, the full Keccak-256 of the canonical event signature.
     *
     * @param signature e.g. {@code Transfer(address,address,uint256)}
     * @return the topic hash
     */
    public static Hash eventTopic(final String signature) {
        Objects.requireNonNull(signature, "signature");
        return Hash.fromBytes(Keccak256.hash(signature));
    }

    /**
     * Parses {@code signature} and encodes a call to it.
     *
     * @param signature e.g. {@code transfer(address,uint256)}
     * @param values one value per parameter
     * @return the call data
     */
    public static HexData encodeCall(final String signature, final AbiValue... values) {
        return AbiEncoder.encodeCall(FunctionSignature.parse(signature), List.of(values)).toHexData();
    }

    /**
     * Decodes a result block against type names.
     *
     * @param data the raw result
     * @param typeNames the canonical output types
     * @return the decoded values
     */
    public static List<AbiValue> decodeResult(final HexData data, final String... typeNames) {
        final List<TypeTag> types = Arrays.stream(typeNames).map(TypeTag::parse).toList();
        return AbiDecoder.decodeResult(types, data);
    }
}
