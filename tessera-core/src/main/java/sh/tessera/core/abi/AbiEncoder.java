// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import sh.tessera.core.DebugLogger;
import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.error.AbiEncodingException;
import sh.tessera.core.types.Address;

/**
 * Encodes typed values into contract call data.
 *
 * <p>
 * A call is laid out as {@code selector ++ head ++ tail}. The head holds one 32-byte word
 * per parameter: static values inline, dynamic values as an offset (relative to the start
 * of the head) into the tail where their payload lives.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EncodedCall call = AbiEncoder.encodeCall(
 *         "transfer",
 *         List.of(Param.of("to", "address"), Param.of("amount", "uint256")),
 *         List.of(AbiValue.address("0x...01"), AbiValue.uint(1_000_000)));
 * String data = call.toHex(); // 0xa9059cbb...
 * }</pre>
 *
 * <h2>Arrays</h2>
 * <p>
 * {@code T[]} is encoded as a count word followed by the elements' encodings concatenated
 * in order. No per-element offset table is written, so arrays of dynamic elements
 * ({@code string[]}, {@code bytes[]}, {@code T[][]}) do not match the standard layout.
 * Arrays of static elements are standard.
 *
 * @see AbiDecoder
 * @since 0.1.0
 */
public final class AbiEncoder {

    private static final int SELECTOR_SIZE = 4;

    private AbiEncoder() {
    }

    /**
     * Returns whether {@code type} is encoded in the tail.
     *
     * @param type the type
     * @return true for {@code string}, {@code bytes} and arrays
     */
    public static boolean isDynamic(final TypeTag type) {
        return type.isDynamic();
    }

    /**
     * Encodes a single value without any head/tail framing.
     *
     * <p>
     * Static types produce exactly one word. {@code string} and {@code bytes} produce a
     * length word followed by the zero-padded content.
     *
     * @param type the declared type
     * @param value the value, whose variant must match the type
     * @return the encoding, always a multiple of 32 bytes
     * @throws AbiEncodingException if the value cannot be encoded as {@code type}
     */
    public static byte[] encodeValue(final TypeTag type, final AbiValue value) {
        Objects.requireNonNull(type, "type");
        return switch (type.kind()) {
            case ADDRESS -> encodeAddress(value);
            case UINT -> encodeInteger(type, ((TypeTag.UIntTag) type).bits(), false, value);
            case INT -> encodeInteger(type, ((TypeTag.IntTag) type).bits(), true, value);
            case BOOL -> encodeBool(value);
            case STRING -> encodeString(value);
            case BYTES -> encodeBytes(value);
            case ARRAY -> encodeArray((TypeTag.ArrayTag) type, value);
        };
    }

    /**
     * Encodes a function call.
     *
     * @param name the function name
     * @param params the declared parameters, in order
     * @param values the values, one per parameter
     * @return the encoded call
     * @throws AbiEncodingException if counts differ or any value cannot be encoded
     */
    public static EncodedCall encodeCall(final String name, final List<Param> params, final List<? extends AbiValue> values) {
        Objects.requireNonNull(name, "name");
        final FunctionSignature signature = FunctionSignature.of(name, params);
        return encodeCall(signature, values);
    }

    /**
     * Encodes a function call for a parsed signature.
     *
     * @param signature the function signature
     * @param values the values, one per parameter
     * @return the encoded call
     */
    public static EncodedCall encodeCall(final FunctionSignature signature, final List<? extends AbiValue> values) {
        Objects.requireNonNull(signature, "signature");
        final Layout layout = layout(signature.params(), values);
        final EncodedCall call = new EncodedCall(signature.selector(), layout.head, layout.tail);
        DebugLogger.logAbi("[ABI-ENCODE] %s args=%d bytes=%d", signature.canonical(), values.size(),
                SELECTOR_SIZE + layout.head.size() * Words.WORD_SIZE + layout.tail.length);
        return call;
    }

    /**
     * Encodes arguments without a selector, as for constructor arguments.
     *
     * @param params the declared parameters, in order
     * @param values the values, one per parameter
     * @return {@code head ++ tail}
     */
    public static byte[] encodeArguments(final List<Param> params, final List<? extends AbiValue> values) {
        final Layout layout = layout(params, values);
        return new EncodedCall(new byte[0], layout.head, layout.tail).arguments();
    }

    /**
     * Computes the selector: the first 4 bytes of the Keccak-256 of the canonical signature.
     *
     * @param canonicalSignature e.g. {@code transfer(address,uint256)}
     * @return 4 bytes
     */
    public static byte[] selector(final String canonicalSignature) {
        return Arrays.copyOf(Keccak256.hash(canonicalSignature), SELECTOR_SIZE);
    }

    private static Layout layout(final List<Param> params, final List<? extends AbiValue> values) {
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(values, "values");
        if (params.size() != values.size()) {
            throw AbiEncodingException.arityMismatch(params.size(), values.size());
        }

        final int count = params.size();
        final boolean[] dynamic = new boolean[count];
        for (int i = 0; i < count; i++) {
            dynamic[i] = isDynamic(params.get(i).type());
        }

        final List<byte[]> head = new ArrayList<>(count);
        final ByteArrayOutputStream tail = new ByteArrayOutputStream();
        long offset = (long) Words.WORD_SIZE * count;
        for (int i = 0; i < count; i++) {
            final byte[] encoded = encodeValue(params.get(i).type(), values.get(i));
            if (dynamic[i]) {
                head.add(Words.intToWord(BigInteger.valueOf(offset), false));
                tail.writeBytes(encoded);
                offset += encoded.length;
            } else {
                head.add(encoded);
            }
        }
        return new Layout(head, tail.toByteArray());
    }

    private static byte[] encodeAddress(final AbiValue value) {
        if (!(value instanceof AbiValue.AddressValue address)) {
            throw AbiEncodingException.typeMismatch("address", value);
        }
        final byte[] raw = address.raw();
        if (raw.length != Address.BYTE_LENGTH) {
            throw AbiEncodingException.invalidAddress(
                    "address must be " + Address.BYTE_LENGTH + " bytes, got " + raw.length);
        }
        final byte[] word = new byte[Words.WORD_SIZE];
        System.arraycopy(raw, 0, word, Words.WORD_SIZE - raw.length, raw.length);
        return word;
    }

    private static byte[] encodeInteger(final TypeTag type, final int bits, final boolean signed, final AbiValue value) {
        if (!(value instanceof AbiValue.IntValue integer)) {
            throw AbiEncodingException.typeMismatch(type.typeName(), value);
        }
        final BigInteger n = integer.value();
        if (!signed && n.signum() < 0) {
            throw AbiEncodingException.negativeUnsigned(type.typeName());
        }
        final int maxBits = signed ? bits - 1 : bits;
        if (n.bitLength() > maxBits) {
            throw AbiEncodingException.valueOutOfRange("value " + n + " does not fit in " + type.typeName());
        }
        return Words.intToWord(n, signed);
    }

    private static byte[] encodeBool(final AbiValue value) {
        if (!(value instanceof AbiValue.BoolValue bool)) {
            throw AbiEncodingException.typeMismatch("bool", value);
        }
        final byte[] word = new byte[Words.WORD_SIZE];
        if (bool.value()) {
            word[Words.WORD_SIZE - 1] = 1;
        }
        return word;
    }

    private static byte[] encodeString(final AbiValue value) {
        if (!(value instanceof AbiValue.StringValue string)) {
            throw AbiEncodingException.typeMismatch("string", value);
        }
        return lengthPrefixed(string.value().getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] encodeBytes(final AbiValue value) {
        if (!(value instanceof AbiValue.BytesValue bytes)) {
            throw AbiEncodingException.typeMismatch("bytes", value);
        }
        return lengthPrefixed(bytes.value());
    }

    private static byte[] lengthPrefixed(final byte[] content) {
        final byte[] padded = Words.padTo32(content);
        final byte[] out = new byte[Words.WORD_SIZE + padded.length];
        System.arraycopy(Words.intToWord(BigInteger.valueOf(content.length), false), 0, out, 0, Words.WORD_SIZE);
        System.arraycopy(padded, 0, out, Words.WORD_SIZE, padded.length);
        return out;
    }

    private static byte[] encodeArray(final TypeTag.ArrayTag type, final AbiValue value) {
        if (!(value instanceof AbiValue.ArrayValue array)) {
            throw AbiEncodingException.typeMismatch(type.typeName(), value);
        }
        final List<AbiValue> elements = array.elements();
        final ByteArrayOutputStream out = new ByteArrayOutputStream(Words.WORD_SIZE * (elements.size() + 1));
        out.writeBytes(Words.intToWord(BigInteger.valueOf(elements.size()), false));
        for (AbiValue element : elements) {
            out.writeBytes(encodeValue(type.element(), element));
        }
        return out.toByteArray();
    }

    private record Layout(List<byte[]> head, byte[] tail) {
    }
}
