// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import sh.tessera.core.DebugLogger;
import sh.tessera.core.error.AbiDecodingException;
import sh.tessera.core.types.HexData;

/**
 * Decodes call results back into {@link AbiValue}s.
 *
 * <p>
 * Decoding covers {@code address}, {@code uintN}, {@code bool} and {@code string};
 * other types are rejected with {@code UNSUPPORTED_TYPE}. Every read is bounds-checked and
 * reported as {@code TRUNCATED_DATA}, including offsets and lengths that point past the data.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * List<AbiValue> out = AbiDecoder.decodeResult(List.of(TypeTag.UINT256), resultBytes);
 * BigInteger balance = ((AbiValue.IntValue) out.get(0)).value();
 * }</pre>
 *
 * @see AbiEncoder
 * @since 0.1.0
 */
public final class AbiDecoder {

    private AbiDecoder() {
    }

    /**
     * Decodes a result tuple.
     *
     * @param types the expected output types, in order
     * @param data the raw result bytes
     * @return one value per type
     * @throws AbiDecodingException if the data is empty, too short, or of an unsupported type
     */
    public static List<AbiValue> decodeResult(final List<TypeTag> types, final byte[] data) {
        Objects.requireNonNull(types, "types");
        if (data == null || data.length == 0) {
            throw AbiDecodingException.emptyData();
        }
        final List<AbiValue> values = new ArrayList<>(types.size());
        int cursor = 0;
        for (TypeTag type : types) {
            values.add(decodeValue(type, data, cursor));
            cursor += Words.WORD_SIZE;
        }
        DebugLogger.logAbi("[ABI-DECODE] types=%d bytes=%d", types.size(), data.length);
        return values;
    }

    public static List<AbiValue> decodeResult(final List<TypeTag> types, final HexData data) {
        Objects.requireNonNull(data, "data");
        return decodeResult(types, data.toBytes());
    }

    /**
     * Decodes the value whose head word starts at {@code headOffset}.
     *
     * @param type the expected type
     * @param data the whole result block; string offsets are relative to its start
     * @param headOffset position of the head word
     * @return the decoded value
     * @throws AbiDecodingException on truncation or unsupported type
     */
    public static AbiValue decodeValue(final TypeTag type, final byte[] data, final int headOffset) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(data, "data");
        return switch (type.kind()) {
            case ADDRESS -> new AbiValue.AddressValue(
                    Words.addressFromWord(readWord(data, headOffset, "address")).toBytes());
            case UINT -> new AbiValue.IntValue(Words.wordToUint(readWord(data, headOffset, type.typeName())));
            case BOOL -> new AbiValue.BoolValue(readWord(data, headOffset, "bool")[Words.WORD_SIZE - 1] != 0);
            case STRING -> decodeString(data, headOffset);
            case INT, BYTES, ARRAY -> throw AbiDecodingException.unsupportedType(type.typeName());
        };
    }

    private static AbiValue decodeString(final byte[] data, final int headOffset) {
        final BigInteger offset = Words.wordToUint(readWord(data, headOffset, "string offset"));
        final int start = checkedPosition(offset, data, "string length");
        final BigInteger length = Words.wordToUint(readWord(data, start, "string length"));
        final int contentStart = start + Words.WORD_SIZE;
        final long available = data.length - contentStart;
        if (length.compareTo(BigInteger.valueOf(available)) > 0) {
            throw AbiDecodingException.truncated("string content",
                    length.min(BigInteger.valueOf(Long.MAX_VALUE)).longValue(), (int) available);
        }
        final int len = length.intValueExact();
        return new AbiValue.StringValue(
                new String(data, contentStart, len, StandardCharsets.UTF_8));
    }

    private static int checkedPosition(final BigInteger position, final byte[] data, final String context) {
        if (position.compareTo(BigInteger.valueOf((long) data.length - Words.WORD_SIZE)) > 0) {
            throw AbiDecodingException.truncated(context,
                    position.min(BigInteger.valueOf(Long.MAX_VALUE - Words.WORD_SIZE)).longValue() + Words.WORD_SIZE,
                    data.length);
        }
        return position.intValueExact();
    }

    private static byte[] readWord(final byte[] data, final int offset, final String context) {
        if (offset < 0 || (long) offset + Words.WORD_SIZE > data.length) {
            throw AbiDecodingException.truncated(context, (long) offset + Words.WORD_SIZE, data.length);
        }
        return Arrays.copyOfRange(data, offset, offset + Words.WORD_SIZE);
    }
}
