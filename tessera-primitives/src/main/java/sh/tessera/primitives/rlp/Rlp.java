// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives.rlp;

import java.util.List;
import java.util.Objects;

/**
 * Recursive Length Prefix encoder.
 *
 * <p>
 * Only encoding is provided; nothing in Tessera reads RLP back.
 *
 * @see <a href="https://ethereum.org/en/developers/docs/data-structures-and-encoding/rlp/">RLP</a>
 */
public final class Rlp {

    private static final int SHORT_LIMIT = 55;
    private static final int STRING_OFFSET = 0x80;
    private static final int LONG_STRING_OFFSET = 0xB7;
    private static final int LIST_OFFSET = 0xC0;
    private static final int LONG_LIST_OFFSET = 0xF7;

    private Rlp() {
        // Utility class
    }

    public static byte[] encode(final RlpItem item) {
        Objects.requireNonNull(item, "item cannot be null");
        return item.encode();
    }

    /**
     * Encodes a byte string.
     *
     * @param bytes the payload
     * @return encoded bytes
     */
    public static byte[] encodeString(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");

        // A single byte below 0x80 is its own encoding
        if (bytes.length == 1 && (bytes[0] & 0xFF) < STRING_OFFSET) {
            return new byte[] { bytes[0] };
        }
        return withHeader(bytes, STRING_OFFSET, LONG_STRING_OFFSET);
    }

    /**
     * Encodes a list of items.
     *
     * @param items the items, in order
     * @return encoded bytes
     */
    public static byte[] encodeList(final List<RlpItem> items) {
        Objects.requireNonNull(items, "items cannot be null");

        final byte[][] encoded = new byte[items.size()][];
        int payloadSize = 0;
        for (int i = 0; i < encoded.length; i++) {
            encoded[i] = Objects.requireNonNull(items.get(i), "items cannot contain null values").encode();
            payloadSize += encoded[i].length;
        }

        final byte[] payload = new byte[payloadSize];
        int offset = 0;
        for (byte[] item : encoded) {
            System.arraycopy(item, 0, payload, offset, item.length);
            offset += item.length;
        }
        return withHeader(payload, LIST_OFFSET, LONG_LIST_OFFSET);
    }

    private static byte[] withHeader(final byte[] payload, final int shortOffset, final int longOffset) {
        final int length = payload.length;
        if (length <= SHORT_LIMIT) {
            final byte[] result = new byte[1 + length];
            result[0] = (byte) (shortOffset + length);
            System.arraycopy(payload, 0, result, 1, length);
            return result;
        }

        final int lengthSize = lengthSize(length);
        final byte[] result = new byte[1 + lengthSize + length];
        result[0] = (byte) (longOffset + lengthSize);
        for (int i = lengthSize; i > 0; i--) {
            result[i] = (byte) (length >>> (8 * (lengthSize - i)));
        }
        System.arraycopy(payload, 0, result, 1 + lengthSize, length);
        return result;
    }

    private static int lengthSize(final int length) {
        return (32 - Integer.numberOfLeadingZeros(length) + 7) / 8;
    }
}
