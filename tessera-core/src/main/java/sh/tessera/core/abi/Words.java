// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import sh.tessera.core.error.AbiEncodingException;
import sh.tessera.core.types.Address;

/**
 * 32-byte word helpers shared by the encoder and decoder.
 *
 * @since 0.1.0
 */
public final class Words {

    /** Size of one ABI word in bytes. */
    public static final int WORD_SIZE = 32;

    private Words() {
    }

    /**
     * Right-pads {@code bytes} with zeros up to the next multiple of 32.
     * Already-aligned input, including an empty array, is returned as is.
     *
     * @param bytes the content
     * @return the padded content
     */
    public static byte[] padTo32(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        final int remainder = bytes.length % WORD_SIZE;
        if (remainder == 0) {
            return bytes;
        }
        return Arrays.copyOf(bytes, bytes.length + (WORD_SIZE - remainder));
    }

    /**
     * Encodes an integer as one big-endian word.
     *
     * @param value the integer
     * @param signed whether to use two's complement
     * @return 32 bytes
     * @throws AbiEncodingException {@code NEGATIVE_VALUE_FOR_UNSIGNED} or
     *         {@code VALUE_OUT_OF_RANGE}
     */
    public static byte[] intToWord(final BigInteger value, final boolean signed) {
        Objects.requireNonNull(value, "value");
        if (!signed && value.signum() < 0) {
            throw AbiEncodingException.negativeUnsigned("uint256");
        }
        final int maxBits = signed ? 255 : 256;
        if (value.bitLength() > maxBits) {
            throw AbiEncodingException.valueOutOfRange(
                    "value " + value + " does not fit in " + (signed ? "int256" : "uint256"));
        }
        final byte[] word = new byte[WORD_SIZE];
        if (value.signum() < 0) {
            Arrays.fill(word, (byte) 0xFF);
        }
        final byte[] raw = value.toByteArray();
        // toByteArray may carry one extra sign byte for a full-width unsigned value
        final int start = raw.length > WORD_SIZE ? raw.length - WORD_SIZE : 0;
        final int len = raw.length - start;
        System.arraycopy(raw, start, word, WORD_SIZE - len, len);
        return word;
    }

    /**
     * Reads a word as an unsigned integer.
     *
     * @param word big-endian bytes
     * @return the non-negative value
     */
    public static BigInteger wordToUint(final byte[] word) {
        Objects.requireNonNull(word, "word");
        return new BigInteger(1, word);
    }

    /**
     * Takes the low 20 bytes of a word. The 12 leading bytes are not checked.
     *
     * @param word a 32-byte word
     * @return the address
     */
    public static Address addressFromWord(final byte[] word) {
        Objects.requireNonNull(word, "word");
        if (word.length != WORD_SIZE) {
            throw new IllegalArgumentException("word must be " + WORD_SIZE + " bytes, got " + word.length);
        }
        return Address.fromBytes(Arrays.copyOfRange(word, WORD_SIZE - Address.BYTE_LENGTH, WORD_SIZE));
    }
}
