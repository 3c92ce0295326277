// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import sh.tessera.primitives.Hex;

/**
 * Arbitrary-length {@code 0x}-prefixed hex data, such as call data or log data.
 *
 * @since 0.1.0
 */
public record HexData(@JsonValue String value) {

    /** Empty data ({@code 0x}). */
    public static final HexData EMPTY = new HexData("0x");

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public HexData {
        Objects.requireNonNull(value, "hex");
        if (!Hex.hasPrefix(value) || !Hex.isValid(value)) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public static HexData fromBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new HexData(Hex.encode(bytes));
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    /**
     * Returns the number of bytes represented.
     *
     * @return byte length
     */
    public int byteLength() {
        return (value.length() - 2) / 2;
    }

    public boolean isEmpty() {
        return value.length() == 2;
    }

    @Override
    public String toString() {
        return value;
    }
}
