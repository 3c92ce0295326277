// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import sh.tessera.primitives.Hex;

/**
 * Hex-encoded 20-byte account address.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be followed by exactly 40 hex characters (20 bytes)</li>
 * </ul>
 * <p>
 * Mixed-case (checksummed) input is accepted; the value is stored in lowercase.
 * A short address is never zero-padded into a valid one.
 *
 * @since 0.1.0
 */
public record Address(@JsonValue String value) {
    /** Raw length of an address in bytes. */
    public static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /**
     * The zero address ({@code 0x0000000000000000000000000000000000000000}).
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Address {
        Objects.requireNonNull(value, "address");
        if (!isValid(value)) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns whether {@code candidate} is a {@code 0x}-prefixed, 40-hex-character address.
     *
     * @param candidate the string to check, may be null
     * @return true if it would be accepted by the constructor
     */
    public static boolean isValid(final String candidate) {
        return candidate != null && HEX.matcher(candidate).matches();
    }

    /**
     * Decodes this address to its 20 raw bytes.
     *
     * @return a fresh 20-byte array
     */
    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address(Hex.encode(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
