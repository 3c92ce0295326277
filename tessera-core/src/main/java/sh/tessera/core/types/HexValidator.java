// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for fixed-length, {@code 0x}-prefixed hex strings.
 * Shared by {@link Address} and {@link Hash}.
 *
 * @since 0.1.0
 */
public final class HexValidator {
    private HexValidator() {}

    /**
     * Creates a pattern matching {@code 0x} followed by exactly {@code byteLength * 2} hex digits.
     *
     * @param byteLength the number of bytes the string must represent
     * @return the compiled pattern
     */
    public static Pattern fixedLength(int byteLength) {
        return Pattern.compile("^0x[0-9a-fA-F]{" + (byteLength * 2) + "}$");
    }
}
