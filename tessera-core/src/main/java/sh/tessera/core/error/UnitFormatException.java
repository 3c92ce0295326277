// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Thrown when a decimal amount string cannot be parsed into base units.
 *
 * @since 0.1.0
 */
public final class UnitFormatException extends TesseraException {

    public UnitFormatException(final String message) {
        super(message);
    }

    public UnitFormatException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
