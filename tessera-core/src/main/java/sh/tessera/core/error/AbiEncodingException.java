// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Thrown when ABI inputs cannot be encoded.
 *
 * @since 0.1.0
 */
public final class AbiEncodingException extends AbiException {

    public AbiEncodingException(final Kind kind, final String message) {
        super(kind, message);
    }

    public AbiEncodingException(final Kind kind, final String message, final Throwable cause) {
        super(kind, message, cause);
    }

    public static AbiEncodingException arityMismatch(final int expected, final int actual) {
        return new AbiEncodingException(Kind.ARITY_MISMATCH,
                "parameter count mismatch: expected " + expected + ", got " + actual);
    }

    public static AbiEncodingException invalidAddress(final String message) {
        return new AbiEncodingException(Kind.INVALID_ADDRESS, message);
    }

    public static AbiEncodingException valueOutOfRange(final String message) {
        return new AbiEncodingException(Kind.VALUE_OUT_OF_RANGE, message);
    }

    public static AbiEncodingException negativeUnsigned(final String typeName) {
        return new AbiEncodingException(Kind.NEGATIVE_VALUE_FOR_UNSIGNED,
                "negative value supplied for " + typeName);
    }

    public static AbiEncodingException unsupportedType(final String typeName) {
        return new AbiEncodingException(Kind.UNSUPPORTED_TYPE, "unsupported type: " + typeName);
    }

    public static AbiEncodingException typeMismatch(final String typeName, final Object value) {
        final String actual = value == null ? "null" : value.getClass().getSimpleName();
        return new AbiEncodingException(Kind.VALUE_TYPE_MISMATCH,
                "value of kind " + actual + " cannot be encoded as " + typeName);
    }
}
