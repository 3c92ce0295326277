// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Thrown when ABI outputs or event logs cannot be decoded.
 *
 * @since 0.1.0
 */
public final class AbiDecodingException extends AbiException {

    public AbiDecodingException(final Kind kind, final String message) {
        super(kind, message);
    }

    public AbiDecodingException(final Kind kind, final String message, final Throwable cause) {
        super(kind, message, cause);
    }

    public static AbiDecodingException emptyData() {
        return new AbiDecodingException(Kind.EMPTY_DATA, "empty data");
    }

    public static AbiDecodingException truncated(final String context, final long needed, final int available) {
        return new AbiDecodingException(Kind.TRUNCATED_DATA,
                "insufficient data for " + context + ": need " + needed + " bytes, have " + available);
    }

    public static AbiDecodingException unsupportedType(final String typeName) {
        return new AbiDecodingException(Kind.UNSUPPORTED_TYPE, "unsupported decode type: " + typeName);
    }
}
