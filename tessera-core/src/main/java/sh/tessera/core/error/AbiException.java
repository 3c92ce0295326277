// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

import java.util.Objects;

/**
 * Failure raised by the call codec.
 *
 * <p>
 * The concrete subclass tells which side failed (encode, decode, signature parsing);
 * {@link #kind()} tells why.
 *
 * @since 0.1.0
 */
public abstract sealed class AbiException extends TesseraException
        permits AbiEncodingException, AbiDecodingException, AbiSignatureException {

    /**
     * Categorizes the codec failure.
     */
    public enum Kind {
        /** Parameter and value counts differ. */
        ARITY_MISMATCH,
        /** An address is not exactly 20 bytes / 40 hex characters. */
        INVALID_ADDRESS,
        /** An integer does not fit its declared width. */
        VALUE_OUT_OF_RANGE,
        /** A negative integer was given for an unsigned type. */
        NEGATIVE_VALUE_FOR_UNSIGNED,
        /** The type is unknown, or not supported in this direction. */
        UNSUPPORTED_TYPE,
        /** A value variant does not match the type it is paired with. */
        VALUE_TYPE_MISMATCH,
        /** A read would run past the end of the data. */
        TRUNCATED_DATA,
        /** Nothing to decode. */
        EMPTY_DATA,
        /** A signature string is not of the form {@code name(type,...)}. */
        INVALID_SIGNATURE_FORMAT
    }

    private final Kind kind;

    protected AbiException(final Kind kind, final String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected AbiException(final Kind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Returns the category of this failure.
     *
     * @return the failure kind
     */
    public Kind kind() {
        return kind;
    }
}
