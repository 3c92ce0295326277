// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Base runtime exception for all Tessera failures.
 *
 * <p>
 * Every failure Tessera reports is a local, deterministic validation failure:
 * nothing here talks to a network, so there is no retryable subclass.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * TesseraException
 * ├── {@link AbiException} - call codec failures, each tagged with an {@link AbiException.Kind}
 * │   ├── {@link AbiEncodingException} - a value cannot be encoded
 * │   ├── {@link AbiDecodingException} - bytes cannot be decoded
 * │   └── {@link AbiSignatureException} - a signature string is malformed
 * └── {@link UnitFormatException} - a decimal amount string is malformed
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     EncodedCall call = AbiEncoder.encodeCall("transfer", params, values);
 * } catch (AbiException e) {
 *     if (e.kind() == AbiException.Kind.INVALID_ADDRESS) {
 *         // reject user input
 *     }
 * } catch (TesseraException e) {
 *     // anything else Tessera rejected
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class TesseraException extends RuntimeException
        permits AbiException,
        UnitFormatException {

    public TesseraException(final String message) {
        super(message);
    }

    public TesseraException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
