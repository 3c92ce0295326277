// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Thrown when a function or event signature string is malformed.
 *
 * @since 0.1.0
 */
public final class AbiSignatureException extends AbiException {

    public AbiSignatureException(final String message) {
        super(Kind.INVALID_SIGNATURE_FORMAT, message);
    }
}
