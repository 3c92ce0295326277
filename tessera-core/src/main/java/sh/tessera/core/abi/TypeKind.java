// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

/**
 * The closed set of ABI type families the codec understands.
 *
 * @since 0.1.0
 */
public enum TypeKind {
    ADDRESS,
    UINT,
    INT,
    BOOL,
    STRING,
    BYTES,
    ARRAY
}
