// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives.rlp;

/**
 * An item that can be RLP-encoded: either a byte string or a list of items.
 */
public sealed interface RlpItem permits RlpString, RlpList {

    /**
     * Encodes this item into its RLP byte representation.
     *
     * @return encoded bytes
     */
    byte[] encode();
}
