// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.event;

import java.math.BigInteger;

import sh.tessera.core.types.Address;

/**
 * An ERC-721 {@code Transfer}; the token id is the fourth topic.
 *
 * @param token the emitting contract
 * @since 0.1.0
 */
public record NftTransferEvent(Address token, Address from, Address to, BigInteger tokenId) {
}
