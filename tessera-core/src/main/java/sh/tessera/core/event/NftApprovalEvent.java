// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.event;

import java.math.BigInteger;

import sh.tessera.core.types.Address;

/**
 * An ERC-721 {@code Approval}.
 *
 * @param token the emitting contract
 * @since 0.1.0
 */
public record NftApprovalEvent(Address token, Address owner, Address approved, BigInteger tokenId) {
}
