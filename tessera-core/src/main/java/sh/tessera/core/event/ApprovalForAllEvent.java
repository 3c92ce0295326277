// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.event;

import sh.tessera.core.types.Address;

/**
 * An ERC-721 {@code ApprovalForAll}.
 *
 * @param token the emitting contract
 * @since 0.1.0
 */
public record ApprovalForAllEvent(Address token, Address owner, Address operator, boolean approved) {
}
