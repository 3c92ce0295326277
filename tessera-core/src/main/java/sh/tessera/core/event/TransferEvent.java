// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.event;

import java.math.BigInteger;

import sh.tessera.core.types.Address;

/**
 * An ERC-20 {@code Transfer}.
 *
 * @param token the emitting contract
 * @since 0.1.0
 */
public record TransferEvent(Address token, Address from, Address to, BigInteger amount) {
}
