// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.util;

import java.math.BigInteger;
import java.util.Objects;

import sh.tessera.core.abi.Words;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.primitives.Hex;

/**
 * Conversions between typed values and 32-byte event topics.
 *
 * <p>Indexed address parameters are stored as topics left-padded with 12 zero bytes.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Hash senderTopic = Topics.fromAddress(sender);
 * EventFilter filter = EventFilter.builder()
 *     .address(tokenAddress)
 *     .topic(EventSignatures.transfer())
 *     .indexed(1, senderTopic)
 *     .build();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Topics {

    private static final String ADDRESS_ZERO_PADDING = "0".repeat(24);

    private Topics() {
        // Utility class
    }

    /**
     * Creates a 32-byte topic from an address (left-padded with zeros).
     *
     * @param address the address to convert
     * @return the topic
     */
    public static Hash fromAddress(final Address address) {
        Objects.requireNonNull(address, "address cannot be null");
        return new Hash("0x" + ADDRESS_ZERO_PADDING + Hex.cleanPrefix(address.value()));
    }

    /**
     * Creates a topic from an unsigned integer, as for an indexed {@code uint256}.
     *
     * @param value the value
     * @return the topic
     */
    public static Hash fromUint(final BigInteger value) {
        return Hash.fromBytes(Words.intToWord(value, false));
    }

    /**
     * Reads an indexed address back from its topic: the low 20 bytes.
     *
     * @param topic the topic
     * @return the address
     */
    public static Address toAddress(final Hash topic) {
        Objects.requireNonNull(topic, "topic cannot be null");
        return Words.addressFromWord(topic.toBytes());
    }

    public static BigInteger toUint(final Hash topic) {
        Objects.requireNonNull(topic, "topic cannot be null");
        return Words.wordToUint(topic.toBytes());
    }
}
