// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.event;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.model.LogEntry;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * Criteria selecting event logs by block range, emitting contract and topics.
 *
 * <p>
 * <strong>Topics:</strong> position {@code i} holds a list of alternatives; a log matches
 * the position if its {@code topics[i]} equals any of them. A position with no
 * alternatives matches anything, including a missing topic.
 *
 * <p>
 * <strong>Block range:</strong> numeric bounds are inclusive and apply only to logs that
 * carry a block number. Named tags ({@code latest}, {@code pending}) do not restrict.
 *
 * <pre>{@code
 * EventFilter filter = EventFilter.builder()
 *         .fromBlock(1_000_000L)
 *         .latest()
 *         .address("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48")
 *         .topic(EventSignatures.transfer())
 *         .build();
 * }</pre>
 *
 * @param fromBlock the lower bound, or null for none
 * @param toBlock   the upper bound, or null for none
 * @param addresses the accepted contracts, empty for any
 * @param topics    per-position alternatives
 * @since 0.1.0
 */
public record EventFilter(
        @Nullable BlockTag fromBlock,
        @Nullable BlockTag toBlock,
        List<Address> addresses,
        List<List<Hash>> topics) {

    public EventFilter {
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
        if (topics == null) {
            topics = List.of();
        } else {
            final List<List<Hash>> copy = new ArrayList<>(topics.size());
            for (List<Hash> alternatives : topics) {
                copy.add(alternatives == null ? List.of() : List.copyOf(alternatives));
            }
            topics = List.copyOf(copy);
        }
    }

    /** A filter that matches every log. */
    public static EventFilter any() {
        return new EventFilter(null, null, List.of(), List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Tests a log against this filter.
     *
     * @param log the log
     * @return true if the address, topics and block range all match
     */
    public boolean matches(final LogEntry log) {
        Objects.requireNonNull(log, "log");
        if (!addresses.isEmpty() && !addresses.contains(log.address())) {
            return false;
        }
        for (int i = 0; i < topics.size(); i++) {
            final List<Hash> alternatives = topics.get(i);
            if (alternatives.isEmpty()) {
                continue;
            }
            if (i >= log.topics().size() || !alternatives.contains(log.topics().get(i))) {
                return false;
            }
        }
        final Long block = log.blockNumber();
        if (block != null) {
            if (fromBlock instanceof BlockTag.Number from && block < from.blockNumber()) {
                return false;
            }
            if (toBlock instanceof BlockTag.Number to && block > to.blockNumber()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Builder for {@link EventFilter}.
     */
    public static final class Builder {
        private @Nullable BlockTag fromBlock;
        private @Nullable BlockTag toBlock;
        private final List<Address> addresses = new ArrayList<>();
        private final List<List<Hash>> topics = new ArrayList<>();

        private Builder() {
        }

        public Builder fromBlock(final long blockNumber) {
            this.fromBlock = BlockTag.of(blockNumber);
            return this;
        }

        public Builder fromBlock(final BlockTag tag) {
            this.fromBlock = tag;
            return this;
        }

        public Builder toBlock(final long blockNumber) {
            this.toBlock = BlockTag.of(blockNumber);
            return this;
        }

        public Builder toBlock(final BlockTag tag) {
            this.toBlock = tag;
            return this;
        }

        /** Sets the upper bound to {@code latest}. */
        public Builder latest() {
            this.toBlock = BlockTag.LATEST;
            return this;
        }

        /** Sets the upper bound to {@code pending}. */
        public Builder pending() {
            this.toBlock = BlockTag.PENDING;
            return this;
        }

        /**
         * Adds a contract address. Strings that are not valid addresses are ignored.
         *
         * @param address the address text
         * @return this builder
         */
        public Builder address(final String address) {
            if (Address.isValid(address)) {
                addresses.add(new Address(address));
            }
            return this;
        }

        public Builder address(final Address address) {
            addresses.add(Objects.requireNonNull(address, "address"));
            return this;
        }

        /**
         * Adds an alternative for the event signature position ({@code topics[0]}).
         *
         * @param topic the event topic
         * @return this builder
         */
        public Builder topic(final Hash topic) {
            return indexed(0, topic);
        }

        /**
         * Adds an alternative at topic position {@code position}; earlier positions left
         * unset match anything.
         *
         * @param position the topic index, 0 for the event signature
         * @param value the accepted topic value
         * @return this builder
         */
        public Builder indexed(final int position, final Hash value) {
            Objects.requireNonNull(value, "value");
            if (position < 0) {
                throw new IllegalArgumentException("topic position must be non-negative: " + position);
            }
            while (topics.size() <= position) {
                topics.add(new ArrayList<>());
            }
            topics.get(position).add(value);
            return this;
        }

        public EventFilter build() {
            return new EventFilter(fromBlock, toBlock, addresses, topics);
        }
    }
}
