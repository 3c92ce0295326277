// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.event;

/**
 * A block bound for an {@link EventFilter}: a specific number or a named tag.
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * BlockTag from = BlockTag.of(12_345_678L);
 * BlockTag to = BlockTag.LATEST;
 * String rpcValue = from.toRpcValue(); // "0xbc614e"
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed interface BlockTag permits BlockTag.Named, BlockTag.Number {

    /** The latest mined block. */
    BlockTag LATEST = new Named("latest");

    /** The pending state. */
    BlockTag PENDING = new Named("pending");

    /** The genesis block. */
    BlockTag EARLIEST = new Named("earliest");

    static BlockTag of(final long blockNumber) {
        return new Number(blockNumber);
    }

    /**
     * Returns the JSON-RPC form: the name for named tags, a hex quantity for numbers.
     *
     * @return the RPC value
     */
    String toRpcValue();

    record Named(String name) implements BlockTag {
        public Named {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Block tag name cannot be null or blank");
            }
        }

        @Override
        public String toRpcValue() {
            return name;
        }
    }

    record Number(long blockNumber) implements BlockTag {
        public Number {
            if (blockNumber < 0) {
                throw new IllegalArgumentException("Block number cannot be negative: " + blockNumber);
            }
        }

        @Override
        public String toRpcValue() {
            return "0x" + Long.toHexString(blockNumber);
        }
    }
}
