// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.model;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.core.types.HexData;

/**
 * An event log entry emitted by a contract.
 *
 * <p>
 * The JSON shape is that of a JSON-RPC log object; block number and indexes are hex
 * quantities there.
 *
 * <p>
 * <strong>Nullability:</strong>
 * <ul>
 * <li>{@code blockNumber} and {@code blockHash} are {@code null} for pending logs</li>
 * <li>All other fields are required</li>
 * </ul>
 *
 * @param address         the emitting contract
 * @param topics          the indexed topics; {@code topics[0]} is usually the event signature hash
 * @param data            the non-indexed data, may be empty
 * @param blockNumber     the block number, or {@code null} when pending
 * @param blockHash       the block hash, or {@code null} when pending
 * @param transactionHash the hash of the transaction that emitted the log
 * @param transactionIndex the transaction's index within the block
 * @param logIndex        the index of this log within the block
 * @param removed         true if the log was removed by a chain reorganization
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LogEntry(
        Address address,
        List<Hash> topics,
        HexData data,
        @Nullable Long blockNumber,
        @Nullable Hash blockHash,
        Hash transactionHash,
        long transactionIndex,
        long logIndex,
        boolean removed) {

    public LogEntry {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(topics, "topics cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        topics = List.copyOf(topics);
    }

    @JsonCreator
    public static LogEntry fromJson(
            @JsonProperty("address") final Address address,
            @JsonProperty("topics") final List<Hash> topics,
            @JsonProperty("data") final HexData data,
            @JsonProperty("blockNumber") final @Nullable String blockNumber,
            @JsonProperty("blockHash") final @Nullable Hash blockHash,
            @JsonProperty("transactionHash") final Hash transactionHash,
            @JsonProperty("transactionIndex") final @Nullable String transactionIndex,
            @JsonProperty("logIndex") final @Nullable String logIndex,
            @JsonProperty("removed") final boolean removed) {
        final Long number = blockNumber == null ? null : quantity(blockNumber);
        return new LogEntry(
                address,
                topics == null ? List.of() : topics,
                data == null ? HexData.EMPTY : data,
                number,
                blockHash,
                transactionHash,
                transactionIndex == null ? 0L : quantity(transactionIndex),
                logIndex == null ? 0L : quantity(logIndex),
                removed);
    }

    /**
     * Returns the event signature topic, if any.
     *
     * @return {@code topics[0]}, or {@code null} for anonymous events
     */
    public @Nullable Hash topic0() {
        return topics.isEmpty() ? null : topics.get(0);
    }

    public boolean isPending() {
        return blockHash == null;
    }

    private static long quantity(final String hex) {
        if (!hex.startsWith("0x") || hex.length() < 3) {
            throw new IllegalArgumentException("Invalid hex quantity: " + hex);
        }
        return Long.parseUnsignedLong(hex.substring(2), 16);
    }
}
