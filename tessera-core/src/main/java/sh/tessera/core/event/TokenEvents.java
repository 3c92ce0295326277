// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.event;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import sh.tessera.core.abi.AbiDecoder;
import sh.tessera.core.abi.AbiValue;
import sh.tessera.core.abi.TypeTag;
import sh.tessera.core.error.AbiDecodingException;
import sh.tessera.core.error.AbiException;
import sh.tessera.core.model.LogEntry;
import sh.tessera.core.util.Topics;

/**
 * Typed views of the standard token event logs.
 *
 * <p>
 * Indexed parameters come from the topics; the remaining value from the data. The
 * {@code topics[0]} signature is not checked, so callers filter first (see
 * {@link EventSignatures}).
 *
 * @since 0.1.0
 */
public final class TokenEvents {

    private TokenEvents() {
    }

    /**
     * Parses {@code Transfer(address indexed from, address indexed to, uint256 value)}.
     * Empty data is read as an amount of zero.
     *
     * @param log the log
     * @return the transfer
     * @throws AbiDecodingException if there are fewer than 3 topics or the data is truncated
     */
    public static TransferEvent parseTransfer(final LogEntry log) {
        requireTopics(log, 3, "Transfer");
        return new TransferEvent(log.address(),
                Topics.toAddress(log.topics().get(1)),
                Topics.toAddress(log.topics().get(2)),
                dataUint(log));
    }

    /**
     * Parses {@code Approval(address indexed owner, address indexed spender, uint256 value)}.
     *
     * @param log the log
     * @return the approval
     * @throws AbiDecodingException if there are fewer than 3 topics or the data is truncated
     */
    public static ApprovalEvent parseApproval(final LogEntry log) {
        requireTopics(log, 3, "Approval");
        return new ApprovalEvent(log.address(),
                Topics.toAddress(log.topics().get(1)),
                Topics.toAddress(log.topics().get(2)),
                dataUint(log));
    }

    /**
     * Parses the ERC-721 {@code Transfer}, whose token id is indexed.
     *
     * @param log the log
     * @return the transfer
     * @throws AbiDecodingException if there are fewer than 4 topics
     */
    public static NftTransferEvent parseNftTransfer(final LogEntry log) {
        requireTopics(log, 4, "NFT Transfer");
        return new NftTransferEvent(log.address(),
                Topics.toAddress(log.topics().get(1)),
                Topics.toAddress(log.topics().get(2)),
                Topics.toUint(log.topics().get(3)));
    }

    public static NftApprovalEvent parseNftApproval(final LogEntry log) {
        requireTopics(log, 4, "NFT Approval");
        return new NftApprovalEvent(log.address(),
                Topics.toAddress(log.topics().get(1)),
                Topics.toAddress(log.topics().get(2)),
                Topics.toUint(log.topics().get(3)));
    }

    /**
     * Parses {@code ApprovalForAll(address indexed owner, address indexed operator, bool approved)}.
     *
     * @param log the log
     * @return the event
     * @throws AbiDecodingException if there are fewer than 3 topics or no data
     */
    public static ApprovalForAllEvent parseApprovalForAll(final LogEntry log) {
        requireTopics(log, 3, "ApprovalForAll");
        final List<AbiValue> values = AbiDecoder.decodeResult(List.of(TypeTag.BOOL), log.data());
        return new ApprovalForAllEvent(log.address(),
                Topics.toAddress(log.topics().get(1)),
                Topics.toAddress(log.topics().get(2)),
                ((AbiValue.BoolValue) values.get(0)).value());
    }

    private static void requireTopics(final LogEntry log, final int required, final String event) {
        Objects.requireNonNull(log, "log");
        if (log.topics().size() < required) {
            throw new AbiDecodingException(AbiException.Kind.TRUNCATED_DATA,
                    "insufficient topics for " + event + " event: need " + required + ", have " + log.topics().size());
        }
    }

    private static BigInteger dataUint(final LogEntry log) {
        if (log.data().isEmpty()) {
            return BigInteger.ZERO;
        }
        final AbiValue value = AbiDecoder.decodeValue(TypeTag.UINT256, log.data().toBytes(), 0);
        return ((AbiValue.IntValue) value).value();
    }
}
