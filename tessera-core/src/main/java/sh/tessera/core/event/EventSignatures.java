// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.event;

import sh.tessera.core.abi.Abi;
import sh.tessera.core.types.Hash;

/**
 * Topic hashes of the standard token events, computed on first use.
 *
 * <p>
 * ERC-20 and ERC-721 share the {@code Transfer} and {@code Approval} signatures; the
 * token standard is told apart by the number of indexed topics.
 *
 * @since 0.1.0
 */
public final class EventSignatures {

    public static final String TRANSFER = "Transfer(address,address,uint256)";
    public static final String APPROVAL = "Approval(address,address,uint256)";
    public static final String APPROVAL_FOR_ALL = "ApprovalForAll(address,address,bool)";

    private EventSignatures() {
    }

    /** {@code keccak256("Transfer(address,address,uint256)")}. */
    public static Hash transfer() {
        return Holder.TRANSFER_TOPIC;
    }

    /** {@code keccak256("Approval(address,address,uint256)")}. */
    public static Hash approval() {
        return Holder.APPROVAL_TOPIC;
    }

    /** {@code keccak256("ApprovalForAll(address,address,bool)")}. */
    public static Hash approvalForAll() {
        return Holder.APPROVAL_FOR_ALL_TOPIC;
    }

    public static Hash erc20Transfer() {
        return transfer();
    }

    public static Hash erc20Approval() {
        return approval();
    }

    public static Hash erc721Transfer() {
        return transfer();
    }

    public static Hash erc721Approval() {
        return approval();
    }

    public static Hash erc721ApprovalForAll() {
        return approvalForAll();
    }

    private static final class Holder {
        static final Hash TRANSFER_TOPIC = Abi.eventTopic(TRANSFER);
        static final Hash APPROVAL_TOPIC = Abi.eventTopic(APPROVAL);
        static final Hash APPROVAL_FOR_ALL_TOPIC = Abi.eventTopic(APPROVAL_FOR_ALL);
    }
}
