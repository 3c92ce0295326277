// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.tessera.core.model.LogEntry;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.core.types.HexData;
import sh.tessera.core.util.Topics;

class EventFilterTest {

    static final Address TOKEN = new Address("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48");
    static final Address OTHER = new Address("0xdac17f958d2ee523a2206206994597c13d831ec7");
    static final Address ALICE = new Address("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266");
    static final Address BOB = new Address("0x70997970c51812dc3a010c7d01b50e0d17dc79c8");
    static final Hash TX = new Hash("0x88df016429689c079f3b2f6ad39fa052532c56795b733da78a91ebe6a713944b");

    static LogEntry transferLog(Address token, Address from, Address to, Long block) {
        return new LogEntry(token,
                List.of(EventSignatures.transfer(), Topics.fromAddress(from), Topics.fromAddress(to)),
                new HexData("0x" + "0".repeat(58) + "0f4240"),
                block, null, TX, 0, 0, false);
    }

    @Test
    void emptyFilterMatchesEverything() {
        assertTrue(EventFilter.any().matches(transferLog(TOKEN, ALICE, BOB, 1L)));
        assertTrue(EventFilter.builder().build().matches(transferLog(OTHER, BOB, ALICE, null)));
    }

    @Test
    void ignoresInvalidAddressesAndStoresLowercase() {
        EventFilter filter = EventFilter.builder()
                .address("not-an-address")
                .address("0x1234")
                .address("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48")
                .build();
        assertEquals(List.of(TOKEN), filter.addresses());
        assertEquals("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48", filter.addresses().get(0).value());
    }

    @Test
    void matchesByAddress() {
        EventFilter filter = EventFilter.builder().address(TOKEN).build();
        assertTrue(filter.matches(transferLog(TOKEN, ALICE, BOB, 1L)));
        assertFalse(filter.matches(transferLog(OTHER, ALICE, BOB, 1L)));
    }

    @Test
    void topicPositionsAreAlternatives() {
        EventFilter filter = EventFilter.builder()
                .topic(EventSignatures.transfer())
                .indexed(1, Topics.fromAddress(ALICE))
                .indexed(1, Topics.fromAddress(BOB))
                .build();
        assertTrue(filter.matches(transferLog(TOKEN, ALICE, OTHER, 1L)));
        assertTrue(filter.matches(transferLog(TOKEN, BOB, OTHER, 1L)));
        assertFalse(filter.matches(transferLog(TOKEN, OTHER, ALICE, 1L)));
    }

    @Test
    void unsetEarlierPositionsMatchAnything() {
        EventFilter filter = EventFilter.builder().indexed(2, Topics.fromAddress(BOB)).build();
        assertEquals(3, filter.topics().size());
        assertTrue(filter.matches(transferLog(TOKEN, ALICE, BOB, 1L)));
        assertFalse(filter.matches(transferLog(TOKEN, BOB, ALICE, 1L)));
    }

    @Test
    void comparesTopicsCaseInsensitively() {
        EventFilter filter = EventFilter.builder()
                .topic(new Hash("0xDDF252AD1BE2C89B69C2B068FC378DAA952BA7F163C4A11628F55A4DF523B3EF"))
                .build();
        assertTrue(filter.matches(transferLog(TOKEN, ALICE, BOB, 1L)));
    }

    @Test
    void constrainedPositionBeyondLogTopicsFails() {
        EventFilter filter = EventFilter.builder().indexed(3, Topics.fromAddress(BOB)).build();
        assertFalse(filter.matches(transferLog(TOKEN, ALICE, BOB, 1L)));
    }

    @Test
    void numericBlockBoundsAreInclusive() {
        EventFilter filter = EventFilter.builder().fromBlock(10).toBlock(20).build();
        assertFalse(filter.matches(transferLog(TOKEN, ALICE, BOB, 9L)));
        assertTrue(filter.matches(transferLog(TOKEN, ALICE, BOB, 10L)));
        assertTrue(filter.matches(transferLog(TOKEN, ALICE, BOB, 20L)));
        assertFalse(filter.matches(transferLog(TOKEN, ALICE, BOB, 21L)));
        assertTrue(filter.matches(transferLog(TOKEN, ALICE, BOB, null)));
    }

    @Test
    void namedTagsDoNotRestrict() {
        EventFilter latest = EventFilter.builder().fromBlock(5).latest().build();
        assertEquals(BlockTag.LATEST, latest.toBlock());
        assertTrue(latest.matches(transferLog(TOKEN, ALICE, BOB, 1_000_000L)));
        assertEquals(BlockTag.PENDING, EventFilter.builder().pending().build().toBlock());
        assertEquals("0x5", latest.fromBlock().toRpcValue());
    }
}
