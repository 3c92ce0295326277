// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.examples;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

import sh.tessera.core.TesseraDebug;
import sh.tessera.core.abi.Abi;
import sh.tessera.core.abi.AbiValue;
import sh.tessera.core.error.AbiException;
import sh.tessera.core.event.EventFilter;
import sh.tessera.core.event.EventMonitor;
import sh.tessera.core.event.EventSignatures;
import sh.tessera.core.event.EventSubscription;
import sh.tessera.core.event.TokenEvents;
import sh.tessera.core.event.TransferEvent;
import sh.tessera.core.model.LogEntry;
import sh.tessera.core.token.Erc20Token;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.core.types.HexData;
import sh.tessera.core.util.Topics;

/**
 * Encodes ERC-20 calls, decodes a {@code balanceOf} result and feeds a synthetic
 * {@code Transfer} log through an {@link EventMonitor}.
 */
public final class Erc20Example {

    private static final Address ALICE = new Address("0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266");
    private static final Address BOB = new Address("0x70997970C51812dc3A010C7d01b50e0d17dc79C8");

    private Erc20Example() {}

    public static void main(final String[] args) throws InterruptedException {
        TesseraDebug.setEnabled(true);

        final Erc20Token usdc = new Erc20Token(
                new Address("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48"), "USD Coin", "USDC", 6);

        // 1. Call data
        System.out.println("transfer:  " + usdc.encodeTransfer(BOB.value(), usdc.parseAmount("1")));
        System.out.println("balanceOf: " + usdc.encodeBalanceOf(ALICE.value()));
        System.out.println("generic:   " + Abi.encodeCall("setGreeting(string,bool)",
                AbiValue.string("gm"), AbiValue.bool(true)));

        // 2. Result decoding
        final HexData balance = new HexData("0x" + String.format("%064x", 12_500_000));
        System.out.println("Decoded balance: " + usdc.formatAmount(usdc.decodeBalance(balance)) + " " + usdc.symbol());

        // 3. Errors carry a kind
        try {
            usdc.encodeTransfer("0x1234", BigInteger.ONE);
        } catch (AbiException e) {
            System.out.println("Rejected (" + e.kind() + "): " + e.getMessage());
        }

        // 4. Events
        try (EventMonitor monitor = new EventMonitor()) {
            final EventSubscription sub = monitor.subscribe(EventFilter.builder()
                    .address(usdc.address())
                    .topic(EventSignatures.transfer())
                    .build());
            monitor.addHandler(EventSignatures.transfer(), log -> {
                final TransferEvent transfer = TokenEvents.parseTransfer(log);
                System.out.println("Handler saw " + usdc.formatAmount(transfer.amount()) + " USDC from " + transfer.from());
            });

            monitor.process(new LogEntry(usdc.address(),
                    List.of(EventSignatures.transfer(), Topics.fromAddress(ALICE), Topics.fromAddress(BOB)),
                    new HexData("0x" + String.format("%064x", 2_000_000)),
                    19_000_000L, null,
                    new Hash("0x88df016429689c079f3b2f6ad39fa052532c56795b733da78a91ebe6a713944b"),
                    0, 0, false));

            final LogEntry received = sub.poll(Duration.ofSeconds(1));
            System.out.println("Subscription " + sub.id() + " received log " + (received == null ? "none" : received.logIndex()));
            // let the handler pool finish before the monitor shuts down
            Thread.sleep(100);
        }
    }
}
