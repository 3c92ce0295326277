// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.event;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.tessera.core.DebugLogger;
import sh.tessera.core.model.LogEntry;
import sh.tessera.core.types.Hash;

/**
 * Dispatches event logs to filtered subscriptions and to handlers keyed by event topic.
 *
 * <p>
 * The monitor does not fetch logs; callers feed it through {@link #process(LogEntry)}.
 * For each log:
 * <ol>
 * <li>every active subscription whose filter matches gets the log in its mailbox, or
 * counts a drop when the mailbox is full</li>
 * <li>every handler registered for the log's {@code topics[0]} is run on the handler
 * executor</li>
 * </ol>
 *
 * <p>
 * Thread-safe. {@code process} never blocks on a slow consumer.
 *
 * <pre>{@code
 * try (EventMonitor monitor = new EventMonitor()) {
 *     EventSubscription sub = monitor.subscribe(EventFilter.builder().address(token).build());
 *     monitor.addHandler(EventSignatures.transfer(), log -> System.out.println(TokenEvents.parseTransfer(log)));
 *     logs.forEach(monitor::process);
 *     List<LogEntry> received = sub.drain();
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class EventMonitor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EventMonitor.class);

    private final int mailboxCapacity;
    private final Executor handlerExecutor;
    private final @Nullable ExecutorService ownedExecutor;
    private final Map<String, EventSubscription> subscriptions = new ConcurrentHashMap<>();
    private final Map<Hash, List<EventHandler>> handlers = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public EventMonitor() {
        this(EventMonitorConfig.defaults());
    }

    public EventMonitor(final EventMonitorConfig config) {
        Objects.requireNonNull(config, "config");
        this.mailboxCapacity = config.mailboxCapacity();
        if (config.handlerExecutor() != null) {
            this.handlerExecutor = config.handlerExecutor();
            this.ownedExecutor = null;
        } else {
            final ExecutorService pool = Executors.newCachedThreadPool(r -> {
                final Thread t = new Thread(r, "tessera-event-handler");
                t.setDaemon(true);
                return t;
            });
            this.handlerExecutor = pool;
            this.ownedExecutor = pool;
        }
    }

    /**
     * Registers a filter and returns its subscription.
     *
     * @param filter the filter
     * @return a new active subscription
     * @throws IllegalStateException if the monitor is closed
     */
    public EventSubscription subscribe(final EventFilter filter) {
        Objects.requireNonNull(filter, "filter");
        ensureOpen();
        final EventSubscription sub = new EventSubscription("sub_" + nextId.getAndIncrement(), filter, mailboxCapacity);
        subscriptions.put(sub.id(), sub);
        DebugLogger.logEvent("[EVENT-SUBSCRIBE] id=%s", sub.id());
        return sub;
    }

    /**
     * Stops and removes a subscription.
     *
     * @param subscriptionId the id returned by {@link EventSubscription#id()}
     * @return true if a subscription was removed
     */
    public boolean unsubscribe(final String subscriptionId) {
        final EventSubscription sub = subscriptions.remove(subscriptionId);
        if (sub == null) {
            return false;
        }
        sub.stop();
        DebugLogger.logEvent("[EVENT-UNSUBSCRIBE] id=%s dropped=%d", sub.id(), sub.droppedCount());
        return true;
    }

    /**
     * Registers a handler for logs whose {@code topics[0]} equals {@code topic0}.
     *
     * @param topic0 the event signature topic
     * @param handler the handler
     */
    public void addHandler(final Hash topic0, final EventHandler handler) {
        Objects.requireNonNull(topic0, "topic0");
        Objects.requireNonNull(handler, "handler");
        ensureOpen();
        handlers.computeIfAbsent(topic0, k -> new CopyOnWriteArrayList<>()).add(handler);
    }

    /**
     * Delivers a log to matching subscriptions and schedules its handlers.
     * Ignored after {@link #close()}.
     *
     * @param entry the log
     */
    public void process(final LogEntry entry) {
        Objects.requireNonNull(entry, "entry");
        if (closed.get()) {
            return;
        }
        for (EventSubscription sub : subscriptions.values()) {
            if (sub.isActive() && sub.filter().matches(entry) && !sub.offer(entry) && sub.isActive()) {
                LOG.debug("Mailbox full, dropped log {} for subscription {} (dropped={})",
                        entry.logIndex(), sub.id(), sub.droppedCount());
            }
        }

        final Hash topic0 = entry.topic0();
        if (topic0 == null) {
            return;
        }
        final List<EventHandler> registered = handlers.get(topic0);
        if (registered == null) {
            return;
        }
        for (EventHandler handler : registered) {
            dispatch(handler, entry);
        }
    }

    /**
     * Returns the active subscriptions.
     *
     * @return a snapshot
     */
    public Collection<EventSubscription> subscriptions() {
        return new ArrayList<>(subscriptions.values());
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops every subscription and shuts down the handler pool if the monitor owns it.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        final int count = subscriptions.size();
        subscriptions.values().forEach(EventSubscription::stop);
        subscriptions.clear();
        handlers.clear();
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
        LOG.info("Event monitor closed, stopped {} subscription(s)", count);
    }

    private void dispatch(final EventHandler handler, final LogEntry entry) {
        try {
            handlerExecutor.execute(() -> {
                try {
                    handler.handle(entry);
                } catch (Exception e) {
                    LOG.error("Event handler failed for tx {} log {}", entry.transactionHash(), entry.logIndex(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.error("Event handler rejected by executor for tx {}", entry.transactionHash(), e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("EventMonitor is closed");
        }
    }
}
