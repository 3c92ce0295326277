// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.event;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.model.LogEntry;

/**
 * A filter registered with an {@link EventMonitor}, with a bounded mailbox of matching logs.
 *
 * <p>
 * Delivery never blocks the producer: when the mailbox is full the log is dropped and
 * {@link #droppedCount()} is incremented. Consumers read with {@link #poll()},
 * {@link #poll(Duration)} or {@link #drain()}.
 *
 * <p>
 * Once stopped, the subscription receives nothing further; logs already in the mailbox
 * can still be read.
 *
 * @since 0.1.0
 */
public final class EventSubscription {

    private final String id;
    private final EventFilter filter;
    private final BlockingQueue<LogEntry> mailbox;
    private final Instant createdAt;
    private final AtomicBoolean active = new AtomicBoolean(true);
    private final AtomicLong dropped = new AtomicLong();

    EventSubscription(final String id, final EventFilter filter, final int capacity) {
        this.id = id;
        this.filter = filter;
        this.mailbox = new ArrayBlockingQueue<>(capacity);
        this.createdAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public EventFilter filter() {
        return filter;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isActive() {
        return active.get();
    }

    /**
     * Returns how many matching logs were dropped because the mailbox was full.
     *
     * @return the drop count
     */
    public long droppedCount() {
        return dropped.get();
    }

    /**
     * Retrieves the next log without waiting.
     *
     * @return the next log, or null if the mailbox is empty
     */
    public @Nullable LogEntry poll() {
        return mailbox.poll();
    }

    /**
     * Retrieves the next log, waiting up to {@code timeout}.
     *
     * @param timeout the maximum wait
     * @return the next log, or null on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public @Nullable LogEntry poll(final Duration timeout) throws InterruptedException {
        return mailbox.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Removes and returns every log currently in the mailbox.
     *
     * @return the logs, oldest first
     */
    public List<LogEntry> drain() {
        final List<LogEntry> out = new ArrayList<>();
        mailbox.drainTo(out);
        return out;
    }

    /**
     * Offers a log to the mailbox.
     *
     * @return true if queued, false if inactive or full
     */
    boolean offer(final LogEntry log) {
        if (!active.get()) {
            return false;
        }
        if (mailbox.offer(log)) {
            return true;
        }
        dropped.incrementAndGet();
        return false;
    }

    void stop() {
        active.set(false);
    }

    @Override
    public String toString() {
        return "EventSubscription[id=" + id + ", active=" + active.get() + ", dropped=" + dropped.get() + "]";
    }
}
