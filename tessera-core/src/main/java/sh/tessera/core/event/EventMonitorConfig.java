// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.event;

import java.util.concurrent.Executor;

import org.jspecify.annotations.Nullable;

/**
 * Settings for an {@link EventMonitor}.
 *
 * @param mailboxCapacity per-subscription queue size; null means 100
 * @param handlerExecutor runs handlers; null means the monitor creates and owns a cached
 *                        daemon pool that it shuts down on close
 * @since 0.1.0
 */
public record EventMonitorConfig(Integer mailboxCapacity, @Nullable Executor handlerExecutor) {

    private static final int DEFAULT_MAILBOX_CAPACITY = 100;

    public EventMonitorConfig {
        mailboxCapacity = mailboxCapacity == null ? DEFAULT_MAILBOX_CAPACITY : mailboxCapacity;
        if (mailboxCapacity <= 0) {
            throw new IllegalArgumentException("mailboxCapacity must be positive, got " + mailboxCapacity);
        }
    }

    public static EventMonitorConfig defaults() {
        return new EventMonitorConfig(null, null);
    }
}
