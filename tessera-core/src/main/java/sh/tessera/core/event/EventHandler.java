// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.event;

import sh.tessera.core.model.LogEntry;

/**
 * Callback invoked by {@link EventMonitor} for logs whose {@code topics[0]} it was
 * registered for. Exceptions are logged by the monitor and do not affect other handlers.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface EventHandler {

    void handle(LogEntry log) throws Exception;
}
