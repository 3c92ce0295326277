// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core;

/**
 * Global toggle for verbose debug logging across Tessera modules.
 *
 * <p>Fields are volatile; {@link #isEnabled()} reads them non-atomically, which is
 * acceptable for best-effort logging.
 */
public final class TesseraDebug {

    private static volatile boolean abiLogging = false;
    private static volatile boolean eventLogging = false;

    private TesseraDebug() {
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either codec or event logging is enabled
     */
    public static boolean isEnabled() {
        return abiLogging || eventLogging;
    }

    public static void setEnabled(final boolean enabled) {
        abiLogging = enabled;
        eventLogging = enabled;
    }

    public static void setAbiLogging(final boolean enabled) {
        abiLogging = enabled;
    }

    public static boolean isAbiLoggingEnabled() {
        return abiLogging;
    }

    public static void setEventLogging(final boolean enabled) {
        eventLogging = enabled;
    }

    public static boolean isEventLoggingEnabled() {
        return eventLogging;
    }
}
