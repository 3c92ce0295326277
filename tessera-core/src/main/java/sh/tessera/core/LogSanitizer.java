// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core;

import java.util.regex.Pattern;

/**
 * Removes sensitive data from debug log payloads.
 *
 * <p>
 * Private key values are redacted and excessively long messages are truncated.
 */
public final class LogSanitizer {

    /** Messages longer than this are truncated. */
    static final int MAX_LOG_LENGTH = 2000;

    static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern PRIVATE_KEY_PATTERN =
            Pattern.compile("\"privateKey\"\\s*:\\s*\"0x[^\"]+\"");

    private static final String PRIVATE_KEY_REPLACEMENT = "\"privateKey\":\"0x***[REDACTED]***\"";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"privateKey\"")) {
            sanitized = PRIVATE_KEY_PATTERN.matcher(sanitized).replaceAll(PRIVATE_KEY_REPLACEMENT);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length();
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
