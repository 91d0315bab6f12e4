// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core;

import java.util.regex.Pattern;

/**
 * Utility that removes key material from diagnostic messages.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts hex runs of 32 digits or more, the shape of entropy, seeds and digests</li>
 * <li>Truncates excessively long messages</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized output. */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated messages. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** 16 bytes or more of hex, with or without a 0x prefix. */
    private static final Pattern KEY_MATERIAL_PATTERN =
            Pattern.compile("(?:0[xX])?[0-9a-fA-F]{32,}");

    private static final String KEY_MATERIAL_REPLACEMENT = "0x***[REDACTED]***";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = KEY_MATERIAL_PATTERN.matcher(input).replaceAll(KEY_MATERIAL_REPLACEMENT);

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }
        return sanitized;
    }
}
