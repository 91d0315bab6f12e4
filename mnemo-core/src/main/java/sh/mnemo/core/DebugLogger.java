// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mnemo.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized diagnostic logger, active only while {@link MnemoDebug} is enabled.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.mnemo.debug");

    private DebugLogger() {
    }

    /**
     * Logs a {@link String#formatted}-style message when diagnostics are enabled.
     * The formatted text is always passed through {@link LogSanitizer}.
     */
    public static void log(final String message, final Object... args) {
        if (!MnemoDebug.isEnabled()) {
            return;
        }
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
