// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger gated by {@link NumeraDebug}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.numera.debug");

    private DebugLogger() {
    }

    /**
     * Traces factorial cache misses, one line per computed {@code n}.
     */
    public static void logCache(final String message, final Object... args) {
        if (!NumeraDebug.isCacheLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Traces secure random source creation and the algorithm chosen.
     */
    public static void logRandom(final String message, final Object... args) {
        if (!NumeraDebug.isRandomLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(formatted);
    }
}
