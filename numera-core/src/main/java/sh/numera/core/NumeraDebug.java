// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core;

/**
 * Global toggle for verbose debug logging across Numera modules.
 *
 * <p>Two categories exist:
 * <ul>
 * <li><b>cache</b>: every factorial cache miss, with the {@code n} being computed</li>
 * <li><b>random</b>: creation of a secure random source and its algorithm</li>
 * </ul>
 *
 * <p>Both start enabled when the {@value #DEBUG_PROPERTY} system property is
 * {@code true} at class initialisation. Later changes to the property take effect only
 * through {@link #reloadFromSystemProperties()}; the setters override it at any time.
 * The flags are volatile; toggling them is visible to all threads.
 */
public final class NumeraDebug {

    /** System property that enables debug logging at startup. */
    public static final String DEBUG_PROPERTY = "numera.debug";

    private static volatile boolean cacheLogging;
    private static volatile boolean randomLogging;

    static {
        reloadFromSystemProperties();
    }

    private NumeraDebug() {
    }

    /**
     * Sets both categories from the current value of {@value #DEBUG_PROPERTY}.
     */
    public static void reloadFromSystemProperties() {
        setEnabled(Boolean.getBoolean(DEBUG_PROPERTY));
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either cache or random-source logging is enabled
     */
    public static boolean isEnabled() {
        return cacheLogging || randomLogging;
    }

    public static void setEnabled(final boolean enabled) {
        cacheLogging = enabled;
        randomLogging = enabled;
    }

    public static void setCacheLogging(final boolean enabled) {
        cacheLogging = enabled;
    }

    public static boolean isCacheLoggingEnabled() {
        return cacheLogging;
    }

    public static void setRandomLogging(final boolean enabled) {
        randomLogging = enabled;
    }

    public static boolean isRandomLoggingEnabled() {
        return randomLogging;
    }
}
