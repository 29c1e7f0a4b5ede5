// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core.error;

/**
 * Thrown when the cryptographically secure random source cannot be created or
 * fails to produce bytes.
 *
 * @since 0.1.0
 */
public final class RandomSourceException extends NumeraException {

    public RandomSourceException(final String message) {
        super(message);
    }

    public RandomSourceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
