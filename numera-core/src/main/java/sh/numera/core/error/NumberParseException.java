// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core.error;

/**
 * Thrown when a string does not represent an integer in the requested base.
 *
 * @since 0.1.0
 */
public final class NumberParseException extends NumeraException {

    public NumberParseException(final String message) {
        super(message);
    }

    public NumberParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
