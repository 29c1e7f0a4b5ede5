// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core.error;

/**
 * Thrown when a value does not fit the machine integer it is narrowed to.
 *
 * @since 0.1.0
 */
public final class IntegerOverflowException extends NumeraException {

    public IntegerOverflowException(final String message) {
        super(message);
    }

    public IntegerOverflowException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
