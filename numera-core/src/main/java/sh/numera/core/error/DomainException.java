// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core.error;

/**
 * Thrown when an operand lies outside an operation's domain, for example the
 * square root of a negative number or a non-positive modulus.
 *
 * @since 0.1.0
 */
public final class DomainException extends NumeraException {

    public DomainException(final String message) {
        super(message);
    }

    public DomainException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
