// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core.error;

/**
 * Thrown when a division, remainder or modulus is requested with a zero right-hand side.
 *
 * <p>The divisor is compared against zero before the engine is invoked, so this
 * exception replaces {@link ArithmeticException} from {@link java.math.BigInteger}.
 *
 * @since 0.1.0
 */
public final class DivisionByZeroException extends NumeraException {

    public DivisionByZeroException(final String message) {
        super(message);
    }

    public DivisionByZeroException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates the exception for the named operation.
     *
     * @param operation the operation that received a zero divisor
     * @return a new exception
     */
    public static DivisionByZeroException forOperation(final String operation) {
        return new DivisionByZeroException("Division by zero in " + operation);
    }
}
