// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core.error;

/**
 * Base runtime exception for all Numera failures.
 *
 * <p>
 * This sealed class forms the root of Numera's exception hierarchy. Every
 * failure raised by {@link sh.numera.core.BigInt} and the utility layer is one
 * of its subclasses, raised synchronously and never retried.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * NumeraException
 * ├── {@link NumberParseException} - text that is not a number in the requested base
 * ├── {@link IntegerOverflowException} - narrowing to a machine integer lost bits
 * ├── {@link DivisionByZeroException} - zero divisor or modulus
 * ├── {@link DomainException} - operand outside the operation's domain
 * └── {@link RandomSourceException} - secure random source unavailable
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     BigInt q = BigInt.from(input).div(divisor);
 * } catch (NumberParseException e) {
 *     // Reject the input
 * } catch (DivisionByZeroException e) {
 *     // Handle zero divisor
 * } catch (NumeraException e) {
 *     // Catch-all for any other Numera error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class NumeraException extends RuntimeException
        permits NumberParseException,
        IntegerOverflowException,
        DivisionByZeroException,
        DomainException,
        RandomSourceException {

    public NumeraException(final String message) {
        super(message);
    }

    public NumeraException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
