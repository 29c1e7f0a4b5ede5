// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core;

import java.math.BigInteger;

/**
 * Anything that can be coerced to a {@link BigInt} operand.
 *
 * <p>Every comparison and arithmetic method of {@link BigInt} accepts an
 * {@code IntegerLike}; {@code long} and decimal {@code String} operands are
 * covered by dedicated overloads on the same methods.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface IntegerLike {

    /**
     * Returns this operand as a {@link BigInt}.
     *
     * @return the coerced value, never {@code null}
     */
    BigInt toBigInt();

    /**
     * Adapts a raw {@link BigInteger}.
     *
     * @param value the engine value
     * @return an operand wrapping {@code value}
     */
    static IntegerLike of(final BigInteger value) {
        return BigInt.of(value);
    }
}
