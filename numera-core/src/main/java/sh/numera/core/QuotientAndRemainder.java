// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core;

import java.util.Objects;

/**
 * Result of {@link BigInt#divQR(IntegerLike, java.math.RoundingMode)}.
 *
 * <p>For dividend {@code n} and divisor {@code d},
 * {@code quotient * d + remainder == n} always holds.
 *
 * @param quotient  the rounded quotient
 * @param remainder the remainder matching that quotient
 */
public record QuotientAndRemainder(BigInt quotient, BigInt remainder) {
    public QuotientAndRemainder {
        Objects.requireNonNull(quotient, "quotient");
        Objects.requireNonNull(remainder, "remainder");
    }
}
