// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core.util;

import java.util.Objects;

import sh.numera.core.BigInt;
import sh.numera.core.IntegerLike;
import sh.numera.core.error.DomainException;
import sh.numera.core.error.RandomSourceException;

/**
 * Stateless helpers built on the public {@link BigInt} contract.
 *
 * <p>The factorial cache and the default random source are process-wide and
 * created on first use.
 *
 * @since 0.1.0
 */
public final class BigIntUtils {

    private static final FactorialCache FACTORIALS = new FactorialCache();

    private static volatile RandomSource sharedRandom;

    private BigIntUtils() {
        // Utility class
    }

    /**
     * Returns {@code n!} from the process-wide cache, computing it at most once per {@code n}.
     *
     * @param n a non-negative integer
     * @return the factorial of {@code n}
     * @throws DomainException if {@code n} is negative
     */
    public static BigInt cachedFactorial(final int n) {
        return FACTORIALS.get(n);
    }

    /**
     * Greatest common divisor of two operands.
     *
     * @return the non-negative gcd; {@code gcd(0, 0) == 0}
     */
    public static BigInt gcd(final IntegerLike a, final IntegerLike b) {
        Objects.requireNonNull(a, "a");
        return a.toBigInt().gcd(b);
    }

    public static BigInt gcd(final IntegerLike a, final long b) {
        return gcd(a, BigInt.of(b));
    }

    public static BigInt gcd(final IntegerLike a, final String b) {
        return gcd(a, BigInt.from(b));
    }

    public static BigInt gcd(final long a, final IntegerLike b) {
        return gcd(BigInt.of(a), b);
    }

    public static BigInt gcd(final long a, final long b) {
        return gcd(BigInt.of(a), BigInt.of(b));
    }

    public static BigInt gcd(final long a, final String b) {
        return gcd(BigInt.of(a), BigInt.from(b));
    }

    public static BigInt gcd(final String a, final IntegerLike b) {
        return gcd(BigInt.from(a), b);
    }

    public static BigInt gcd(final String a, final long b) {
        return gcd(BigInt.from(a), BigInt.of(b));
    }

    public static BigInt gcd(final String a, final String b) {
        return gcd(BigInt.from(a), BigInt.from(b));
    }

    /**
     * Cryptographically secure random value of {@code sizeBytes} bytes, read big-endian.
     *
     * @param sizeBytes number of random bytes, zero or more
     * @return a value in {@code [0, 256^sizeBytes)}
     * @throws DomainException       if {@code sizeBytes} is negative
     * @throws RandomSourceException if the secure random source is unavailable or fails
     */
    public static BigInt random(final int sizeBytes) {
        return random(sizeBytes, sharedRandom());
    }

    /**
     * Same as {@link #random(int)} but drawing from the given source.
     */
    public static BigInt random(final int sizeBytes, final RandomSource source) {
        Objects.requireNonNull(source, "source");
        return BigInt.fromBuffer(source.nextBytes(sizeBytes), false);
    }

    private static RandomSource sharedRandom() {
        RandomSource source = sharedRandom;
        if (source == null) {
            synchronized (BigIntUtils.class) {
                source = sharedRandom;
                if (source == null) {
                    source = RandomSource.fromSystemProperties();
                    sharedRandom = source;
                }
            }
        }
        return source;
    }
}
