// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core.util;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.IntFunction;

import sh.numera.core.BigInt;
import sh.numera.core.DebugLogger;
import sh.numera.core.error.DomainException;

/**
 * Memo table from {@code n} to {@code n!}.
 *
 * <p>Entries are added on first request and never evicted. Inserts go through
 * {@link ConcurrentMap#computeIfAbsent}, so under concurrent first access each
 * {@code n} is computed exactly once and readers never see a partially built value.
 *
 * @since 0.1.0
 */
public final class FactorialCache {

    private final ConcurrentMap<Integer, BigInt> table = new ConcurrentHashMap<>();
    private final IntFunction<BigInt> factorial;

    /**
     * Creates a cache backed by {@link BigInt#factorial(int)}.
     */
    public FactorialCache() {
        this(BigInt::factorial);
    }

    /**
     * Creates a cache backed by the given computation.
     *
     * @param factorial computes {@code n!} on a miss; must not return {@code null}
     */
    public FactorialCache(final IntFunction<BigInt> factorial) {
        this.factorial = Objects.requireNonNull(factorial, "factorial");
    }

    /**
     * Returns {@code n!}, computing and storing it on the first request.
     *
     * @param n a non-negative integer
     * @return the factorial of {@code n}
     * @throws DomainException if {@code n} is negative
     */
    public BigInt get(final int n) {
        if (n < 0) {
            throw new DomainException("Factorial of a negative number: " + n);
        }
        final BigInt cached = table.get(n);
        if (cached != null) {
            return cached;
        }
        return table.computeIfAbsent(n, key -> {
            DebugLogger.logCache("[FACTORIAL-MISS] n=%d", key);
            return Objects.requireNonNull(factorial.apply(key), "factorial result");
        });
    }

    public boolean contains(final int n) {
        return table.containsKey(n);
    }

    public int size() {
        return table.size();
    }
}
