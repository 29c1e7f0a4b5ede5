// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core.util;

import java.security.NoSuchAlgorithmException;
import java.security.ProviderException;
import java.security.SecureRandom;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.numera.core.DebugLogger;
import sh.numera.core.error.DomainException;
import sh.numera.core.error.RandomSourceException;

/**
 * Cryptographically secure byte source backed by {@link SecureRandom}.
 *
 * <p>The algorithm can be chosen with the {@value #ALGORITHM_PROPERTY} system
 * property; when it is absent the platform default is used. Every failure of the
 * underlying generator surfaces as {@link RandomSourceException}.
 *
 * @since 0.1.0
 */
public final class RandomSource {

    /** System property naming the {@link SecureRandom} algorithm, e.g. {@code DRBG}. */
    public static final String ALGORITHM_PROPERTY = "numera.random.algorithm";

    private static final Logger LOG = LoggerFactory.getLogger(RandomSource.class);

    private final SecureRandom random;

    public RandomSource(final SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Creates a source configured from {@value #ALGORITHM_PROPERTY}.
     *
     * @return a new source
     * @throws RandomSourceException if the configured algorithm is unavailable
     */
    public static RandomSource fromSystemProperties() {
        return create(System.getProperty(ALGORITHM_PROPERTY));
    }

    /**
     * Creates a source for the named algorithm.
     *
     * @param algorithm a {@link SecureRandom} algorithm name, or {@code null}/blank for
     *                  the platform default
     * @return a new source
     * @throws RandomSourceException if the algorithm is unavailable
     */
    public static RandomSource create(final String algorithm) {
        if (algorithm == null || algorithm.isBlank()) {
            final SecureRandom random = new SecureRandom();
            DebugLogger.logRandom("[RANDOM-INIT] algorithm=%s (default)", random.getAlgorithm());
            return new RandomSource(random);
        }
        try {
            final SecureRandom random = SecureRandom.getInstance(algorithm.trim());
            DebugLogger.logRandom("[RANDOM-INIT] algorithm=%s", random.getAlgorithm());
            return new RandomSource(random);
        } catch (NoSuchAlgorithmException e) {
            throw new RandomSourceException("Secure random algorithm not available: " + algorithm, e);
        }
    }

    /**
     * Draws {@code size} random bytes.
     *
     * @param size number of bytes, zero or more
     * @return a new array of random bytes
     * @throws DomainException       if {@code size} is negative
     * @throws RandomSourceException if the generator fails
     */
    public byte[] nextBytes(final int size) {
        if (size < 0) {
            throw new DomainException("Random size must not be negative: " + size);
        }
        final byte[] bytes = new byte[size];
        try {
            random.nextBytes(bytes);
        } catch (ProviderException | IllegalStateException e) {
            LOG.debug("Secure random generator {} failed: {}", random.getAlgorithm(), e.getMessage());
            throw new RandomSourceException("Secure random source failed to produce " + size + " bytes", e);
        }
        return bytes;
    }

    public String algorithm() {
        return random.getAlgorithm();
    }
}
