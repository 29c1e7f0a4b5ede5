// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core.util;

import static org.junit.jupiter.api.Assertions.*;

import java.security.ProviderException;
import java.security.SecureRandom;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import sh.numera.core.error.DomainException;
import sh.numera.core.error.RandomSourceException;

class RandomSourceTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(RandomSource.ALGORITHM_PROPERTY);
    }

    @Test
    void defaultSourceProducesRequestedLength() {
        RandomSource source = RandomSource.create(null);
        assertEquals(32, source.nextBytes(32).length);
        assertEquals(0, source.nextBytes(0).length);
        assertNotNull(source.algorithm());
    }

    @Test
    void namedAlgorithmIsUsed() {
        RandomSource source = RandomSource.create("SHA1PRNG");
        assertEquals("SHA1PRNG", source.algorithm());
    }

    @Test
    void algorithmFromSystemProperty() {
        System.setProperty(RandomSource.ALGORITHM_PROPERTY, "SHA1PRNG");
        assertEquals("SHA1PRNG", RandomSource.fromSystemProperties().algorithm());
    }

    @Test
    void blankAlgorithmFallsBackToDefault() {
        assertNotNull(RandomSource.create("  ").algorithm());
    }

    @Test
    void unknownAlgorithmFails() {
        RandomSourceException e = assertThrows(RandomSourceException.class,
                () -> RandomSource.create("NoSuchRandom"));
        assertNotNull(e.getCause());
    }

    @Test
    void generatorFailureIsTyped() {
        RandomSource source = new RandomSource(new FailingSecureRandom());
        RandomSourceException e = assertThrows(RandomSourceException.class, () -> source.nextBytes(8));
        assertInstanceOf(ProviderException.class, e.getCause());
    }

    @Test
    void negativeSizeRejected() {
        assertThrows(DomainException.class, () -> RandomSource.create(null).nextBytes(-1));
    }

    static final class FailingSecureRandom extends SecureRandom {
        @Override
        public void nextBytes(byte[] bytes) {
            throw new ProviderException("entropy source exhausted");
        }
    }
}
