// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NumeraDebugTest {

    @AfterEach
    void reset() {
        System.clearProperty(NumeraDebug.DEBUG_PROPERTY);
        NumeraDebug.setEnabled(false);
    }

    @Test
    @DisplayName("numera.debug=true enables both categories")
    void propertyEnablesLogging() {
        System.setProperty(NumeraDebug.DEBUG_PROPERTY, "true");
        NumeraDebug.reloadFromSystemProperties();

        assertTrue(NumeraDebug.isCacheLoggingEnabled());
        assertTrue(NumeraDebug.isRandomLoggingEnabled());
    }

    @Test
    void absentOrFalsePropertyDisablesLogging() {
        NumeraDebug.setEnabled(true);
        NumeraDebug.reloadFromSystemProperties();
        assertFalse(NumeraDebug.isEnabled());

        System.setProperty(NumeraDebug.DEBUG_PROPERTY, "false");
        NumeraDebug.setEnabled(true);
        NumeraDebug.reloadFromSystemProperties();
        assertFalse(NumeraDebug.isEnabled());
    }

    @Test
    @DisplayName("property changes apply only on reload")
    void propertyIsNotReadLive() {
        NumeraDebug.setEnabled(false);
        System.setProperty(NumeraDebug.DEBUG_PROPERTY, "true");

        assertFalse(NumeraDebug.isEnabled());
        NumeraDebug.reloadFromSystemProperties();
        assertTrue(NumeraDebug.isEnabled());
    }

    @Test
    void settersOverrideProperty() {
        System.setProperty(NumeraDebug.DEBUG_PROPERTY, "true");
        NumeraDebug.reloadFromSystemProperties();
        NumeraDebug.setRandomLogging(false);

        assertTrue(NumeraDebug.isCacheLoggingEnabled());
        assertFalse(NumeraDebug.isRandomLoggingEnabled());
        assertTrue(NumeraDebug.isEnabled());
    }
}
