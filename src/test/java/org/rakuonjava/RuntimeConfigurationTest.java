package org.rakuonjava;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RuntimeConfigurationTest {

    @Test
    void bundledResourceGivesDefaults() {
        RuntimeConfiguration config = RuntimeConfiguration.get();
        assertEquals(Configuration.defaultHyperBatch, config.getHyperBatch());
        assertEquals(Configuration.defaultHyperDegree, config.getHyperDegree());
        assertSame(config, RuntimeConfiguration.get());
    }

    @Test
    void missingResourceGivesDefaults() {
        RuntimeConfiguration config = RuntimeConfiguration.load("no-such-file.toml");
        assertEquals(Configuration.defaultHyperBatch, config.getHyperBatch());
        assertEquals(Configuration.defaultHyperDegree, config.getHyperDegree());
        assertFalse(config.isDebugHyper());
    }

    @Test
    void loadsResourceFromClasspath() {
        RuntimeConfiguration config = RuntimeConfiguration.load("rakuonjava-test.toml");
        assertEquals(16, config.getHyperBatch());
        assertEquals(2, config.getHyperDegree());
        assertTrue(config.isDebugSeq());
        assertFalse(config.isDebugHyper());
    }

    @Test
    void partialTableKeepsOtherDefaults() {
        RuntimeConfiguration config = RuntimeConfiguration.parse("[hyper]\ndegree = 8\n");
        assertEquals(Configuration.defaultHyperBatch, config.getHyperBatch());
        assertEquals(8, config.getHyperDegree());
    }

    @Test
    void invalidTomlIsRejected() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> RuntimeConfiguration.parse("[hyper\nbatch = "));
        assertTrue(e.getMessage().startsWith("Invalid configuration in <string>"));
    }

    @Test
    void nonPositiveSettingsAreRejected() {
        assertThrows(IllegalStateException.class, () -> RuntimeConfiguration.parse("[hyper]\nbatch = 0\n"));
        assertThrows(IllegalStateException.class, () -> RuntimeConfiguration.parse("[hyper]\ndegree = -1\n"));
    }

    @Test
    void systemPropertyOverridesFile() {
        System.setProperty("rakuonjava.hyper.batch", "5");
        try {
            RuntimeConfiguration config = RuntimeConfiguration.parse("[hyper]\nbatch = 100\n");
            assertEquals(5, config.getHyperBatch());
        } finally {
            System.clearProperty("rakuonjava.hyper.batch");
        }
    }
}
