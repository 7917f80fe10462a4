package com.cajunsystems.mirepoix.runtime;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeConfigTest {

    @Test
    void testDefaults() {
        RuntimeConfig config = RuntimeConfig.defaults();

        assertTrue(config.computationThreads() >= 2);
        assertEquals(RuntimeConfig.DEFAULT_BLOCKING_KEEP_ALIVE, config.blockingKeepAlive());
        assertEquals(RuntimeConfig.DEFAULT_SHUTDOWN_TIMEOUT, config.shutdownTimeout());
        assertEquals("mirepoix", config.threadNamePrefix());
    }

    @Test
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(RuntimeConfig.COMPUTATION_THREADS_PROPERTY, "3");
        properties.setProperty(RuntimeConfig.BLOCKING_KEEP_ALIVE_PROPERTY, " 1500 ");
        properties.setProperty(RuntimeConfig.SHUTDOWN_TIMEOUT_PROPERTY, "250");
        properties.setProperty(RuntimeConfig.THREAD_PREFIX_PROPERTY, "worker");

        RuntimeConfig config = RuntimeConfig.fromProperties(properties);

        assertEquals(3, config.computationThreads());
        assertEquals(Duration.ofMillis(1500), config.blockingKeepAlive());
        assertEquals(Duration.ofMillis(250), config.shutdownTimeout());
        assertEquals("worker", config.threadNamePrefix());
    }

    @Test
    void testMissingOrBlankPropertiesFallBackToDefaults() {
        Properties properties = new Properties();
        properties.setProperty(RuntimeConfig.SHUTDOWN_TIMEOUT_PROPERTY, "  ");

        RuntimeConfig config = RuntimeConfig.fromProperties(properties);

        assertEquals(RuntimeConfig.defaults(), config);
    }

    @Test
    void testInvalidNumberIsRejected() {
        Properties properties = new Properties();
        properties.setProperty(RuntimeConfig.COMPUTATION_THREADS_PROPERTY, "many");

        IllegalArgumentException thrown = assertThrows(
                IllegalArgumentException.class,
                () -> RuntimeConfig.fromProperties(properties)
        );
        assertTrue(thrown.getMessage().contains(RuntimeConfig.COMPUTATION_THREADS_PROPERTY));
        assertInstanceOf(NumberFormatException.class, thrown.getCause());
    }

    @Test
    void testInvalidValuesAreRejected() {
        RuntimeConfig defaults = RuntimeConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> defaults.withComputationThreads(0));
        assertThrows(IllegalArgumentException.class, () -> defaults.withBlockingKeepAlive(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> defaults.withShutdownTimeout(Duration.ofMillis(-5)));
        assertThrows(IllegalArgumentException.class, () -> defaults.withThreadNamePrefix(" "));
        assertThrows(NullPointerException.class, () -> defaults.withShutdownTimeout(null));
    }

    @Test
    void testWithersCopy() {
        RuntimeConfig defaults = RuntimeConfig.defaults();

        RuntimeConfig tuned = defaults.withComputationThreads(7).withThreadNamePrefix("io");

        assertEquals(7, tuned.computationThreads());
        assertEquals("io", tuned.threadNamePrefix());
        assertEquals(defaults.blockingKeepAlive(), tuned.blockingKeepAlive());
        assertNotEquals(defaults, tuned);
    }
}
