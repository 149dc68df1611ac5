package com.skanga.sqlproxy.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigParamsTest {
    private static ConfigParams withPool(int minSize, int maxSize, int timeoutMs) {
        return new ConfigParams("jdbc:h2:mem:cfg", "sa", "", null, null, minSize, maxSize, timeoutMs,
                30, 10000, null, 600000, 1800000, 0);
    }

    @Test
    void testDefaultsAreFilledIn() {
        ConfigParams config = withPool(1, 4, 1000);

        assertEquals("org.h2.Driver", config.dbDriver());
        assertEquals(ConfigParams.DEFAULT_SCHEMA, config.dbSchema());
        assertEquals(List.of(), config.forbiddenKeywords());
    }

    @Test
    void testPoolBoundsAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> withPool(0, 4, 1000));
        assertThrows(IllegalArgumentException.class, () -> withPool(1, 101, 1000));
        assertThrows(IllegalArgumentException.class, () -> withPool(5, 4, 1000));
        assertThrows(IllegalArgumentException.class, () -> withPool(1, 4, 100));
        assertDoesNotThrow(() -> withPool(1, 1, ConfigParams.MIN_POOL_TIMEOUT_MS));
        assertDoesNotThrow(() -> withPool(100, 100, 1000));
    }

    @Test
    void testOtherLimitsAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> new ConfigParams(" ", "sa", "", null, null,
                1, 4, 1000, 30, 10000, null, 600000, 1800000, 0));
        assertThrows(IllegalArgumentException.class, () -> new ConfigParams("jdbc:h2:mem:cfg", "sa", "", null, null,
                1, 4, 1000, 0, 10000, null, 600000, 1800000, 0));
        assertThrows(IllegalArgumentException.class, () -> new ConfigParams("jdbc:h2:mem:cfg", "sa", "", null, null,
                1, 4, 1000, 30, 0, null, 600000, 1800000, 0));
    }

    @Test
    void testDatabaseType() {
        assertEquals("postgresql", ConfigParams.defaultConfig("jdbc:postgresql://localhost/app", "u", "p", null)
                .getDatabaseType());
        assertEquals("h2", withPool(1, 4, 1000).getDatabaseType());
        assertEquals("unknown", ConfigParams.defaultConfig("postgres://localhost/app", "u", "p", "org.postgresql.Driver")
                .getDatabaseType());
    }

    @Test
    void testToStringNeverShowsPassword() {
        ConfigParams config = ConfigParams.defaultConfig(
                "jdbc:postgresql://localhost/app?password=urlsecret", "reader", "s3cret", null);

        String rendered = config.toString();
        assertFalse(rendered.contains("s3cret"));
        assertFalse(rendered.contains("urlsecret"));
        assertTrue(rendered.contains("dbPass=***"));
        assertTrue(rendered.contains("dbUser=reader"));
    }
}
