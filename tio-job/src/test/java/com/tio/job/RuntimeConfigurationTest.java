package com.tio.job;

import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuntimeConfigurationTest {

    @Test
    void fromJson_flatShape() {
        RuntimeConfiguration config = RuntimeConfiguration.fromJson("""
                {"Validin": {"scan_choice": "advanced", "timeout": 5}}
                """);

        assertTrue(config.hasOverride("Validin", "scan_choice"));
        assertEquals("advanced", config.getOverride("Validin", "scan_choice"));
        assertEquals(5, config.getOverride("Validin", "timeout"));
        assertFalse(config.hasOverride("Validin", "other"));
    }

    @Test
    void fromJson_perKindShapeIsFlattened() {
        RuntimeConfiguration config = RuntimeConfiguration.fromJson("""
                {"analyzers": {"Validin": {"scan_choice": "advanced"}},
                 "connectors": {"Misp": {"ssl_check": false}}}
                """);

        assertEquals("advanced", config.getOverride("Validin", "scan_choice"));
        assertEquals(false, config.getOverride("Misp", "ssl_check"));
    }

    @Test
    void fromJson_nullValueIsAnOverride() {
        RuntimeConfiguration config = RuntimeConfiguration.fromJson("{\"Validin\": {\"scan_choice\": null}}");

        assertTrue(config.hasOverride("Validin", "scan_choice"));
        assertNull(config.getOverride("Validin", "scan_choice"));
    }

    @Test
    void fromJson_blankIsEmptyAndMalformedThrows() {
        assertTrue(RuntimeConfiguration.fromJson("  ").isEmpty());
        assertThrows(UncheckedIOException.class, () -> RuntimeConfiguration.fromJson("[1,2]"));
    }
}
