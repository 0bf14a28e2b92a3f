package com.tio.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TioConfigTest {

    @Test
    void builder_defaultQueueIsAlwaysValid() {
        TioConfig config = TioConfig.builder()
                .queues(List.of("long", "local"))
                .defaultQueue("default")
                .build();

        QueueSettings queues = config.getQueueSettings();
        assertTrue(queues.isValid("default"));
        assertTrue(queues.isValid("long"));
        assertFalse(queues.isValid("gpu"));
    }

    @Test
    void validOrDefault_fallsBackForUnknownQueue() {
        QueueSettings queues = new QueueSettings(List.of("long"), "default", "");

        assertEquals("long", queues.validOrDefault("long"));
        assertEquals("default", queues.validOrDefault("gpu"));
        assertEquals("default", queues.validOrDefault(null));
    }

    @Test
    void qualifiedName_appliesPrefix() {
        QueueSettings queues = new QueueSettings(List.of("long"), "default", "prod-");

        assertEquals("prod-long", queues.qualifiedName("long"));
        assertEquals(List.of("prod-default", "prod-long"), queues.qualifiedQueueNames());
    }

    @Test
    void builder_nonPositiveTimeLimitsUseDefaults() {
        TioConfig config = TioConfig.builder()
                .defaultSoftTimeLimitSeconds(0)
                .stageTransitionTimeLimitSeconds(-5)
                .build();

        assertEquals(TioConfig.DEFAULT_SOFT_TIME_LIMIT_SECONDS, config.getDefaultSoftTimeLimitSeconds());
        assertEquals(TioConfig.DEFAULT_STAGE_TRANSITION_TIME_LIMIT_SECONDS, config.getStageTransitionTimeLimitSeconds());
    }

    @Test
    void parseHelpers_handleBlankAndGarbage() {
        assertEquals(List.of("a", "b"), TioConfig.parseCommaSeparated(" a, ,b "));
        assertEquals(7, TioConfig.parseInt("x", 7));
        assertTrue(TioConfig.parseBoolean("1", false));
        assertFalse(TioConfig.parseBoolean(null, false));
    }
}
