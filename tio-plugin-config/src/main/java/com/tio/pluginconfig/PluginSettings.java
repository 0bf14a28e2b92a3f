package com.tio.pluginconfig;

import java.util.Objects;

/** Execution settings of a plugin: destination queue and soft time limit (seconds). */
public final class PluginSettings {

    public static final String DEFAULT_QUEUE = "default";
    public static final int DEFAULT_SOFT_TIME_LIMIT_SECONDS = 60;

    private final String queue;
    private final int softTimeLimitSeconds;

    public PluginSettings(String queue, int softTimeLimitSeconds) {
        this.queue = queue != null && !queue.isBlank() ? queue.trim() : DEFAULT_QUEUE;
        if (softTimeLimitSeconds <= 0) {
            throw new IllegalArgumentException("soft_time_limit must be positive: " + softTimeLimitSeconds);
        }
        this.softTimeLimitSeconds = softTimeLimitSeconds;
    }

    public static PluginSettings defaults() {
        return new PluginSettings(DEFAULT_QUEUE, DEFAULT_SOFT_TIME_LIMIT_SECONDS);
    }

    public String getQueue() {
        return queue;
    }

    public int getSoftTimeLimitSeconds() {
        return softTimeLimitSeconds;
    }

    public PluginSettings withQueue(String newQueue) {
        return new PluginSettings(newQueue, softTimeLimitSeconds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginSettings that = (PluginSettings) o;
        return softTimeLimitSeconds == that.softTimeLimitSeconds && queue.equals(that.queue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queue, softTimeLimitSeconds);
    }

    @Override
    public String toString() {
        return "PluginSettings(queue=" + queue + ", softTimeLimit=" + softTimeLimitSeconds + "s)";
    }
}
