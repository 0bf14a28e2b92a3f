package com.tio.config;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The set of valid task queues, the fallback default queue, and the prefix applied to queue names
 * when a task is submitted (e.g. prefix {@code prod-} turns {@code long} into {@code prod-long}).
 * The default queue is always valid.
 */
public final class QueueSettings {

    private final Set<String> validQueues;
    private final String defaultQueue;
    private final String prefix;

    public QueueSettings(List<String> validQueues, String defaultQueue, String prefix) {
        this.defaultQueue = defaultQueue != null && !defaultQueue.isBlank() ? defaultQueue.trim() : TioConfig.DEFAULT_QUEUE;
        Set<String> queues = new LinkedHashSet<>();
        queues.add(this.defaultQueue);
        if (validQueues != null) {
            for (String q : validQueues) {
                if (q != null && !q.isBlank()) queues.add(q.trim());
            }
        }
        this.validQueues = Collections.unmodifiableSet(queues);
        this.prefix = prefix != null ? prefix.trim() : "";
    }

    /** Settings with only the default queue and no prefix. */
    public static QueueSettings defaults() {
        return new QueueSettings(List.of(), TioConfig.DEFAULT_QUEUE, "");
    }

    public Set<String> getValidQueues() {
        return validQueues;
    }

    public String getDefaultQueue() {
        return defaultQueue;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isValid(String queue) {
        return queue != null && validQueues.contains(queue.trim());
    }

    /**
     * Returns the queue itself when valid, otherwise the default queue. Callers log the fallback.
     *
     * @param queue configured queue (may be null)
     * @return a valid queue name (unprefixed)
     */
    public String validOrDefault(String queue) {
        return isValid(queue) ? queue.trim() : defaultQueue;
    }

    /**
     * Name under which the worker pool knows the queue: prefix + queue.
     *
     * @param queue valid queue name
     * @return qualified name
     */
    public String qualifiedName(String queue) {
        return prefix + Objects.requireNonNull(queue, "queue");
    }

    /** Qualified names of every valid queue (what workers poll). */
    public List<String> qualifiedQueueNames() {
        return validQueues.stream().map(this::qualifiedName).collect(Collectors.toList());
    }
}
