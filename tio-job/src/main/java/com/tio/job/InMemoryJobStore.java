package com.tio.job;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** {@link JobStore} backed by a concurrent map. */
public final class InMemoryJobStore implements JobStore {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public void save(Job job) {
        Objects.requireNonNull(job, "job");
        jobs.put(job.getId(), job);
    }

    @Override
    public Optional<Job> find(String jobId) {
        if (jobId == null) return Optional.empty();
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<Job> all() {
        return new ArrayList<>(jobs.values());
    }
}
