package com.tio.job;

import java.util.List;
import java.util.Optional;

/** Persistence of jobs. Implementations must return the same instance on every lookup of an id. */
public interface JobStore {

    void save(Job job);

    Optional<Job> find(String jobId);

    List<Job> all();
}
