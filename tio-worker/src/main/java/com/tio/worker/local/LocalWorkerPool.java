package com.tio.worker.local;

import com.tio.dispatch.TaskDescriptor;
import com.tio.dispatch.TaskSubmissionException;
import com.tio.dispatch.TaskSubmitter;
import com.tio.dispatch.TaskType;
import com.tio.worker.TaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process worker pool. A task starts once every task it depends on has finished, successfully or not,
 * and runs at most once per token. At most {@code threads} plugin handlers run within their time limit at once.
 * <p>
 * Handlers run on their own threads while a worker thread waits for them. A handler running past its soft
 * time limit is completed as FAILED, interrupted and left behind while its worker thread moves on.
 * A late result is dropped by the {@link TaskExecutor}.
 * <p>
 * Bookkeeping of a job's finished tasks is released once the job is COMPLETED or FAILED.
 * <p>
 * The pool is created first and {@link #attach attached} to its executor once the coordinator exists,
 * since the coordinator submits through the pool.
 */
public final class LocalWorkerPool implements TaskSubmitter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkerPool.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ExecutorService workers;
    private final ExecutorService handlers;
    private final Map<String, CompletableFuture<Void>> finishedByToken = new LinkedHashMap<>();
    private final Map<String, Set<String>> tokensByJob = new HashMap<>();
    private final AtomicInteger executions = new AtomicInteger();
    private volatile TaskExecutor executor;

    public LocalWorkerPool(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        this.workers = Executors.newFixedThreadPool(threads, daemonThreads("tio-worker-"));
        this.handlers = Executors.newCachedThreadPool(daemonThreads("tio-handler-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public void attach(TaskExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Schedules the task. Re-submitting a known token of a running job is a no-op.
     *
     * @throws TaskSubmissionException if the pool is not attached or closed, or a dependency token is unknown
     */
    @Override
    public void submit(TaskDescriptor descriptor) {
        TaskExecutor exec = executor;
        if (exec == null) {
            throw new TaskSubmissionException(descriptor.getToken(), "worker pool has no executor attached");
        }
        if (workers.isShutdown()) {
            throw new TaskSubmissionException(descriptor.getToken(), "worker pool is closed");
        }
        CompletableFuture<?>[] dependencies;
        CompletableFuture<Void> finished = new CompletableFuture<>();
        synchronized (finishedByToken) {
            if (finishedByToken.containsKey(descriptor.getToken())) {
                log.debug("Task {} already submitted; ignoring duplicate", descriptor.getToken());
                return;
            }
            List<CompletableFuture<Void>> deps = new ArrayList<>();
            for (String token : descriptor.getDependencies()) {
                CompletableFuture<Void> dep = finishedByToken.get(token);
                if (dep == null) {
                    throw new TaskSubmissionException(descriptor.getToken(), "unknown dependency " + token);
                }
                deps.add(dep);
            }
            dependencies = deps.toArray(new CompletableFuture<?>[0]);
            finishedByToken.put(descriptor.getToken(), finished);
            tokensByJob.computeIfAbsent(descriptor.getJobId(), id -> new LinkedHashSet<>()).add(descriptor.getToken());
        }
        CompletableFuture.allOf(dependencies)
                .thenRunAsync(() -> run(exec, descriptor, finished), workers)
                .exceptionally(e -> {
                    exec.fail(descriptor, "task could not be started: " + e.getMessage());
                    finish(exec, descriptor, finished);
                    return null;
                });
        log.debug("Queued {} on {} ({} dependencies)", descriptor, descriptor.getQueue(), dependencies.length);
    }

    private void run(TaskExecutor exec, TaskDescriptor descriptor, CompletableFuture<Void> finished) {
        executions.incrementAndGet();
        try {
            if (descriptor.getType() == TaskType.STAGE_TRANSITION) {
                exec.execute(descriptor);
            } else {
                runHandler(exec, descriptor);
            }
        } catch (RuntimeException e) {
            log.error("Task {} of job {} failed unexpectedly", descriptor.getToken(), descriptor.getJobId(), e);
            exec.fail(descriptor, String.valueOf(e.getMessage()));
        } finally {
            finish(exec, descriptor, finished);
        }
    }

    private void runHandler(TaskExecutor exec, TaskDescriptor descriptor) {
        Future<?> handler = handlers.submit(() -> exec.execute(descriptor));
        try {
            handler.get(descriptor.getSoftTimeLimitSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            exec.fail(descriptor, "soft time limit of " + descriptor.getSoftTimeLimitSeconds() + "s exceeded");
            handler.cancel(true);
            log.warn("Task {} of job {} exceeded its soft time limit; handler interrupted", descriptor.getToken(),
                    descriptor.getJobId());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            exec.fail(descriptor, String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exec.fail(descriptor, "worker interrupted");
            handler.cancel(true);
        }
    }

    private void finish(TaskExecutor exec, TaskDescriptor descriptor, CompletableFuture<Void> finished) {
        synchronized (finishedByToken) {
            finished.complete(null);
            if (exec.isJobFinished(descriptor.getJobId())) {
                release(descriptor.getJobId());
            }
        }
    }

    /** Drops the finished tasks of a COMPLETED or FAILED job; tasks still queued or running stay. */
    private void release(String jobId) {
        synchronized (finishedByToken) {
            Set<String> tokens = tokensByJob.get(jobId);
            if (tokens == null) {
                return;
            }
            for (Iterator<String> it = tokens.iterator(); it.hasNext(); ) {
                String token = it.next();
                CompletableFuture<Void> f = finishedByToken.get(token);
                if (f == null || f.isDone()) {
                    finishedByToken.remove(token);
                    it.remove();
                }
            }
            if (tokens.isEmpty()) {
                tokensByJob.remove(jobId);
            }
        }
    }

    /** Number of tasks whose bookkeeping is still held. */
    int getTrackedTaskCount() {
        synchronized (finishedByToken) {
            return finishedByToken.size();
        }
    }

    /** Number of tasks started so far. */
    public int getExecutionCount() {
        return executions.get();
    }

    /**
     * Waits until every submitted task (including tasks submitted while waiting) has finished.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            List<CompletableFuture<Void>> pending = new ArrayList<>();
            synchronized (finishedByToken) {
                for (CompletableFuture<Void> f : finishedByToken.values()) {
                    if (!f.isDone()) pending.add(f);
                }
            }
            if (pending.isEmpty()) {
                return true;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            try {
                CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                log.warn("Task future failed: {}", e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        handlers.shutdownNow();
    }
}
