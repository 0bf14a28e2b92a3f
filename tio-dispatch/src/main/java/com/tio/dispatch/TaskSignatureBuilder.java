package com.tio.dispatch;

import com.tio.config.QueueSettings;
import com.tio.config.TioConfig;
import com.tio.job.Job;
import com.tio.job.JobStatus;
import com.tio.pluginconfig.Parameter;
import com.tio.pluginconfig.PluginConfiguration;
import com.tio.pluginconfig.PluginKind;
import com.tio.registry.PluginConfigRegistry;
import com.tio.registry.RunnabilityCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Builds task descriptors. Every call mints a fresh idempotency token, so building twice for the same
 * plugin and job gives two distinct descriptors.
 */
public final class TaskSignatureBuilder {

    private static final Logger log = LoggerFactory.getLogger(TaskSignatureBuilder.class);

    private final PluginConfigRegistry registry;
    private final QueueSettings queueSettings;
    private final int stageTransitionTimeLimitSeconds;

    public TaskSignatureBuilder(PluginConfigRegistry registry, TioConfig config) {
        this(registry, config.getStageTransitionTimeLimitSeconds());
    }

    public TaskSignatureBuilder(PluginConfigRegistry registry, int stageTransitionTimeLimitSeconds) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.queueSettings = registry.getQueueSettings();
        this.stageTransitionTimeLimitSeconds = stageTransitionTimeLimitSeconds > 0
                ? stageTransitionTimeLimitSeconds
                : TioConfig.DEFAULT_STAGE_TRANSITION_TIME_LIMIT_SECONDS;
    }

    /**
     * Builds the descriptor that runs the plugin for the job.
     *
     * @param resolvedParams output of the parameter resolver for this plugin and job
     * @throws PluginNotRunnableException if the plugin is not runnable for the job's user
     */
    public TaskDescriptor build(PluginConfiguration plugin, Job job, Map<Parameter, Object> resolvedParams) {
        Objects.requireNonNull(plugin, "plugin");
        Objects.requireNonNull(job, "job");
        RunnabilityCheck check = registry.checkRunnable(plugin, job.getUser());
        if (!check.isRunnable()) {
            throw new PluginNotRunnableException(check.getRejection());
        }
        PluginConfiguration current = registry.get(plugin.getName()).orElse(plugin);
        String queue = current.getSettings().getQueue();
        if (!queueSettings.isValid(queue)) {
            log.warn("Plugin {} queue '{}' is no longer valid; dispatching on '{}'",
                    current.getRef(), queue, queueSettings.getDefaultQueue());
            queue = queueSettings.getDefaultQueue();
        }

        Map<String, Object> params = new LinkedHashMap<>();
        if (resolvedParams != null) {
            for (Map.Entry<Parameter, Object> e : resolvedParams.entrySet()) {
                params.put(e.getKey().getName(), e.getValue());
            }
        }
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put(TaskDescriptor.KW_PARAMS, params);

        PluginKind stageKind = current.getKind() == PluginKind.PIVOT ? null : current.getKind();
        TaskDescriptor descriptor = new TaskDescriptor(TaskType.PLUGIN_RUN, job.getId(), current.getEntryPoint(),
                current.getName(), List.of(job.getId(), current.getName()), kwargs,
                queueSettings.qualifiedName(queue), current.getSettings().getSoftTimeLimitSeconds(),
                newToken(), Set.of(), stageKind, null);
        log.debug("Built {}", descriptor);
        return descriptor;
    }

    /**
     * Builds the descriptor whose only effect is moving the job to {@code targetStatus}. It runs on the
     * default queue with the short stage-transition time limit.
     *
     * @param dependencies tokens of the tasks that must finish first (may be empty)
     */
    public TaskDescriptor buildStageTransition(Job job, JobStatus targetStatus, Set<String> dependencies) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(targetStatus, "targetStatus");
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put(TaskDescriptor.KW_TARGET_STATUS, targetStatus.name());
        TaskDescriptor descriptor = new TaskDescriptor(TaskType.STAGE_TRANSITION, job.getId(),
                TaskDescriptor.PIPELINE_ENTRY_POINT, null, List.of(job.getId()), kwargs,
                queueSettings.qualifiedName(queueSettings.getDefaultQueue()), stageTransitionTimeLimitSeconds,
                newToken(), dependencies, targetStatus.stageKind(), targetStatus);
        log.debug("Built {}", descriptor);
        return descriptor;
    }

    private static String newToken() {
        return UUID.randomUUID().toString();
    }
}
