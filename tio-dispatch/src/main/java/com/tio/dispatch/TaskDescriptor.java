package com.tio.dispatch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tio.job.JobStatus;
import com.tio.pluginconfig.PluginKind;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Self-contained unit of work for the worker pool. Immutable; serializable to JSON for remote workers.
 * <p>
 * A descriptor carries resolved parameter values, some of which may be secrets, so {@link #toString()}
 * prints only keys and never argument values.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TaskDescriptor {

    /** Entry point of stage-transition descriptors. */
    public static final String PIPELINE_ENTRY_POINT = "tio.pipeline.advance";

    /** Keyword argument holding the resolved parameter map of a plugin run. */
    public static final String KW_PARAMS = "params";
    /** Keyword argument holding the target status of a stage transition. */
    public static final String KW_TARGET_STATUS = "target_status";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private final TaskType type;
    private final String jobId;
    private final String entryPoint;
    private final String pluginName;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final String queue;
    private final int softTimeLimitSeconds;
    private final String token;
    private final Set<String> dependencies;
    private final PluginKind stageKind;
    private final JobStatus targetStatus;

    @JsonCreator
    public TaskDescriptor(
            @JsonProperty("type") TaskType type,
            @JsonProperty("jobId") String jobId,
            @JsonProperty("entryPoint") String entryPoint,
            @JsonProperty("pluginName") String pluginName,
            @JsonProperty("args") List<Object> args,
            @JsonProperty("kwargs") Map<String, Object> kwargs,
            @JsonProperty("queue") String queue,
            @JsonProperty("softTimeLimitSeconds") int softTimeLimitSeconds,
            @JsonProperty("token") String token,
            @JsonProperty("dependencies") Set<String> dependencies,
            @JsonProperty("stageKind") PluginKind stageKind,
            @JsonProperty("targetStatus") JobStatus targetStatus) {
        this.type = Objects.requireNonNull(type, "type");
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.entryPoint = Objects.requireNonNull(entryPoint, "entryPoint");
        this.pluginName = pluginName;
        this.args = args != null ? frozenList(args) : List.of();
        this.kwargs = kwargs != null ? frozenMap(kwargs) : Map.of();
        this.queue = Objects.requireNonNull(queue, "queue");
        if (softTimeLimitSeconds <= 0) {
            throw new IllegalArgumentException("softTimeLimitSeconds must be positive: " + softTimeLimitSeconds);
        }
        this.softTimeLimitSeconds = softTimeLimitSeconds;
        this.token = Objects.requireNonNull(token, "token");
        this.dependencies = dependencies != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(dependencies))
                : Set.of();
        this.stageKind = stageKind;
        this.targetStatus = targetStatus;
    }

    public static TaskDescriptor fromJson(String json) {
        try {
            return MAPPER.readValue(json, TaskDescriptor.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task " + token, e);
        }
    }

    public TaskType getType() {
        return type;
    }

    public String getJobId() {
        return jobId;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    /** Plugin run by this task; null for stage transitions. */
    public String getPluginName() {
        return pluginName;
    }

    public List<Object> getArgs() {
        return args;
    }

    public Map<String, Object> getKwargs() {
        return kwargs;
    }

    /** Queue-prefix-qualified queue name. */
    public String getQueue() {
        return queue;
    }

    public int getSoftTimeLimitSeconds() {
        return softTimeLimitSeconds;
    }

    /** Idempotency token; unique per descriptor. */
    public String getToken() {
        return token;
    }

    /** Tokens of the tasks that must finish before this one runs. */
    public Set<String> getDependencies() {
        return dependencies;
    }

    /** Stage the task belongs to; null for pivots and for transitions out of no stage. */
    public PluginKind getStageKind() {
        return stageKind;
    }

    /** Status a stage transition moves the job to; null for plugin runs. */
    public JobStatus getTargetStatus() {
        return targetStatus;
    }

    /** Resolved parameters of a plugin run, by parameter name; unmodifiable. */
    @JsonIgnore
    @SuppressWarnings("unchecked")
    public Map<String, Object> getParameters() {
        Object params = kwargs.get(KW_PARAMS);
        return params instanceof Map ? (Map<String, Object>) params : Map.of();
    }

    /** Unmodifiable copy of the map; nested maps and lists are copied the same way. */
    private static Map<String, Object> frozenMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : source.entrySet()) {
            copy.put(String.valueOf(e.getKey()), frozen(e.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static List<Object> frozenList(List<?> source) {
        List<Object> copy = new ArrayList<>(source.size());
        for (Object value : source) copy.add(frozen(value));
        return Collections.unmodifiableList(copy);
    }

    private static Object frozen(Object value) {
        if (value instanceof Map) return frozenMap((Map<?, ?>) value);
        if (value instanceof List) return frozenList((List<?>) value);
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return token.equals(((TaskDescriptor) o).token);
    }

    @Override
    public int hashCode() {
        return token.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TaskDescriptor(")
                .append(type).append(", job=").append(jobId)
                .append(", entryPoint=").append(entryPoint);
        if (pluginName != null) sb.append(", plugin=").append(pluginName);
        if (targetStatus != null) sb.append(", target=").append(targetStatus);
        sb.append(", queue=").append(queue)
                .append(", softTimeLimit=").append(softTimeLimitSeconds).append('s')
                .append(", token=").append(token)
                .append(", dependencies=").append(dependencies.size())
                .append(", args=").append(args.size())
                .append(", kwargs=").append(kwargs.keySet());
        if (type == TaskType.PLUGIN_RUN) sb.append(", params=").append(getParameters().keySet());
        return sb.append(')').toString();
    }
}
