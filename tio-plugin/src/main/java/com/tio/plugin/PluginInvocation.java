package com.tio.plugin;

import com.tio.pluginconfig.ObservableClassification;
import com.tio.pluginconfig.PluginRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Input handed to a {@link PluginHandler}: which plugin runs for which job, the resolved parameter map
 * (parameter name to value) and the job's observable. For file analysis the classification is null
 * and {@link #getMimeType()} is set.
 */
public final class PluginInvocation {

    private final String jobId;
    private final PluginRef plugin;
    private final Map<String, Object> parameters;
    private final String observableName;
    private final ObservableClassification classification;
    private final String mimeType;
    private final String userId;

    public PluginInvocation(String jobId, PluginRef plugin, Map<String, Object> parameters,
                            String observableName, ObservableClassification classification,
                            String mimeType, String userId) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.plugin = Objects.requireNonNull(plugin, "plugin");
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
        this.observableName = observableName;
        this.classification = classification;
        this.mimeType = mimeType;
        this.userId = userId;
    }

    public String getJobId() {
        return jobId;
    }

    public PluginRef getPlugin() {
        return plugin;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Object getParameter(String name) {
        return parameters.get(name);
    }

    public String getObservableName() {
        return observableName;
    }

    public ObservableClassification getClassification() {
        return classification;
    }

    public String getMimeType() {
        return mimeType;
    }

    /** Requesting user id, or null for system jobs. */
    public String getUserId() {
        return userId;
    }

    @Override
    public String toString() {
        return "PluginInvocation(job=" + jobId + ", plugin=" + plugin + ", params=" + parameters.keySet() + ")";
    }
}
