package com.tio.pipeline;

import com.tio.dispatch.TaskOutcome;
import com.tio.pluginconfig.PluginKind;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Tasks of one stage of one job (or the job's pivots): which were submitted, which finished and how.
 * A token is expected before its task is submitted so an outcome can never arrive for an unknown task.
 */
public final class StageProgress {

    private final PluginKind kind;
    private final Map<String, String> pluginByToken = new LinkedHashMap<>();
    private final Set<String> succeeded = new LinkedHashSet<>();
    private final Map<String, String> failed = new LinkedHashMap<>();
    private String transitionToken;

    StageProgress(PluginKind kind) {
        this.kind = kind;
    }

    public PluginKind getKind() {
        return kind;
    }

    synchronized void expect(String token, String pluginName) {
        pluginByToken.put(token, pluginName);
    }

    synchronized void forget(String token) {
        pluginByToken.remove(token);
    }

    synchronized void setTransitionToken(String token) {
        this.transitionToken = token;
    }

    /**
     * @return false if the token does not belong to this stage
     */
    synchronized boolean record(TaskOutcome outcome) {
        String plugin = pluginByToken.get(outcome.getToken());
        if (plugin == null) {
            return false;
        }
        if (outcome.isSucceeded()) {
            succeeded.add(outcome.getToken());
        } else {
            failed.put(outcome.getToken(), outcome.getError());
        }
        return true;
    }

    /** Tokens of the submitted plugin tasks, in submission order. */
    public synchronized Set<String> getSubmittedTokens() {
        return new LinkedHashSet<>(pluginByToken.keySet());
    }

    /** Names of every plugin dispatched in this stage. */
    public synchronized Set<String> getDispatchedPlugins() {
        return new LinkedHashSet<>(pluginByToken.values());
    }

    public synchronized Set<String> getSucceededPlugins() {
        Set<String> names = new LinkedHashSet<>();
        for (String token : succeeded) names.add(pluginByToken.get(token));
        return names;
    }

    /** Plugin name to error of every failed task. */
    public synchronized Map<String, String> getFailedPlugins() {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : failed.entrySet()) out.put(pluginByToken.get(e.getKey()), e.getValue());
        return out;
    }

    public synchronized int getPendingCount() {
        return pluginByToken.size() - succeeded.size() - failed.size();
    }

    /** Token of the stage-transition task; null for pivots or when the transition was not submitted. */
    public synchronized String getTransitionToken() {
        return transitionToken;
    }

    @Override
    public synchronized String toString() {
        return "StageProgress(" + kind + ", submitted=" + pluginByToken.size() + ", succeeded=" + succeeded.size()
                + ", failed=" + failed.size() + ")";
    }
}
