package com.tio.dispatch;

import com.tio.job.RejectionReason;
import com.tio.pluginconfig.PluginRef;

/** A task was requested for a plugin that is not runnable for the job's user. */
public class PluginNotRunnableException extends RuntimeException {

    private final PluginRef plugin;
    private final RejectionReason reason;

    public PluginNotRunnableException(RejectionReason reason) {
        super("Plugin " + reason.getPlugin() + " is not runnable: " + reason.getMessage());
        this.plugin = reason.getPlugin();
        this.reason = reason;
    }

    public PluginRef getPlugin() {
        return plugin;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
