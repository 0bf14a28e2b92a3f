package com.tio.job;

import com.tio.pluginconfig.PluginRef;

import java.util.Objects;

/** Structured reason a plugin was not dispatched for a job: which plugin, which parameter, which cause. */
public final class RejectionReason {

    public enum Cause {
        DISABLED,
        DISABLED_FOR_ORGANIZATION,
        PARAMETER_NOT_CONFIGURED,
        UNSUPPORTED_OBSERVABLE,
        NOT_REGISTERED,
        SUBMISSION_FAILED
    }

    private final PluginRef plugin;
    private final String parameterName;
    private final Cause cause;
    private final String message;

    public RejectionReason(PluginRef plugin, String parameterName, Cause cause, String message) {
        this.plugin = Objects.requireNonNull(plugin, "plugin");
        this.parameterName = parameterName;
        this.cause = Objects.requireNonNull(cause, "cause");
        this.message = message != null ? message : cause.name();
    }

    public static RejectionReason of(PluginRef plugin, Cause cause, String message) {
        return new RejectionReason(plugin, null, cause, message);
    }

    public PluginRef getPlugin() {
        return plugin;
    }

    /** Parameter that caused the rejection, or null when not parameter-related. */
    public String getParameterName() {
        return parameterName;
    }

    public Cause getCause() {
        return cause;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RejectionReason that = (RejectionReason) o;
        return plugin.equals(that.plugin) && Objects.equals(parameterName, that.parameterName) && cause == that.cause;
    }

    @Override
    public int hashCode() {
        return Objects.hash(plugin, parameterName, cause);
    }

    @Override
    public String toString() {
        return plugin + ": " + cause + (parameterName != null ? " (" + parameterName + ")" : "") + " - " + message;
    }
}
