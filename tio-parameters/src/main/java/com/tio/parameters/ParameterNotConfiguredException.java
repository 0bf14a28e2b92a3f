package com.tio.parameters;

import com.tio.pluginconfig.Parameter;
import com.tio.pluginconfig.PluginRef;

/** No value for a parameter at any precedence tier. */
public class ParameterNotConfiguredException extends RuntimeException {

    private final Parameter parameter;

    public ParameterNotConfiguredException(Parameter parameter) {
        super("Parameter " + parameter.getName() + " of plugin " + parameter.getOwner() + " is not configured");
        this.parameter = parameter;
    }

    public Parameter getParameter() {
        return parameter;
    }

    public PluginRef getPlugin() {
        return parameter.getOwner();
    }
}
