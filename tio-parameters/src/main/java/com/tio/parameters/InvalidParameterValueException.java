package com.tio.parameters;

import com.tio.pluginconfig.Parameter;
import com.tio.pluginconfig.ParameterType;

/** Thrown when a value does not match its parameter's declared type. The value itself is not carried. */
public class InvalidParameterValueException extends RuntimeException {

    private final Parameter parameter;
    private final ParameterType expectedType;

    public InvalidParameterValueException(Parameter parameter, Object value) {
        super("Value for " + parameter + " must be of type " + parameter.getType().getCode()
                + " but was " + (value == null ? "null" : value.getClass().getSimpleName()));
        this.parameter = parameter;
        this.expectedType = parameter.getType();
    }

    public Parameter getParameter() {
        return parameter;
    }

    public ParameterType getExpectedType() {
        return expectedType;
    }
}
