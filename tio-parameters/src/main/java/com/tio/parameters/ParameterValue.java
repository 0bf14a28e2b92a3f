package com.tio.parameters;

import com.tio.pluginconfig.Parameter;

import java.time.Instant;
import java.util.Objects;

/** A candidate value for a parameter within one scope. */
public final class ParameterValue {

    private final Parameter parameter;
    private final ValueScope scope;
    private final Object value;
    private final Instant updatedAt;

    /**
     * @throws InvalidParameterValueException if the value is null or does not match the parameter's declared type
     */
    public ParameterValue(Parameter parameter, ValueScope scope, Object value, Instant updatedAt) {
        this.parameter = Objects.requireNonNull(parameter, "parameter");
        this.scope = Objects.requireNonNull(scope, "scope");
        if (!parameter.getType().accepts(value)) {
            throw new InvalidParameterValueException(parameter, value);
        }
        this.value = value;
        this.updatedAt = updatedAt != null ? updatedAt : Instant.now();
    }

    public Parameter getParameter() {
        return parameter;
    }

    public ValueScope getScope() {
        return scope;
    }

    public Object getValue() {
        return value;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterValue that = (ParameterValue) o;
        return parameter.equals(that.parameter) && scope.equals(that.scope) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameter, scope, value);
    }

    @Override
    public String toString() {
        return "ParameterValue(" + parameter + ", " + scope + ", "
                + (parameter.isSecret() ? "***" : String.valueOf(value)) + ")";
    }
}
