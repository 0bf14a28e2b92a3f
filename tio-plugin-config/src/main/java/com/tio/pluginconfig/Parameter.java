package com.tio.pluginconfig;

import java.util.Objects;

/**
 * A named, typed input a plugin declares. Belongs to exactly one plugin configuration
 * ({@link #getOwner()}); identity is (name, owner).
 */
public final class Parameter {

    private final String name;
    private final ParameterType type;
    private final String description;
    private final boolean secret;
    private final boolean required;
    private final PluginRef owner;

    public Parameter(String name, ParameterType type, String description, boolean secret, boolean required,
                     PluginRef owner) {
        this.name = Objects.requireNonNull(name, "name").trim();
        if (this.name.isEmpty()) {
            throw new IllegalArgumentException("Parameter name must be non-blank");
        }
        this.type = Objects.requireNonNull(type, "type");
        this.description = description != null ? description : "";
        this.secret = secret;
        this.required = required;
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public String getName() {
        return name;
    }

    public ParameterType getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public boolean isSecret() {
        return secret;
    }

    public boolean isRequired() {
        return required;
    }

    /** The single plugin configuration this parameter belongs to. */
    public PluginRef getOwner() {
        return owner;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Parameter that = (Parameter) o;
        return name.equals(that.name) && owner.equals(that.owner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, owner);
    }

    @Override
    public String toString() {
        return owner + "." + name;
    }
}
