package com.tio.pluginconfig.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One entry of a manifest's {@code "params"} array. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ParameterDefinition {

    private final String name;
    private final String type;
    private final String description;
    private final boolean secret;
    private final boolean required;

    @JsonCreator
    public ParameterDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("description") String description,
            @JsonProperty("is_secret") boolean secret,
            @JsonProperty("required") boolean required) {
        this.name = name;
        this.type = type;
        this.description = description;
        this.secret = secret;
        this.required = required;
    }

    public String getName() {
        return name;
    }

    public String getType() {
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
}
