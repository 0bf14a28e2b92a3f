package com.tio.pluginconfig.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a manifest's {@code "values"} array. No owner means a system default;
 * an owner with {@code for_organization=true} means the value of the organization that user owns.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ValueDefinition {

    private final String parameter;
    private final Object value;
    private final String owner;
    private final boolean forOrganization;

    @JsonCreator
    public ValueDefinition(
            @JsonProperty("parameter") String parameter,
            @JsonProperty("value") Object value,
            @JsonProperty("owner") String owner,
            @JsonProperty("for_organization") boolean forOrganization) {
        this.parameter = parameter;
        this.value = value;
        this.owner = owner;
        this.forOrganization = forOrganization;
    }

    public String getParameter() {
        return parameter;
    }

    public Object getValue() {
        return value;
    }

    public String getOwner() {
        return owner;
    }

    public boolean isForOrganization() {
        return forOrganization;
    }

    public boolean isSystemDefault() {
        return owner == null || owner.isBlank();
    }
}
