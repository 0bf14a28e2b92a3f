package com.tio.pluginconfig.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** The {@code "plugin"} object of a manifest. Analyzer and pivot fields are ignored for other kinds. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PluginDefinition {

    private final String name;
    private final String kind;
    private final String description;
    private final String entryPoint;
    private final boolean disabled;
    private final List<String> disabledInOrganizations;
    private final String queue;
    private final Integer softTimeLimit;
    private final String type;
    private final List<String> observableSupported;
    private final List<String> supportedFiletypes;
    private final List<String> notSupportedFiletypes;
    private final List<String> relatedConfigs;

    @JsonCreator
    public PluginDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("kind") String kind,
            @JsonProperty("description") String description,
            @JsonProperty("entry_point") String entryPoint,
            @JsonProperty("disabled") boolean disabled,
            @JsonProperty("disabled_in_organizations") List<String> disabledInOrganizations,
            @JsonProperty("queue") String queue,
            @JsonProperty("soft_time_limit") Integer softTimeLimit,
            @JsonProperty("type") String type,
            @JsonProperty("observable_supported") List<String> observableSupported,
            @JsonProperty("supported_filetypes") List<String> supportedFiletypes,
            @JsonProperty("not_supported_filetypes") List<String> notSupportedFiletypes,
            @JsonProperty("related_configs") List<String> relatedConfigs) {
        this.name = name;
        this.kind = kind;
        this.description = description;
        this.entryPoint = entryPoint;
        this.disabled = disabled;
        this.disabledInOrganizations = disabledInOrganizations != null ? List.copyOf(disabledInOrganizations) : List.of();
        this.queue = queue;
        this.softTimeLimit = softTimeLimit;
        this.type = type;
        this.observableSupported = observableSupported != null ? List.copyOf(observableSupported) : List.of();
        this.supportedFiletypes = supportedFiletypes != null ? List.copyOf(supportedFiletypes) : List.of();
        this.notSupportedFiletypes = notSupportedFiletypes != null ? List.copyOf(notSupportedFiletypes) : List.of();
        this.relatedConfigs = relatedConfigs != null ? List.copyOf(relatedConfigs) : List.of();
    }

    public String getName() {
        return name;
    }

    public String getKind() {
        return kind;
    }

    public String getDescription() {
        return description;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public List<String> getDisabledInOrganizations() {
        return disabledInOrganizations;
    }

    public String getQueue() {
        return queue;
    }

    public Integer getSoftTimeLimit() {
        return softTimeLimit;
    }

    public String getType() {
        return type;
    }

    public List<String> getObservableSupported() {
        return observableSupported;
    }

    public List<String> getSupportedFiletypes() {
        return supportedFiletypes;
    }

    public List<String> getNotSupportedFiletypes() {
        return notSupportedFiletypes;
    }

    public List<String> getRelatedConfigs() {
        return relatedConfigs;
    }
}
