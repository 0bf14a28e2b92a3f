package com.tio.pluginconfig.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tio.pluginconfig.AnalyzerAttributes;
import com.tio.pluginconfig.ObservableClassification;
import com.tio.pluginconfig.Parameter;
import com.tio.pluginconfig.ParameterType;
import com.tio.pluginconfig.PivotAttributes;
import com.tio.pluginconfig.PluginConfiguration;
import com.tio.pluginconfig.PluginKind;
import com.tio.pluginconfig.PluginSettings;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Declarative registration document for one plugin:
 * <pre>{"plugin": {...}, "params": [...], "values": [...]}</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PluginManifest {

    private final PluginDefinition plugin;
    private final List<ParameterDefinition> params;
    private final List<ValueDefinition> values;

    @JsonCreator
    public PluginManifest(
            @JsonProperty("plugin") PluginDefinition plugin,
            @JsonProperty("params") List<ParameterDefinition> params,
            @JsonProperty("values") List<ValueDefinition> values) {
        this.plugin = plugin;
        this.params = params != null ? List.copyOf(params) : List.of();
        this.values = values != null ? List.copyOf(values) : List.of();
    }

    public PluginDefinition getPlugin() {
        return plugin;
    }

    public List<ParameterDefinition> getParams() {
        return params;
    }

    public List<ValueDefinition> getValues() {
        return values;
    }

    /** Same as {@link #toConfiguration(PluginSettings)} with {@link PluginSettings#defaults()}. */
    public PluginConfiguration toConfiguration() {
        return toConfiguration(PluginSettings.defaults());
    }

    /**
     * Builds the configuration this manifest describes.
     *
     * @param defaults queue and soft time limit for a manifest that omits them
     * @throws IllegalArgumentException if the plugin block is missing or any field is invalid
     */
    public PluginConfiguration toConfiguration(PluginSettings defaults) {
        if (plugin == null) {
            throw new IllegalArgumentException("Manifest has no \"plugin\" object");
        }
        PluginKind kind = PluginKind.fromString(plugin.getKind());
        int softTimeLimit = plugin.getSoftTimeLimit() != null
                ? plugin.getSoftTimeLimit()
                : defaults.getSoftTimeLimitSeconds();
        String queue = plugin.getQueue() != null && !plugin.getQueue().isBlank()
                ? plugin.getQueue()
                : defaults.getQueue();
        PluginConfiguration.Builder builder = PluginConfiguration.builder(kind, plugin.getName())
                .description(plugin.getDescription())
                .disabled(plugin.isDisabled())
                .disabledInOrganizations(new LinkedHashSet<>(plugin.getDisabledInOrganizations()))
                .entryPoint(plugin.getEntryPoint())
                .settings(new PluginSettings(queue, softTimeLimit));
        for (ParameterDefinition p : params) {
            builder.parameter(new Parameter(p.getName(), ParameterType.fromCode(p.getType()), p.getDescription(),
                    p.isSecret(), p.isRequired(), builder.ref()));
        }
        if (kind == PluginKind.ANALYZER) {
            builder.analyzerAttributes(analyzerAttributes());
        } else if (kind == PluginKind.PIVOT) {
            builder.pivotAttributes(new PivotAttributes(new LinkedHashSet<>(plugin.getRelatedConfigs())));
        }
        return builder.build();
    }

    private AnalyzerAttributes analyzerAttributes() {
        AnalyzerAttributes.AnalyzerType type = plugin.getType() == null
                ? AnalyzerAttributes.AnalyzerType.OBSERVABLE
                : AnalyzerAttributes.AnalyzerType.valueOf(plugin.getType().trim().toUpperCase(Locale.ROOT));
        Set<ObservableClassification> supported = new LinkedHashSet<>();
        for (String c : plugin.getObservableSupported()) {
            supported.add(ObservableClassification.fromString(c));
        }
        return new AnalyzerAttributes(type, supported,
                new LinkedHashSet<>(plugin.getSupportedFiletypes()),
                new LinkedHashSet<>(plugin.getNotSupportedFiletypes()));
    }
}
