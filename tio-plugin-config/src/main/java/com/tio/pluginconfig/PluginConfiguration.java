package com.tio.pluginconfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of one plugin: identity, enablement, entry point, settings and declared parameters.
 * Every parameter's owner must be this configuration's {@link #getRef()}.
 * Category-specific attributes: {@link #getAnalyzerAttributes()} for analyzers, {@link #getPivotAttributes()} for pivots.
 */
public final class PluginConfiguration {

    private final PluginRef ref;
    private final String description;
    private final boolean disabled;
    private final Set<String> disabledInOrganizations;
    private final String entryPoint;
    private final PluginSettings settings;
    private final Map<String, Parameter> parameters;
    private final AnalyzerAttributes analyzerAttributes;
    private final PivotAttributes pivotAttributes;

    private PluginConfiguration(Builder b) {
        this.ref = new PluginRef(b.kind, PluginNameValidator.validate(b.name));
        this.description = b.description != null ? b.description : "";
        this.disabled = b.disabled;
        this.disabledInOrganizations = Collections.unmodifiableSet(new LinkedHashSet<>(b.disabledInOrganizations));
        if (b.entryPoint == null || b.entryPoint.isBlank()) {
            throw new IllegalArgumentException("Plugin " + ref + " has no entry point");
        }
        this.entryPoint = b.entryPoint.trim();
        this.settings = b.settings != null ? b.settings : PluginSettings.defaults();
        Map<String, Parameter> params = new LinkedHashMap<>();
        for (Parameter p : b.parameters) {
            if (!ref.equals(p.getOwner())) {
                throw new IllegalArgumentException("Parameter " + p + " is not owned by " + ref);
            }
            if (params.putIfAbsent(p.getName(), p) != null) {
                throw new IllegalArgumentException("Duplicate parameter " + p);
            }
        }
        this.parameters = Collections.unmodifiableMap(params);
        if (b.kind == PluginKind.ANALYZER) {
            this.analyzerAttributes = b.analyzerAttributes != null ? b.analyzerAttributes : AnalyzerAttributes.anyObservable();
        } else {
            this.analyzerAttributes = null;
        }
        if (b.kind == PluginKind.PIVOT) {
            this.pivotAttributes = b.pivotAttributes != null ? b.pivotAttributes : new PivotAttributes(Set.of());
        } else {
            this.pivotAttributes = null;
        }
    }

    public static Builder builder(PluginKind kind, String name) {
        return new Builder(kind, name);
    }

    public PluginRef getRef() {
        return ref;
    }

    public String getName() {
        return ref.getName();
    }

    public PluginKind getKind() {
        return ref.getKind();
    }

    public String getDescription() {
        return description;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public Set<String> getDisabledInOrganizations() {
        return disabledInOrganizations;
    }

    public boolean isDisabledFor(String organizationId) {
        return organizationId != null && disabledInOrganizations.contains(organizationId);
    }

    /** Name under which the handler is registered in the entry-point loader. */
    public String getEntryPoint() {
        return entryPoint;
    }

    public PluginSettings getSettings() {
        return settings;
    }

    /** Declared parameters, in declaration order. */
    public List<Parameter> getParameters() {
        return List.copyOf(parameters.values());
    }

    public Parameter getParameter(String name) {
        return parameters.get(name);
    }

    /** Present only for {@link PluginKind#ANALYZER}; null otherwise. */
    public AnalyzerAttributes getAnalyzerAttributes() {
        return analyzerAttributes;
    }

    /** Present only for {@link PluginKind#PIVOT}; null otherwise. */
    public PivotAttributes getPivotAttributes() {
        return pivotAttributes;
    }

    /** Copy with different settings (used when the registry falls back to the default queue). */
    public PluginConfiguration withSettings(PluginSettings newSettings) {
        return toBuilder().settings(newSettings).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(ref.getKind(), ref.getName())
                .description(description)
                .disabled(disabled)
                .disabledInOrganizations(disabledInOrganizations)
                .entryPoint(entryPoint)
                .settings(settings)
                .analyzerAttributes(analyzerAttributes)
                .pivotAttributes(pivotAttributes);
        for (Parameter p : parameters.values()) {
            b.parameter(p);
        }
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return ref.equals(((PluginConfiguration) o).ref);
    }

    @Override
    public int hashCode() {
        return ref.hashCode();
    }

    @Override
    public String toString() {
        return "PluginConfiguration(" + ref + ", entryPoint=" + entryPoint + ", " + settings
                + (disabled ? ", disabled" : "") + ")";
    }

    public static final class Builder {
        private final PluginKind kind;
        private final String name;
        private String description;
        private boolean disabled;
        private final Set<String> disabledInOrganizations = new LinkedHashSet<>();
        private String entryPoint;
        private PluginSettings settings;
        private final List<Parameter> parameters = new ArrayList<>();
        private AnalyzerAttributes analyzerAttributes;
        private PivotAttributes pivotAttributes;

        private Builder(PluginKind kind, String name) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.name = name;
        }

        /** Ref of the configuration under construction; use it as owner of parameters. */
        public PluginRef ref() {
            return new PluginRef(kind, name);
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder disabled(boolean disabled) {
            this.disabled = disabled;
            return this;
        }

        public Builder disabledInOrganizations(Set<String> organizationIds) {
            this.disabledInOrganizations.clear();
            if (organizationIds != null) this.disabledInOrganizations.addAll(organizationIds);
            return this;
        }

        public Builder disabledInOrganization(String organizationId) {
            this.disabledInOrganizations.add(organizationId);
            return this;
        }

        public Builder entryPoint(String entryPoint) {
            this.entryPoint = entryPoint;
            return this;
        }

        public Builder settings(PluginSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder parameter(Parameter parameter) {
            this.parameters.add(Objects.requireNonNull(parameter, "parameter"));
            return this;
        }

        /** Declares a parameter owned by this configuration. */
        public Builder parameter(String paramName, ParameterType type, boolean secret, boolean required) {
            return parameter(new Parameter(paramName, type, "", secret, required, ref()));
        }

        public Builder analyzerAttributes(AnalyzerAttributes attributes) {
            this.analyzerAttributes = attributes;
            return this;
        }

        public Builder pivotAttributes(PivotAttributes attributes) {
            this.pivotAttributes = attributes;
            return this;
        }

        public PluginConfiguration build() {
            return new PluginConfiguration(this);
        }
    }
}
