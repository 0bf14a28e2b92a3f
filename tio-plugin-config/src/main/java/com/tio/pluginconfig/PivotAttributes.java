package com.tio.pluginconfig;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** Pivot-only attributes: the analyzer/connector configurations whose completion triggers the pivot. */
public final class PivotAttributes {

    private final Set<String> relatedConfigs;

    public PivotAttributes(Set<String> relatedConfigs) {
        this.relatedConfigs = relatedConfigs != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(relatedConfigs))
                : Set.of();
    }

    /** Names of related analyzer and connector configurations. */
    public Set<String> getRelatedConfigs() {
        return relatedConfigs;
    }

    public boolean isTriggeredBy(String pluginName) {
        return pluginName != null && relatedConfigs.contains(pluginName);
    }
}
