package com.tio.internal.plugins.pivot;

import com.tio.plugin.PluginHandler;
import com.tio.plugin.PluginInvocation;
import com.tio.pluginconfig.ObservableClassification;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pivot deriving a new observable from a URL: its host, classified as domain or IP.
 * Output key {@value #OUTPUT_OBSERVABLES} lists derived observables (empty for non-URL input).
 */
public final class ExtractHostPivot implements PluginHandler {

    public static final String OUTPUT_OBSERVABLES = "observables";

    @Override
    public Map<String, Object> run(PluginInvocation invocation) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (invocation.getClassification() != ObservableClassification.URL || invocation.getObservableName() == null) {
            out.put(OUTPUT_OBSERVABLES, List.of());
            return out;
        }
        String host = URI.create(invocation.getObservableName().trim()).getHost();
        if (host == null || host.isBlank()) {
            out.put(OUTPUT_OBSERVABLES, List.of());
            return out;
        }
        host = host.toLowerCase(Locale.ROOT);
        Map<String, Object> derived = new LinkedHashMap<>();
        derived.put("name", host);
        derived.put("classification", isIpLiteral(host) ? "ip" : "domain");
        out.put(OUTPUT_OBSERVABLES, List.of(derived));
        return out;
    }

    private static boolean isIpLiteral(String host) {
        return host.startsWith("[") || host.matches("^\\d{1,3}(\\.\\d{1,3}){3}$");
    }
}
