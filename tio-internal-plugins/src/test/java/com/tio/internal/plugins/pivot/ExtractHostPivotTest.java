package com.tio.internal.plugins.pivot;

import com.tio.plugin.PluginInvocation;
import com.tio.pluginconfig.ObservableClassification;
import com.tio.pluginconfig.PluginKind;
import com.tio.pluginconfig.PluginRef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExtractHostPivotTest {

    private static Map<String, Object> run(String name, ObservableClassification type) {
        return new ExtractHostPivot().run(new PluginInvocation("job-1", PluginRef.of(PluginKind.PIVOT, "ExtractHost"),
                Map.of(), name, type, null, null));
    }

    @Test
    void url_yieldsHostAsDomain() {
        assertEquals(List.of(Map.of("name", "evil.example", "classification", "domain")),
                run("https://Evil.Example/path?q=1", ObservableClassification.URL).get(ExtractHostPivot.OUTPUT_OBSERVABLES));
    }

    @Test
    void url_withIpHostYieldsIp() {
        assertEquals(List.of(Map.of("name", "192.0.2.7", "classification", "ip")),
                run("http://192.0.2.7:8080/", ObservableClassification.URL).get(ExtractHostPivot.OUTPUT_OBSERVABLES));
    }

    @Test
    void nonUrl_yieldsNothing() {
        assertEquals(List.of(), run("example.com", ObservableClassification.DOMAIN).get(ExtractHostPivot.OUTPUT_OBSERVABLES));
    }
}
