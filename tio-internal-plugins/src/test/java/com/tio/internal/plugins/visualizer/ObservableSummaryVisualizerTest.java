package com.tio.internal.plugins.visualizer;

import com.tio.plugin.PluginInvocation;
import com.tio.pluginconfig.ObservableClassification;
import com.tio.pluginconfig.PluginKind;
import com.tio.pluginconfig.PluginRef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ObservableSummaryVisualizerTest {

    @Test
    @SuppressWarnings("unchecked")
    void run_buildsSingleLevelPage() {
        Map<String, Object> page = new ObservableSummaryVisualizer().run(new PluginInvocation("job-1",
                PluginRef.of(PluginKind.VISUALIZER, "ObservableSummary"), Map.of("page_title", "Domain"),
                "example.com", ObservableClassification.DOMAIN, null, null));

        assertEquals("Domain", page.get("name"));
        List<Map<String, Object>> levels = (List<Map<String, Object>>) page.get("levels");
        assertEquals(1, levels.size());
        List<Map<String, Object>> elements = (List<Map<String, Object>>) levels.get(0).get("elements");
        assertEquals("example.com", elements.get(0).get("value"));
        assertEquals("domain", elements.get(1).get("value"));
    }
}
