package com.tio.internal.plugins.visualizer;

import com.tio.plugin.PluginHandler;
import com.tio.plugin.PluginInvocation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Visualizer producing a single-level page layout for the job's observable: a title element and one
 * base element per attribute. Parameter: {@code page_title} (optional).
 */
public final class ObservableSummaryVisualizer implements PluginHandler {

    static final String PARAM_PAGE_TITLE = "page_title";
    private static final String DEFAULT_TITLE = "Observable";

    @Override
    public Map<String, Object> run(PluginInvocation invocation) {
        Object title = invocation.getParameter(PARAM_PAGE_TITLE);
        String type = invocation.getClassification() != null
                ? invocation.getClassification().name().toLowerCase(Locale.ROOT) : "file";

        List<Map<String, Object>> elements = List.of(
                element("title", title != null ? title.toString() : DEFAULT_TITLE, invocation.getObservableName()),
                element("base", "classification", type),
                element("base", "job", invocation.getJobId()));

        Map<String, Object> level = new LinkedHashMap<>();
        level.put("level", 1);
        level.put("elements", elements);
        Map<String, Object> page = new LinkedHashMap<>();
        page.put("name", title != null ? title.toString() : DEFAULT_TITLE);
        page.put("levels", List.of(level));
        return page;
    }

    private static Map<String, Object> element(String type, String label, Object value) {
        Map<String, Object> e = new LinkedHashMap<>();
        e.put("type", type);
        e.put("label", label);
        e.put("value", value);
        return e;
    }
}
