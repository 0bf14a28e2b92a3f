package com.tio.dispatch;

import com.tio.pluginconfig.PluginKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TaskDescriptorTest {

    private static TaskDescriptor run(Map<String, Object> params) {
        Map<String, Object> kwargs = new HashMap<>();
        kwargs.put(TaskDescriptor.KW_PARAMS, params);
        return new TaskDescriptor(TaskType.PLUGIN_RUN, "job-1", "validin.Validin", "Validin",
                List.of(), kwargs, "default", 30, "tok-1", Set.of(), PluginKind.ANALYZER, null);
    }

    @Test
    void getParameters_isUnmodifiable() {
        TaskDescriptor descriptor = run(new HashMap<>(Map.of("api_key_name", "secret")));

        assertThrows(UnsupportedOperationException.class, () -> descriptor.getParameters().put("injected", 1));
        assertThrows(UnsupportedOperationException.class, () -> descriptor.getParameters().remove("api_key_name"));
    }

    @Test
    void constructor_copiesNestedParameters() {
        List<Object> domains = new ArrayList<>(List.of("example.com"));
        Map<String, Object> params = new HashMap<>();
        params.put("api_key_name", "secret");
        params.put("domains", domains);
        TaskDescriptor descriptor = run(params);

        params.put("api_key_name", "changed");
        domains.add("evil.com");

        assertEquals("secret", descriptor.getParameters().get("api_key_name"));
        assertEquals(List.of("example.com"), descriptor.getParameters().get("domains"));
        @SuppressWarnings("unchecked")
        List<Object> copied = (List<Object>) descriptor.getParameters().get("domains");
        assertThrows(UnsupportedOperationException.class, () -> copied.add("evil.com"));
    }

    @Test
    void fromJson_parametersAreUnmodifiable() {
        TaskDescriptor parsed = TaskDescriptor.fromJson(run(Map.of("timeout", 5)).toJson());

        assertEquals(5, parsed.getParameters().get("timeout"));
        assertThrows(UnsupportedOperationException.class, () -> parsed.getParameters().put("timeout", 6));
    }
}
