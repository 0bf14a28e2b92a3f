package com.tio.parameters;

import com.tio.pluginconfig.Parameter;
import com.tio.pluginconfig.ParameterType;
import com.tio.pluginconfig.PluginKind;
import com.tio.pluginconfig.PluginRef;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/** Key layout and row encoding; talking to a live Redis is out of scope for unit tests. */
class RedisParameterStoreTest {

    private static final Parameter HEADERS = new Parameter("headers", ParameterType.DICT, "", false, false,
            PluginRef.of(PluginKind.CONNECTOR, "Misp"));

    @Test
    void keyFor_includesKindPluginAndParameter() {
        assertEquals("tio:params:connector:Misp:headers", RedisParameterStore.keyFor(HEADERS));
    }

    @Test
    void decode_readsEncodedRow() throws Exception {
        Map<String, Object> value = Map.of("X-Api", List.of("a", "b"));
        Instant at = Instant.ofEpochMilli(1_700_000_000_000L);
        String json = RedisParameterStore.encode(new ParameterValue(HEADERS, ValueScope.user("alice"), value, at));

        ParameterValue decoded = RedisParameterStore.decode(HEADERS, "user:alice", json);

        assertEquals(value, decoded.getValue());
        assertEquals(ValueScope.user("alice"), decoded.getScope());
        assertEquals(at, decoded.getUpdatedAt());
    }
}
