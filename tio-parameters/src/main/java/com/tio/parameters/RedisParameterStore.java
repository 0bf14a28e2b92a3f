package com.tio.parameters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tio.config.TioConfig;
import com.tio.pluginconfig.Parameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed {@link ParameterStore}. One hash per parameter
 * ({@code tio:params:<kind>:<plugin>:<parameter>}); the hash field is the scope key
 * ({@link ValueScope#key()}) and the field value is JSON {@code {"value": ..., "updatedAt": epochMillis}}.
 * One field per scope keeps the at-most-one-value-per-scope rule in the data layout itself.
 */
public final class RedisParameterStore implements ParameterStore {

    private static final Logger log = LoggerFactory.getLogger(RedisParameterStore.class);

    static final String KEY_PREFIX = "tio:params:";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JedisPool pool;

    public RedisParameterStore(TioConfig config) {
        this(Objects.requireNonNull(config, "config").getCacheHost(), config.getCachePort());
    }

    public RedisParameterStore(String cacheHost, int cachePort) {
        this(new JedisPool(new JedisPoolConfig(), cacheHost, cachePort));
        log.debug("RedisParameterStore connected to {}:{}", cacheHost, cachePort);
    }

    public RedisParameterStore(JedisPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    static String keyFor(Parameter parameter) {
        return KEY_PREFIX + parameter.getOwner().getKind().name().toLowerCase() + ":"
                + parameter.getOwner().getName() + ":" + parameter.getName();
    }

    @Override
    public Set<ParameterValue> candidates(Parameter parameter) {
        Map<String, String> fields;
        try (var jedis = pool.getResource()) {
            fields = jedis.hgetAll(keyFor(parameter));
        }
        Set<ParameterValue> out = new LinkedHashSet<>();
        for (Map.Entry<String, String> e : fields.entrySet()) {
            ParameterValue pv = decodeOrNull(parameter, e.getKey(), e.getValue());
            if (pv != null) out.add(pv);
        }
        return out;
    }

    @Override
    public Optional<ParameterValue> find(ValueScope scope, Parameter parameter) {
        String json;
        try (var jedis = pool.getResource()) {
            json = jedis.hget(keyFor(parameter), scope.key());
        }
        return json != null ? Optional.ofNullable(decodeOrNull(parameter, scope.key(), json)) : Optional.empty();
    }

    @Override
    public ParameterValue upsert(ValueScope scope, Parameter parameter, Object value) {
        ParameterValue pv = new ParameterValue(parameter, Objects.requireNonNull(scope, "scope"), value, Instant.now());
        String json = encode(pv);
        try (var jedis = pool.getResource()) {
            jedis.hset(keyFor(parameter), scope.key(), json);
        }
        log.debug("Stored value for {} in scope {}", parameter, scope);
        return pv;
    }

    @Override
    public boolean delete(ValueScope scope, Parameter parameter) {
        try (var jedis = pool.getResource()) {
            return jedis.hdel(keyFor(parameter), scope.key()) > 0;
        }
    }

    static String encode(ParameterValue pv) {
        ObjectNode node = MAPPER.createObjectNode();
        node.set("value", MAPPER.valueToTree(pv.getValue()));
        node.put("updatedAt", pv.getUpdatedAt().toEpochMilli());
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode value for " + pv.getParameter(), e);
        }
    }

    static ParameterValue decode(Parameter parameter, String scopeKey, String json) throws JsonProcessingException {
        JsonNode node = MAPPER.readTree(json);
        Object value = MAPPER.treeToValue(node.get("value"), Object.class);
        Instant updatedAt = node.hasNonNull("updatedAt") ? Instant.ofEpochMilli(node.get("updatedAt").asLong()) : null;
        return new ParameterValue(parameter, ValueScope.parse(scopeKey), value, updatedAt);
    }

    /** Corrupt rows are logged and treated as absent so one bad field cannot block resolution. */
    private static ParameterValue decodeOrNull(Parameter parameter, String scopeKey, String json) {
        try {
            return decode(parameter, scopeKey, json);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Ignoring unreadable value for {} in scope {}: {}", parameter, scopeKey, e.getMessage());
            return null;
        }
    }

    /** Closes the connection pool. */
    public void close() {
        pool.close();
    }
}
