package com.tio.parameters;

import com.tio.pluginconfig.Parameter;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** {@link ParameterStore} held in memory: parameter → (scope → value). */
public final class InMemoryParameterStore implements ParameterStore {

    private final Map<Parameter, Map<ValueScope, ParameterValue>> values = new ConcurrentHashMap<>();

    @Override
    public Set<ParameterValue> candidates(Parameter parameter) {
        Map<ValueScope, ParameterValue> byScope = values.get(parameter);
        return byScope != null ? new LinkedHashSet<>(byScope.values()) : Set.of();
    }

    @Override
    public Optional<ParameterValue> find(ValueScope scope, Parameter parameter) {
        Map<ValueScope, ParameterValue> byScope = values.get(parameter);
        return byScope != null ? Optional.ofNullable(byScope.get(scope)) : Optional.empty();
    }

    @Override
    public ParameterValue upsert(ValueScope scope, Parameter parameter, Object value) {
        Objects.requireNonNull(scope, "scope");
        ParameterValue pv = new ParameterValue(parameter, scope, value, Instant.now());
        values.computeIfAbsent(parameter, k -> new ConcurrentHashMap<>()).put(scope, pv);
        return pv;
    }

    @Override
    public boolean delete(ValueScope scope, Parameter parameter) {
        Map<ValueScope, ParameterValue> byScope = values.get(parameter);
        return byScope != null && byScope.remove(scope) != null;
    }
}
