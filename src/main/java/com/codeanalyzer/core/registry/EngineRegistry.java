package com.codeanalyzer.core.registry;

import com.codeanalyzer.core.model.EngineDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog of the engines the analyzer knows how to run, keyed by engine name.
 */
public final class EngineRegistry {

    private final Map<String, EngineDescriptor> engines;

    public EngineRegistry(Map<String, EngineDescriptor> engines) {
        this.engines = Collections.unmodifiableMap(new LinkedHashMap<>(engines));
    }

    public static EngineRegistry empty() {
        return new EngineRegistry(Map.of());
    }

    public Optional<EngineDescriptor> find(String name) {
        return Optional.ofNullable(engines.get(name));
    }

    public Map<String, EngineDescriptor> asMap() {
        return engines;
    }

    public int size() {
        return engines.size();
    }

    @Override
    public String toString() {
        return "EngineRegistry" + engines.keySet();
    }
}
