package com.codeanalyzer.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One engine block from the {@code engines} section of the analyzer configuration.
 *
 * @param enabled whether the engine should run; {@code false} when the key is omitted
 * @param config  raw {@code config} value, or {@code null} when the block has none
 * @param extra   every other key the block declares, in declaration order
 */
public record EngineSettings(
    boolean enabled,
    Object config,
    Map<String, Object> extra
) {

    public EngineSettings {
        extra = extra == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public static EngineSettings enabledEngine() {
        return new EngineSettings(true, null, Map.of());
    }

    public static EngineSettings enabledWithConfig(Object config) {
        return new EngineSettings(true, config, Map.of());
    }
}
