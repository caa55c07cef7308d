package com.codeanalyzer.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved per-engine configuration handed to engine construction.
 *
 * <p>The engine-declared block ({@code enabled}, {@code config}, extra keys) and the
 * analyzer-computed path lists live in separate fields, so a key an engine declares can
 * never shadow {@link #excludePaths()} or {@link #includePaths()}.
 *
 * @param enabled      the engine's {@code enabled} flag
 * @param config       normalized {@code config} payload, or {@code null} when absent
 * @param extra        other keys of the engine block, in declaration order
 * @param excludePaths paths the engine must skip, relative to the source directory
 * @param includePaths paths the engine should analyze, relative to the source directory
 */
public record EngineConfig(
    boolean enabled,
    ConfigPayload config,
    Map<String, Object> extra,
    List<String> excludePaths,
    List<String> includePaths
) {

    public static final String ENABLED_KEY = "enabled";
    public static final String CONFIG_KEY = "config";
    public static final String EXCLUDE_PATHS_KEY = "exclude_paths";
    public static final String INCLUDE_PATHS_KEY = "include_paths";

    public EngineConfig {
        extra = extra == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
        excludePaths = excludePaths == null ? List.of() : List.copyOf(excludePaths);
        includePaths = includePaths == null ? List.of() : List.copyOf(includePaths);
    }

    /**
     * Merges an engine block with the computed path lists.
     */
    public static EngineConfig resolve(EngineSettings settings, List<String> excludePaths, List<String> includePaths) {
        return new EngineConfig(
                settings.enabled(),
                ConfigPayload.of(settings.config()),
                settings.extra(),
                excludePaths,
                includePaths);
    }

    /**
     * Value engines see under {@code config}: the bare file name for a file reference,
     * the raw value otherwise, {@code null} when the block has no config.
     */
    public Object configValue() {
        return config == null ? null : config.value();
    }

    /**
     * The document an engine receives. Computed path lists are written last and win over
     * any engine-declared key of the same name.
     */
    public Map<String, Object> asMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put(ENABLED_KEY, enabled);
        if (config != null) {
            map.put(CONFIG_KEY, config.value());
        }
        extra.forEach(map::putIfAbsent);
        map.put(EXCLUDE_PATHS_KEY, excludePaths);
        map.put(INCLUDE_PATHS_KEY, includePaths);
        return map;
    }
}
