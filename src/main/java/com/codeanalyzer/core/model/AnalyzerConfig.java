package com.codeanalyzer.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed analyzer configuration.
 *
 * @param engines      engine blocks keyed by engine name, in configuration order; empty when the
 *                     document has no {@code engines} section
 * @param excludePaths top-level glob patterns excluded from every engine
 */
public record AnalyzerConfig(
    Map<String, EngineSettings> engines,
    List<String> excludePaths
) {

    public AnalyzerConfig {
        engines = engines == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(engines));
        excludePaths = excludePaths == null ? List.of() : List.copyOf(excludePaths);
    }

    public static AnalyzerConfig empty() {
        return new AnalyzerConfig(Map.of(), List.of());
    }
}
