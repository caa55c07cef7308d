package com.codeanalyzer.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Registry metadata for a single analysis engine.
 *
 * @param image      container image the engine runs from
 * @param attributes any other catalog keys (description, community flag, ...), in declaration order
 */
public record EngineDescriptor(
    String image,
    Map<String, Object> attributes
) {

    public EngineDescriptor {
        Objects.requireNonNull(image, "image");
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static EngineDescriptor ofImage(String image) {
        return new EngineDescriptor(image, Map.of());
    }
}
