package com.codeanalyzer.engine;

import com.codeanalyzer.core.model.EngineConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

/**
 * Renders an {@link EngineConfig} as the JSON document an engine reads at startup
 * ({@code /config.json} inside its container).
 */
@Component
public class EngineConfigWriter {

    private final ObjectMapper objectMapper;

    public EngineConfigWriter() {
        this(new ObjectMapper());
    }

    public EngineConfigWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(EngineConfig config) {
        try {
            return objectMapper.writeValueAsString(config.asMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize engine configuration", e);
        }
    }

    public String toPrettyJson(EngineConfig config) {
        try {
            return objectMapper.copy()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(config.asMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize engine configuration", e);
        }
    }
}
