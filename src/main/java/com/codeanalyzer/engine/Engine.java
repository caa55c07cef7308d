package com.codeanalyzer.engine;

import com.codeanalyzer.core.model.EngineConfig;
import com.codeanalyzer.core.model.EngineDescriptor;

import java.util.Objects;

/**
 * A configured analysis engine, ready to be handed to an executor.
 *
 * @param name       engine name, as configured and registered
 * @param descriptor registry metadata (container image, ...)
 * @param sourceDir  source directory the engine analyzes
 * @param config     resolved configuration, including include and exclude paths
 * @param formatter  receiver of the engine's output
 */
public record Engine(
    String name,
    EngineDescriptor descriptor,
    String sourceDir,
    EngineConfig config,
    Formatter formatter
) {

    public Engine {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(config, "config");
    }

    public String image() {
        return descriptor.image();
    }
}
