package com.codeanalyzer.engine;

import com.codeanalyzer.core.model.EngineConfig;
import com.codeanalyzer.core.model.EngineDescriptor;

/**
 * Constructs an engine instance from its resolved configuration.
 * {@code Engine::new} is the default; callers may supply any other type.
 *
 * @param <E> the engine type produced
 */
@FunctionalInterface
public interface EngineFactory<E> {

    E create(String name, EngineDescriptor descriptor, String sourceDir, EngineConfig config, Formatter formatter);
}
