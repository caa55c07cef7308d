package com.codeanalyzer.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * The {@code config} value of an engine block.
 *
 * <p>Only one shape is normalized: a mapping whose sole key is {@code file}
 * becomes a {@link FileReference}, which engines receive as the bare file name.
 * Every other value is carried as {@link Structured} and passed through untouched.
 */
public sealed interface ConfigPayload permits ConfigPayload.FileReference, ConfigPayload.Structured {

    String FILE_KEY = "file";

    /**
     * The value engines see under the {@code config} key.
     */
    Object value();

    /**
     * Normalizes a raw YAML value. Returns {@code null} for a missing config.
     */
    static ConfigPayload of(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Map<?, ?> map && map.size() == 1 && map.get(FILE_KEY) != null) {
            return new FileReference(String.valueOf(map.get(FILE_KEY)));
        }
        return new Structured(raw);
    }

    /**
     * A reference to an engine-specific configuration file inside the source tree.
     */
    record FileReference(String file) implements ConfigPayload {

        public FileReference {
            Objects.requireNonNull(file, "file");
        }

        @Override
        public Object value() {
            return file;
        }
    }

    /**
     * Any other config value, opaque to the analyzer.
     */
    record Structured(Object raw) implements ConfigPayload {

        public Structured {
            Objects.requireNonNull(raw, "raw");
        }

        @Override
        public Object value() {
            return raw;
        }
    }
}
