package com.codeanalyzer.core.registry;

import com.codeanalyzer.core.config.AnalyzerConfigException;
import com.codeanalyzer.core.config.AnalyzerProperties;
import com.codeanalyzer.core.model.EngineDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the {@link EngineRegistry} from an {@code engines.yml} catalog:
 *
 * <pre>
 * rubocop:
 *   image: codeclimate/codeclimate-rubocop
 *   description: Ruby static code analyzer
 * </pre>
 *
 * The file named by {@code analyzer.registry-file} wins; otherwise the catalog bundled
 * on the classpath is used.
 */
@Service
public class EngineRegistryLoader {

    private static final Logger log = LoggerFactory.getLogger(EngineRegistryLoader.class);

    static final String BUNDLED_REGISTRY = "/engines.yml";
    static final String IMAGE_KEY = "image";

    private final AnalyzerProperties properties;

    public EngineRegistryLoader(AnalyzerProperties properties) {
        this.properties = properties;
    }

    /**
     * Loads the configured registry file, or the bundled catalog when none is configured.
     */
    public EngineRegistry load() {
        if (properties.isRegistryFileConfigured()) {
            return load(Path.of(properties.getRegistryFile()));
        }
        return loadBundled();
    }

    public EngineRegistry load(Path registryFile) {
        if (!Files.exists(registryFile)) {
            throw new AnalyzerConfigException("Engine registry not found: " + registryFile);
        }
        try (InputStream in = Files.newInputStream(registryFile)) {
            var registry = parse(in, registryFile.toString());
            log.info("Loaded {} engine(s) from {}", registry.size(), registryFile);
            return registry;
        } catch (IOException e) {
            throw new AnalyzerConfigException("Failed to read engine registry " + registryFile, e);
        }
    }

    public EngineRegistry loadBundled() {
        try (InputStream in = EngineRegistryLoader.class.getResourceAsStream(BUNDLED_REGISTRY)) {
            if (in == null) {
                throw new AnalyzerConfigException("Bundled engine registry " + BUNDLED_REGISTRY + " is missing");
            }
            var registry = parse(in, BUNDLED_REGISTRY);
            log.debug("Loaded {} engine(s) from bundled registry", registry.size());
            return registry;
        } catch (IOException e) {
            throw new AnalyzerConfigException("Failed to read bundled engine registry", e);
        }
    }

    public static EngineRegistry parse(String yaml) {
        try {
            return fromDocument(newYaml().load(yaml), "<inline>");
        } catch (YAMLException e) {
            throw new AnalyzerConfigException("Invalid engine registry YAML: " + e.getMessage(), e);
        }
    }

    static EngineRegistry parse(InputStream in, String source) {
        try {
            return fromDocument(newYaml().load(in), source);
        } catch (YAMLException e) {
            throw new AnalyzerConfigException("Invalid engine registry YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    private static Yaml newYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private static EngineRegistry fromDocument(Object document, String source) {
        if (document == null) {
            return EngineRegistry.empty();
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new AnalyzerConfigException("Engine registry " + source + " must be a mapping of engine names");
        }
        var engines = new LinkedHashMap<String, EngineDescriptor>();
        for (var entry : root.entrySet()) {
            String name = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof Map<?, ?> attributes)) {
                throw new AnalyzerConfigException(
                        "Registry entry '%s' in %s must be a mapping".formatted(name, source));
            }
            Object image = attributes.get(IMAGE_KEY);
            if (!(image instanceof String imageName) || imageName.isBlank()) {
                throw new AnalyzerConfigException(
                        "Registry entry '%s' in %s has no image".formatted(name, source));
            }
            var rest = new LinkedHashMap<String, Object>();
            attributes.forEach((key, value) -> {
                if (!IMAGE_KEY.equals(key)) {
                    rest.put(String.valueOf(key), value);
                }
            });
            engines.put(name, new EngineDescriptor(imageName, rest));
        }
        return new EngineRegistry(engines);
    }
}
