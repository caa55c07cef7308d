package com.codeanalyzer.core.config;

import com.codeanalyzer.core.model.AnalyzerConfig;
import com.codeanalyzer.core.model.EngineConfig;
import com.codeanalyzer.core.model.EngineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the analyzer YAML configuration ({@code .codeclimate.yml} shape) into an
 * {@link AnalyzerConfig}.
 *
 * <pre>
 * engines:
 *   rubocop:
 *     enabled: true
 *     config:
 *       file: rubocop.yml
 * exclude_paths:
 *   - "vendor/**"
 * </pre>
 *
 * Engine blocks keep their declaration order. A document without an {@code engines}
 * section parses to an empty engine map.
 */
public final class AnalyzerConfigParser {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerConfigParser.class);

    static final String ENGINES_KEY = "engines";
    static final String EXCLUDE_PATHS_KEY = "exclude_paths";

    private AnalyzerConfigParser() {
    }

    public static AnalyzerConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new AnalyzerConfigException("Configuration file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath)) {
            return fromDocument(newYaml().load(reader), configPath.toString());
        } catch (IOException e) {
            throw new AnalyzerConfigException("Failed to read configuration file " + configPath, e);
        } catch (YAMLException e) {
            throw new AnalyzerConfigException("Invalid YAML in " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static AnalyzerConfig parse(String yaml) {
        try {
            return fromDocument(newYaml().load(yaml), "<inline>");
        } catch (YAMLException e) {
            throw new AnalyzerConfigException("Invalid YAML configuration: " + e.getMessage(), e);
        }
    }

    static Yaml newYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private static AnalyzerConfig fromDocument(Object document, String source) {
        if (document == null) {
            log.debug("Configuration {} is empty", source);
            return AnalyzerConfig.empty();
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new AnalyzerConfigException("Configuration " + source + " must be a YAML mapping");
        }
        var engines = parseEngines(root.get(ENGINES_KEY), source);
        var excludePaths = parseExcludePaths(root.get(EXCLUDE_PATHS_KEY), source);
        log.debug("Parsed configuration {}: {} engine(s), {} exclude pattern(s)",
                source, engines.size(), excludePaths.size());
        return new AnalyzerConfig(engines, excludePaths);
    }

    private static Map<String, EngineSettings> parseEngines(Object section, String source) {
        var engines = new LinkedHashMap<String, EngineSettings>();
        if (section == null) {
            return engines;
        }
        if (!(section instanceof Map<?, ?> map)) {
            throw new AnalyzerConfigException("'engines' in " + source + " must be a mapping of engine names");
        }
        for (var entry : map.entrySet()) {
            String name = String.valueOf(entry.getKey());
            engines.put(name, parseEngineBlock(name, entry.getValue(), source));
        }
        return engines;
    }

    private static EngineSettings parseEngineBlock(String name, Object block, String source) {
        if (block == null) {
            return new EngineSettings(false, null, Map.of());
        }
        if (!(block instanceof Map<?, ?> map)) {
            throw new AnalyzerConfigException(
                    "Engine '%s' in %s must be a mapping".formatted(name, source));
        }
        boolean enabled = false;
        Object config = null;
        var extra = new LinkedHashMap<String, Object>();
        for (var entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (EngineConfig.ENABLED_KEY.equals(key)) {
                enabled = Boolean.TRUE.equals(value) || "true".equalsIgnoreCase(String.valueOf(value));
            } else if (EngineConfig.CONFIG_KEY.equals(key)) {
                config = value;
            } else {
                extra.put(key, value);
            }
        }
        return new EngineSettings(enabled, config, extra);
    }

    private static List<String> parseExcludePaths(Object section, String source) {
        var patterns = new ArrayList<String>();
        if (section == null) {
            return patterns;
        }
        if (section instanceof String single) {
            patterns.add(single);
            return patterns;
        }
        if (!(section instanceof List<?> list)) {
            throw new AnalyzerConfigException("'exclude_paths' in " + source + " must be a list of patterns");
        }
        for (Object item : list) {
            if (!(item instanceof String pattern)) {
                throw new AnalyzerConfigException(
                        "'exclude_paths' in " + source + " must only contain strings, found: " + item);
            }
            patterns.add(pattern);
        }
        return patterns;
    }
}
