package com.codeanalyzer.dispatch.cli;

import com.codeanalyzer.core.config.AnalyzerConfigException;
import com.codeanalyzer.core.config.AnalyzerConfigParser;
import com.codeanalyzer.core.config.AnalyzerProperties;
import com.codeanalyzer.core.paths.PosixFileReadability;
import com.codeanalyzer.core.registry.EngineRegistry;
import com.codeanalyzer.core.registry.EngineRegistryLoader;
import com.codeanalyzer.engine.Engine;
import com.codeanalyzer.engine.EngineConfigWriter;
import com.codeanalyzer.engine.EnginesBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: code-analyzer engines [PATH...]
 * <p>
 * Resolves the engines the configuration enables and prints each one with its image and
 * the JSON configuration it would receive. Nothing is executed.
 */
@Command(name = "engines", mixinStandardHelpOptions = true,
        description = "Resolve configured engines and print their configuration")
@Component
public class EnginesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(EnginesCommand.class);

    @Parameters(arity = "0..*", paramLabel = "PATH", description = "Paths to analyze (default: everything not ignored)")
    private List<String> requestedPaths = new ArrayList<>();

    @Option(names = {"--config", "-c"}, description = "Analyzer configuration file")
    private String configFile;

    @Option(names = {"--workspace", "-w"}, description = "Directory to scan for files and ignore rules")
    private String workspace;

    @Option(names = {"--source-dir"}, description = "Source directory path handed to engines")
    private String sourceDir;

    @Option(names = {"--registry", "-r"}, description = "Engine registry file")
    private String registryFile;

    private final AnalyzerProperties properties;
    private final EngineRegistryLoader registryLoader;
    private final EngineConfigWriter configWriter;

    public EnginesCommand(AnalyzerProperties properties, EngineRegistryLoader registryLoader,
                          EngineConfigWriter configWriter) {
        this.properties = properties;
        this.registryLoader = registryLoader;
        this.configWriter = configWriter;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Path workspacePath = Path.of(workspace != null ? workspace : properties.getWorkspace());
        Path configPath = workspacePath.resolve(configFile != null ? configFile : properties.getConfigFile());
        String engineSourceDir = sourceDir != null ? sourceDir : properties.getSourceDir();

        List<Engine> engines;
        try {
            var config = AnalyzerConfigParser.load(configPath);
            EngineRegistry registry = registryFile != null
                    ? registryLoader.load(Path.of(registryFile))
                    : registryLoader.load();
            var builder = new EnginesBuilder(registry, config, properties.getContainerLabelOrNull(),
                    engineSourceDir, requestedPaths, workspacePath, new PosixFileReadability());
            engines = builder.run();
        } catch (AnalyzerConfigException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (UncheckedIOException e) {
            log.error("Failed to scan {}", workspacePath, e);
            ConsoleOutput.error("Failed to scan " + workspacePath + ": " + e.getCause().getMessage());
            return 1;
        }

        if (engines.isEmpty()) {
            ConsoleOutput.info("No enabled engines found in " + configPath);
            return 0;
        }
        for (Engine engine : engines) {
            ConsoleOutput.engine(engine.name(), engine.image());
            ConsoleOutput.detail(configWriter.toPrettyJson(engine.config()));
        }
        ConsoleOutput.success(engines.size() + " engine(s) resolved");
        return 0;
    }
}
