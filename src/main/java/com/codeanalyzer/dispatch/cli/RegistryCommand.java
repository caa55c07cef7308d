package com.codeanalyzer.dispatch.cli;

import com.codeanalyzer.core.config.AnalyzerConfigException;
import com.codeanalyzer.core.registry.EngineRegistry;
import com.codeanalyzer.core.registry.EngineRegistryLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: code-analyzer registry
 * <p>
 * Lists the engines of the registry with their images.
 */
@Command(name = "registry", mixinStandardHelpOptions = true, description = "List the engines the registry knows")
@Component
public class RegistryCommand implements Callable<Integer> {

    @Option(names = {"--registry", "-r"}, description = "Engine registry file")
    private String registryFile;

    private final EngineRegistryLoader registryLoader;

    public RegistryCommand(EngineRegistryLoader registryLoader) {
        this.registryLoader = registryLoader;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        EngineRegistry registry;
        try {
            registry = registryFile != null ? registryLoader.load(Path.of(registryFile)) : registryLoader.load();
        } catch (AnalyzerConfigException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        registry.asMap().forEach((name, descriptor) -> {
            ConsoleOutput.engine(name, descriptor.image());
            Object description = descriptor.attributes().get("description");
            if (description != null) {
                ConsoleOutput.detail(String.valueOf(description));
            }
        });
        ConsoleOutput.success(registry.size() + " engine(s) registered");
        return 0;
    }
}
