package com.codeanalyzer.engine;

import com.codeanalyzer.core.logging.MdcContext;
import com.codeanalyzer.core.model.AnalyzerConfig;
import com.codeanalyzer.core.model.EngineConfig;
import com.codeanalyzer.core.model.EngineDescriptor;
import com.codeanalyzer.core.model.EngineSettings;
import com.codeanalyzer.core.paths.ExcludePathsResolver;
import com.codeanalyzer.core.paths.FileReadability;
import com.codeanalyzer.core.paths.IncludePathsBuilder;
import com.codeanalyzer.core.paths.PosixFileReadability;
import com.codeanalyzer.core.registry.EngineRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a registry, an analyzer configuration and a source directory into the list of
 * engines to run.
 *
 * <p>For every engine block in configuration order:
 * <ul>
 *   <li>engines the registry does not know are skipped (logged, never an error)</li>
 *   <li>disabled engines are skipped</li>
 *   <li>the exclude paths are resolved from configuration patterns, ignore rules and file
 *       readability, then the include paths from the {@link IncludePathsBuilder}</li>
 *   <li>the engine block and both path lists are merged into an {@link EngineConfig} and
 *       handed to the {@link EngineFactory} together with the formatter</li>
 * </ul>
 *
 * <p>Path lists are computed once per {@link #run} call and never cached across calls.
 * The builder keeps no reference to the engines it constructs.
 */
public class EnginesBuilder {

    private static final Logger log = LoggerFactory.getLogger(EnginesBuilder.class);

    private final EngineRegistry registry;
    private final AnalyzerConfig config;
    private final String containerLabel;
    private final String sourceDir;
    private final List<String> requestedPaths;
    private final ExcludePathsResolver excludePathsResolver;
    private final IncludePathsBuilder includePathsBuilder;

    /**
     * Scans {@code sourceDir} itself, using POSIX permissions for readability.
     */
    public EnginesBuilder(EngineRegistry registry, AnalyzerConfig config, String containerLabel,
                          String sourceDir, List<String> requestedPaths) {
        this(registry, config, containerLabel, sourceDir, requestedPaths,
                Path.of(sourceDir), new PosixFileReadability());
    }

    /**
     * @param workspace   directory scanned for ignore rules and files; differs from
     *                    {@code sourceDir} when engines see the tree under a mount point
     * @param readability predicate deciding which files engines can read
     */
    public EnginesBuilder(EngineRegistry registry, AnalyzerConfig config, String containerLabel,
                          String sourceDir, List<String> requestedPaths,
                          Path workspace, FileReadability readability) {
        this(registry, config, containerLabel, sourceDir, requestedPaths,
                new ExcludePathsResolver(workspace, readability), new IncludePathsBuilder(workspace));
    }

    public EnginesBuilder(EngineRegistry registry, AnalyzerConfig config, String containerLabel,
                          String sourceDir, List<String> requestedPaths,
                          ExcludePathsResolver excludePathsResolver, IncludePathsBuilder includePathsBuilder) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.containerLabel = containerLabel;
        this.sourceDir = Objects.requireNonNull(sourceDir, "sourceDir");
        this.requestedPaths = requestedPaths == null ? List.of() : List.copyOf(requestedPaths);
        this.excludePathsResolver = Objects.requireNonNull(excludePathsResolver, "excludePathsResolver");
        this.includePathsBuilder = Objects.requireNonNull(includePathsBuilder, "includePathsBuilder");
    }

    /**
     * Builds {@link Engine} instances with a formatter that discards output.
     */
    public List<Engine> run() {
        return run(Engine::new, NullFormatter.INSTANCE);
    }

    public List<Engine> run(Formatter formatter) {
        return run(Engine::new, formatter);
    }

    public <E> List<E> run(EngineFactory<E> factory) {
        return run(factory, NullFormatter.INSTANCE);
    }

    /**
     * Constructs one engine per enabled, registry-known engine block, in configuration order.
     *
     * @param factory   engine constructor
     * @param formatter forwarded unchanged to every engine
     * @return the constructed engines; empty when no configured engine resolves
     * @throws UncheckedIOException if the source tree cannot be scanned
     */
    public <E> List<E> run(EngineFactory<E> factory, Formatter formatter) {
        Objects.requireNonNull(factory, "factory");
        var engines = new ArrayList<E>();
        var pathLists = new PathLists();

        var previousMdc = MdcContext.snapshot();
        MdcContext.setRun(sourceDir);
        try {
            for (Map.Entry<String, EngineSettings> entry : config.engines().entrySet()) {
                String name = entry.getKey();
                Optional<EngineDescriptor> descriptor = registry.find(name);
                if (descriptor.isEmpty()) {
                    log.info("Skipping engine '{}': not present in the engine registry", name);
                    continue;
                }
                EngineSettings settings = entry.getValue();
                if (!settings.enabled()) {
                    log.debug("Skipping engine '{}': disabled", name);
                    continue;
                }

                MdcContext.setEngine(name);
                try {
                    EngineConfig engineConfig = EngineConfig.resolve(
                            settings, pathLists.excludePaths(), pathLists.includePaths());
                    log.debug("Resolved engine '{}' ({}): {} include path(s), {} exclude path(s)",
                            name, descriptor.get().image(),
                            engineConfig.includePaths().size(), engineConfig.excludePaths().size());
                    engines.add(factory.create(name, descriptor.get(), sourceDir, engineConfig, formatter));
                } finally {
                    MdcContext.clearEngine();
                }
            }
        } finally {
            previousMdc.restore();
        }

        log.info("Built {} engine(s) from {} configured", engines.size(), config.engines().size());
        return engines;
    }

    public String getContainerLabel() {
        return containerLabel;
    }

    public String getSourceDir() {
        return sourceDir;
    }

    /**
     * Path lists of a single run, resolved on first use so runs with no resolvable engine
     * never touch the file system.
     */
    private final class PathLists {

        private List<String> excludePaths;
        private List<String> includePaths;

        List<String> excludePaths() {
            if (excludePaths == null) {
                try {
                    excludePaths = excludePathsResolver.resolve(config.excludePaths());
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to resolve exclude paths in " + sourceDir, e);
                }
            }
            return excludePaths;
        }

        List<String> includePaths() {
            if (includePaths == null) {
                try {
                    includePaths = includePathsBuilder.build(excludePaths(), requestedPaths);
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to resolve include paths in " + sourceDir, e);
                }
            }
            return includePaths;
        }
    }
}
