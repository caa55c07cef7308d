package com.codeanalyzer.dispatch.cli;

import com.codeanalyzer.core.config.AnalyzerProperties;
import com.codeanalyzer.core.registry.EngineRegistryLoader;
import com.codeanalyzer.engine.EngineConfigWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the analyzer CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * against a temporary workspace and the bundled engine registry.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path workspace;

    private AnalyzerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AnalyzerProperties();
        properties.setWorkspace(workspace.toString());
    }

    /**
     * Custom picocli IFactory that wires command dependencies by hand.
     */
    private CommandLine.IFactory createFactory() {
        var registryLoader = new EngineRegistryLoader(properties);
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == EnginesCommand.class) {
                    return (K) new EnginesCommand(properties, registryLoader, new EngineConfigWriter());
                }
                if (cls == RegistryCommand.class) {
                    return (K) new RegistryCommand(registryLoader);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new AnalyzerCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private void writeConfig(String yaml) throws IOException {
        Files.writeString(workspace.resolve(".codeclimate.yml"), yaml);
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("engines"), "Help should list 'engines' subcommand");
            assertTrue(result.output().contains("registry"), "Help should list 'registry' subcommand");
            assertTrue(result.output().contains("help"), "Help should list 'help' subcommand");
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Code Analyzer 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints usage")
        void noSubcommandPrintsUsage() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage: code-analyzer"));
        }

        @Test
        @DisplayName("engines --help shows its options")
        void enginesHelp() {
            CliResult result = execute("engines", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--config"));
            assertTrue(result.output().contains("--workspace"));
            assertTrue(result.output().contains("--source-dir"));
        }
    }

    // =====================================================================
    //  engines
    // =====================================================================

    @Nested
    @DisplayName("engines command")
    class EnginesTests {

        @Test
        @DisplayName("prints each resolved engine with its configuration")
        void printsResolvedEngines() throws IOException {
            writeConfig("""
                    engines:
                      rubocop:
                        enabled: true
                        config:
                          file: rubocop.yml
                      unknown_engine:
                        enabled: true
                    """);

            CliResult result = execute("engines");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("[ENGINE rubocop] codeclimate/codeclimate-rubocop"));
            assertTrue(result.output().contains("rubocop.yml"));
            assertTrue(result.output().contains("include_paths"));
            assertFalse(result.output().contains("[ENGINE unknown_engine]"));
            assertTrue(result.output().contains("1 engine(s) resolved"));
        }

        @Test
        @DisplayName("reports when no engine is enabled")
        void noEnabledEngines() throws IOException {
            writeConfig("engines:\n  rubocop:\n    enabled: false\n");

            CliResult result = execute("engines");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No enabled engines found"));
        }

        @Test
        @DisplayName("--config selects another file in the workspace")
        void customConfigFile() throws IOException {
            Files.writeString(workspace.resolve("analysis.yml"), "engines:\n  eslint:\n    enabled: true\n");

            CliResult result = execute("engines", "--config", "analysis.yml");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[ENGINE eslint]"));
        }

        @Test
        @DisplayName("a missing configuration file fails with exit code 1")
        void missingConfig() {
            CliResult result = execute("engines");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Configuration file not found"));
        }

        @Test
        @DisplayName("an invalid configuration fails with exit code 1")
        void invalidConfig() throws IOException {
            writeConfig("engines:\n  - rubocop\n");

            CliResult result = execute("engines");

            assertEquals(1, result.exitCode());
        }
    }

    // =====================================================================
    //  registry
    // =====================================================================

    @Nested
    @DisplayName("registry command")
    class RegistryTests {

        @Test
        @DisplayName("lists the bundled engines")
        void listsBundledEngines() {
            CliResult result = execute("registry");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[ENGINE rubocop] codeclimate/codeclimate-rubocop"));
            assertTrue(result.output().contains("engine(s) registered"));
        }

        @Test
        @DisplayName("--registry reads another catalog")
        void customRegistry() throws IOException {
            Path file = Files.writeString(workspace.resolve("engines.yml"),
                    "custom:\n  image: acme/custom\n  description: In-house checks\n");

            CliResult result = execute("registry", "--registry", file.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[ENGINE custom] acme/custom"));
            assertTrue(result.output().contains("In-house checks"));
            assertTrue(result.output().contains("1 engine(s) registered"));
        }

        @Test
        @DisplayName("a missing registry file fails with exit code 1")
        void missingRegistry() {
            CliResult result = execute("registry", "--registry", workspace.resolve("absent.yml").toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Engine registry not found"));
        }
    }
}
