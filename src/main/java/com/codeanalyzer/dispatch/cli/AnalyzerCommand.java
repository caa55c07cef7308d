package com.codeanalyzer.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for the analyzer.
 * Routes to subcommands: engines, registry.
 */
@Command(
        name = "code-analyzer",
        mixinStandardHelpOptions = true,
        version = "Code Analyzer 0.1.0",
        description = "Resolves which analysis engines run over a source tree, and with which paths",
        subcommands = {
                EnginesCommand.class,
                RegistryCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AnalyzerCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
