package com.codeanalyzer.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the analyzer CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CODE ANALYZER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ANALYZER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void engine(String name, String image) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [ENGINE " + name + "]|@ " + image));
    }

    public static void detail(String text) {
        for (String line : text.split("\n")) {
            System.out.println("    " + line);
        }
    }
}
