package com.codeanalyzer.core.config;

/**
 * Thrown when an analyzer configuration or engine registry document cannot be
 * read or does not have the expected structure.
 */
public class AnalyzerConfigException extends RuntimeException {
    public AnalyzerConfigException(String message) {
        super(message);
    }

    public AnalyzerConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
