package com.codeanalyzer.core.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Utility for managing analyzer-specific MDC keys for structured logging.
 */
public final class MdcContext {

    static final String ENGINE_KEY = "engine";
    static final String SOURCE_DIR_KEY = "sourceDir";

    private MdcContext() {}

    public static void setRun(String sourceDir) {
        MDC.put(SOURCE_DIR_KEY, sourceDir);
    }

    public static void setEngine(String engineName) {
        MDC.put(ENGINE_KEY, engineName);
    }

    public static void clearEngine() {
        MDC.remove(ENGINE_KEY);
    }

    public static void clear() {
        MDC.remove(ENGINE_KEY);
        MDC.remove(SOURCE_DIR_KEY);
    }

    /**
     * Captures the current values of the analyzer keys; absent keys map to {@code null}.
     */
    public static Snapshot snapshot() {
        return new Snapshot(MDC.get(ENGINE_KEY), MDC.get(SOURCE_DIR_KEY));
    }

    /**
     * Values of the analyzer keys at one point in time. {@link #restore()} puts them back,
     * removing keys that were absent, and leaves every other MDC key alone.
     */
    public record Snapshot(String engine, String sourceDir) {

        public void restore() {
            restoreKey(ENGINE_KEY, engine);
            restoreKey(SOURCE_DIR_KEY, sourceDir);
        }

        private static void restoreKey(String key, String value) {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        }
    }
}
