package com.codeanalyzer.engine;

/**
 * A {@link Formatter} that discards everything. Used when no formatter is supplied.
 */
public final class NullFormatter implements Formatter {

    public static final NullFormatter INSTANCE = new NullFormatter();

    private NullFormatter() {
    }

    @Override
    public void started() {
    }

    @Override
    public void write(String data) {
    }

    @Override
    public void engineRunning(String engineName, Runnable body) {
        body.run();
    }

    @Override
    public void finished() {
    }

    @Override
    public void close() {
    }
}
