package com.codeanalyzer.engine;

/**
 * Receives the lifecycle and output events of an analysis run.
 *
 * <p>The engines builder only forwards a formatter to each engine it constructs; it
 * never calls these methods itself.
 */
public interface Formatter extends AutoCloseable {

    /**
     * The run is about to start its first engine.
     */
    void started();

    /**
     * Raw output emitted by an engine (one JSON issue document, usually).
     */
    void write(String data);

    /**
     * Wraps the execution of one engine, so output can be attributed to it.
     *
     * @param engineName name of the engine being run
     * @param body       the engine execution
     */
    void engineRunning(String engineName, Runnable body);

    /**
     * Every engine has finished.
     */
    void finished();

    /**
     * Releases the formatter's output. Must not throw.
     */
    @Override
    void close();
}
