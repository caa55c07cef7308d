package com.codeanalyzer.core.paths;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decides whether a file can be read by every user.
 * <p>
 * Engines run as an unprivileged user inside their containers, so a file only its owner
 * can read would make them fail; such files are excluded up front.
 */
@FunctionalInterface
public interface FileReadability {

    boolean readableByAll(Path path) throws IOException;
}
