package com.codeanalyzer.core.paths;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Expands the glob patterns of a configuration's {@code exclude_paths} into the files they
 * cover under a root directory.
 * <p>
 * Patterns use {@link java.nio.file.FileSystem#getPathMatcher glob} syntax relative to the
 * root. <code>**&#47;x</code> also matches {@code x} at the root, and a pattern that matches a
 * directory covers every file beneath it.
 */
public final class PathPatterns {

    private final Path root;

    public PathPatterns(Path root) {
        this.root = root;
    }

    /**
     * @return matching files relative to the root, sorted; empty when nothing matches
     */
    public List<String> expand(List<String> patterns) throws IOException {
        var matchers = compile(patterns);
        if (matchers.isEmpty() || !Files.isDirectory(root)) {
            return List.of();
        }
        var matches = new TreeSet<String>();
        collect(root, matchers, matches);
        return List.copyOf(matches);
    }

    private void collect(Path dir, List<PathMatcher> matchers, TreeSet<String> out) throws IOException {
        for (Path child : SourceTree.children(dir)) {
            if (SourceTree.isDirectory(child)) {
                collect(child, matchers, out);
            } else {
                String relative = SourceTree.relative(root, child);
                if (coveredBy(relative, matchers)) {
                    out.add(relative);
                }
            }
        }
    }

    /**
     * A file is covered when it, or any directory above it, matches a pattern.
     */
    private static boolean coveredBy(String relative, List<PathMatcher> matchers) {
        Path candidate = Path.of(relative);
        while (candidate != null) {
            for (PathMatcher matcher : matchers) {
                if (matcher.matches(candidate)) {
                    return true;
                }
            }
            candidate = candidate.getParent();
        }
        return false;
    }

    private static List<PathMatcher> compile(List<String> patterns) {
        var matchers = new ArrayList<PathMatcher>();
        if (patterns == null) {
            return matchers;
        }
        var fileSystem = FileSystems.getDefault();
        for (String pattern : patterns) {
            String glob = SourceTree.normalize(pattern.trim());
            if (glob.isEmpty()) {
                continue;
            }
            matchers.add(fileSystem.getPathMatcher("glob:" + glob));
            if (glob.startsWith("**/")) {
                matchers.add(fileSystem.getPathMatcher("glob:" + glob.substring(3)));
            }
        }
        return matchers;
    }
}
