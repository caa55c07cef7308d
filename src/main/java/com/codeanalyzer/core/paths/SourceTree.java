package com.codeanalyzer.core.paths;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Directory listing helpers shared by the path resolvers.
 * <p>
 * Listings are sorted by file name so every resolver produces a stable order, and
 * the {@code .git} directory is never part of a listing.
 */
final class SourceTree {

    static final String GIT_DIR = ".git";
    static final String ROOT_MARKER = "./";

    private SourceTree() {
        // utility class
    }

    /**
     * Lists the entries of {@code dir}, sorted by name, without {@code .git}.
     */
    static List<Path> children(Path dir) throws IOException {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                    .filter(p -> !GIT_DIR.equals(p.getFileName().toString()))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    /**
     * Directories are not followed through symbolic links.
     */
    static boolean isDirectory(Path path) {
        return Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS);
    }

    /**
     * Slash-separated path of {@code path} relative to {@code root}; empty for the root itself.
     */
    static String relative(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    /**
     * Normalizes a caller-supplied relative path: strips {@code ./} prefixes and trailing
     * slashes. Returns an empty string for the root.
     */
    static String normalize(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return ".".equals(normalized) ? "" : normalized;
    }

    /**
     * True when {@code path} equals {@code ancestor} or lies beneath it. An empty ancestor is the root.
     */
    static boolean isWithin(String path, String ancestor) {
        if (ancestor.isEmpty()) {
            return true;
        }
        return path.equals(ancestor) || path.startsWith(ancestor + "/");
    }
}
