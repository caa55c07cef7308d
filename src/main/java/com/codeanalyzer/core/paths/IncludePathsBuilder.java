package com.codeanalyzer.core.paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the paths an engine should analyze.
 * <p>
 * The result is the smallest list of path prefixes that covers every file left once the
 * excluded paths are removed. A directory with nothing excluded inside it collapses to
 * {@code "dir/"}, and the whole tree to {@code "./"}. A directory that does contain an
 * excluded path is expanded: its files are listed individually and its subdirectories are
 * resolved the same way, in name order. {@code .git} is never listed.
 * <p>
 * When paths were requested explicitly, only those are resolved, in request order.
 * Requested paths that are excluded, missing or outside the root are skipped.
 */
public class IncludePathsBuilder {

    private static final Logger log = LoggerFactory.getLogger(IncludePathsBuilder.class);

    private final Path root;

    public IncludePathsBuilder(Path root) {
        this.root = root;
    }

    /**
     * @param excludePaths   excluded paths relative to the root
     * @param requestedPaths paths the caller asked to analyze; empty means the whole tree
     * @return include paths relative to the root
     * @throws IOException if a directory that must be expanded cannot be listed
     */
    public List<String> build(List<String> excludePaths, List<String> requestedPaths) throws IOException {
        var excluded = new LinkedHashSet<String>();
        for (String path : excludePaths) {
            String normalized = SourceTree.normalize(path);
            if (!normalized.isEmpty()) {
                excluded.add(normalized);
            }
        }

        var included = new LinkedHashSet<String>();
        if (requestedPaths == null || requestedPaths.isEmpty()) {
            collect(root, "", excluded, included);
        } else {
            for (String requested : requestedPaths) {
                includeRequested(requested, excluded, included);
            }
        }
        return List.copyOf(included);
    }

    private void includeRequested(String requested, Set<String> excluded, Set<String> included) throws IOException {
        Path absoluteRoot = root.toAbsolutePath().normalize();
        Path target = absoluteRoot.resolve(requested.replace('\\', '/')).normalize();
        if (!target.startsWith(absoluteRoot)) {
            log.warn("Requested path '{}' is outside {}; skipping", requested, root);
            return;
        }
        String relative = SourceTree.relative(absoluteRoot, target);
        if (isExcluded(relative, excluded)) {
            log.warn("Requested path '{}' is excluded; skipping", requested);
            return;
        }
        Path path = relative.isEmpty() ? root : root.resolve(relative);
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            log.warn("Requested path '{}' does not exist; skipping", requested);
            return;
        }
        if (SourceTree.isDirectory(path)) {
            collect(path, relative, excluded, included);
        } else {
            included.add(relative);
        }
    }

    private void collect(Path dir, String relative, Set<String> excluded, Set<String> out) throws IOException {
        if (!containsExcluded(relative, excluded)) {
            out.add(relative.isEmpty() ? SourceTree.ROOT_MARKER : relative + "/");
            return;
        }
        for (Path child : SourceTree.children(dir)) {
            String childRelative = SourceTree.relative(root, child);
            if (excluded.contains(childRelative)) {
                continue;
            }
            if (SourceTree.isDirectory(child)) {
                collect(child, childRelative, excluded, out);
            } else {
                out.add(childRelative);
            }
        }
    }

    private static boolean containsExcluded(String directory, Set<String> excluded) {
        for (String path : excluded) {
            if (!path.equals(directory) && SourceTree.isWithin(path, directory)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isExcluded(String path, Set<String> excluded) {
        for (String excludedPath : excluded) {
            if (SourceTree.isWithin(path, excludedPath)) {
                return true;
            }
        }
        return false;
    }
}
