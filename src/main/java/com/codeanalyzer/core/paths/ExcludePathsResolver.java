package com.codeanalyzer.core.paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the paths every engine must skip in a workspace.
 * <p>
 * The list is assembled in three groups, de-duplicated and kept in this order:
 * <ol>
 *   <li>files covered by the configuration's {@code exclude_paths} patterns</li>
 *   <li>untracked files git ignores, when the workspace is a git repository</li>
 *   <li>files that are not readable by every user</li>
 * </ol>
 * Ignored files are listed one by one, as {@code git ls-files --others -i} reports them.
 * A workspace that does not exist has nothing to exclude.
 */
public class ExcludePathsResolver {

    private static final Logger log = LoggerFactory.getLogger(ExcludePathsResolver.class);

    private final Path workspace;
    private final FileReadability readability;
    private final GitIgnoredFiles gitIgnored;

    public ExcludePathsResolver(Path workspace, FileReadability readability) {
        this(workspace, readability, new GitIgnoredFiles(workspace));
    }

    public ExcludePathsResolver(Path workspace, FileReadability readability, GitIgnoredFiles gitIgnored) {
        this.workspace = workspace;
        this.readability = readability;
        this.gitIgnored = gitIgnored;
    }

    /**
     * @param configPatterns glob patterns from the configuration's {@code exclude_paths}
     * @return excluded paths relative to the workspace
     * @throws IOException if the workspace cannot be listed or git fails
     */
    public List<String> resolve(List<String> configPatterns) throws IOException {
        if (!Files.isDirectory(workspace)) {
            log.debug("Workspace {} does not exist; nothing to exclude", workspace);
            return List.of();
        }
        var excluded = new LinkedHashSet<String>(new PathPatterns(workspace).expand(configPatterns));
        excluded.addAll(gitIgnoredFiles());
        excluded.addAll(unreadableFiles(excluded));
        log.debug("Resolved {} excluded path(s) in {}", excluded.size(), workspace);
        return List.copyOf(excluded);
    }

    /**
     * Untracked files git ignores in the workspace, sorted by path; empty when the workspace
     * is not a git repository.
     */
    public List<String> gitIgnoredFiles() throws IOException {
        if (!Files.isDirectory(workspace)) {
            return List.of();
        }
        return gitIgnored.list();
    }

    private List<String> unreadableFiles(Set<String> alreadyExcluded) throws IOException {
        var unreadable = new ArrayList<String>();
        collectUnreadable(workspace, alreadyExcluded, unreadable);
        return unreadable;
    }

    private void collectUnreadable(Path dir, Set<String> alreadyExcluded, List<String> out) throws IOException {
        for (Path child : SourceTree.children(dir)) {
            String relative = SourceTree.relative(workspace, child);
            if (alreadyExcluded.contains(relative)) {
                continue;
            }
            if (SourceTree.isDirectory(child)) {
                collectUnreadable(child, alreadyExcluded, out);
            } else if (!readability.readableByAll(child)) {
                log.warn("Excluding {}: file is not readable by all users", relative);
                out.add(relative);
            }
        }
    }
}
