package com.codeanalyzer.core.paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Lists the untracked files git ignores in a workspace.
 * <p>
 * Runs {@code git ls-files --others -i --exclude-standard -z}, so every source of ignore
 * rules git knows is honored: {@code .gitignore} files at any depth, {@code .git/info/exclude}
 * and {@code core.excludesFile}. Tracked files are never reported, even when a pattern
 * matches them. A workspace that is not itself a git repository has no ignored files.
 * <p>
 * This class shells out to the {@code git} CLI via {@link ProcessBuilder}.
 */
public class GitIgnoredFiles {

    private static final Logger log = LoggerFactory.getLogger(GitIgnoredFiles.class);

    static final List<String> LS_FILES_ARGS =
            List.of("ls-files", "--others", "--ignored", "--exclude-standard", "-z");

    private final Path workspace;
    private final String gitExecutable;

    public GitIgnoredFiles(Path workspace) {
        this(workspace, "git");
    }

    GitIgnoredFiles(Path workspace, String gitExecutable) {
        this.workspace = workspace;
        this.gitExecutable = gitExecutable;
    }

    /**
     * True when the workspace holds its own {@code .git} directory (or worktree file).
     */
    public boolean isRepository() {
        return Files.exists(workspace.resolve(SourceTree.GIT_DIR), LinkOption.NOFOLLOW_LINKS);
    }

    /**
     * @return ignored untracked files relative to the workspace, sorted; empty outside a repository
     * @throws IOException if git cannot be started or exits with an error
     */
    public List<String> list() throws IOException {
        if (!isRepository()) {
            log.debug("{} is not a git repository; no ignored files", workspace);
            return List.of();
        }
        var ignored = new TreeSet<>(parse(runGitOutput(LS_FILES_ARGS)));
        log.debug("git reports {} ignored file(s) in {}", ignored.size(), workspace);
        return List.copyOf(ignored);
    }

    /**
     * Splits NUL-terminated {@code -z} output into paths.
     */
    static List<String> parse(String output) {
        var paths = new ArrayList<String>();
        for (String entry : output.split("\0")) {
            if (!entry.isEmpty()) {
                paths.add(entry);
            }
        }
        return paths;
    }

    /**
     * Runs a git command in the workspace and captures stdout.
     */
    String runGitOutput(List<String> args) throws IOException {
        var command = new ArrayList<String>();
        command.add(gitExecutable);
        command.addAll(args);
        log.debug("Running (capture): {}", String.join(" ", command));

        var process = new ProcessBuilder(command)
                .directory(workspace.toFile())
                .redirectErrorStream(false)
                .start();
        try {
            String output;
            try (InputStream stdout = process.getInputStream()) {
                output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
            }
            String errors;
            try (InputStream stderr = process.getErrorStream()) {
                errors = new String(stderr.readAllBytes(), StandardCharsets.UTF_8).trim();
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new IOException("git %s exited with code %d in %s: %s"
                        .formatted(String.join(" ", args), exitCode, workspace, errors));
            }
            return output;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while running git in " + workspace);
        } finally {
            process.destroy();
        }
    }
}
