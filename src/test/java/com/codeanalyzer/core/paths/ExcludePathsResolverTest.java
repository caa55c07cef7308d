package com.codeanalyzer.core.paths;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ExcludePathsResolverTest {

    @TempDir
    Path workspace;

    private ExcludePathsResolver resolver() {
        return new ExcludePathsResolver(workspace, path -> true);
    }

    private ExcludePathsResolver resolverIgnoring(List<String> ignored, FileReadability readability)
            throws IOException {
        var gitIgnored = mock(GitIgnoredFiles.class);
        when(gitIgnored.list()).thenReturn(ignored);
        return new ExcludePathsResolver(workspace, readability, gitIgnored);
    }

    private void makeFile(String relativePath, String content) throws IOException {
        Path file = workspace.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Nested
    @DisplayName("Ignored files")
    class IgnoredFileTests {

        @Test
        @DisplayName("ignore files are not applied outside a git repository")
        void notAGitRepository() throws IOException {
            makeFile(".gitignore", ".ignorethis\n");
            makeFile(".ignorethis", "");

            assertFalse(Files.exists(workspace.resolve(".git")));
            assertEquals(List.of(), resolver().gitIgnoredFiles());
            assertEquals(List.of(), resolver().resolve(List.of()));
        }

        @Test
        @DisplayName("in a repository, git's ignored untracked files are excluded")
        void gitRepository() throws Exception {
            GitRepositories.assumeGitAvailable();
            GitRepositories.init(workspace);
            makeFile(".gitignore", "build/\n");
            makeFile("build/out/app.jar", "");
            makeFile("src/app.rb", "");

            assertEquals(List.of("build/out/app.jar"), resolver().gitIgnoredFiles());
        }

        @Test
        @DisplayName("the ignored list comes from the injected GitIgnoredFiles")
        void delegatesToGit() throws IOException {
            var gitIgnored = mock(GitIgnoredFiles.class);
            when(gitIgnored.list()).thenReturn(List.of("tmp/cache.bin"));
            makeFile("tmp/cache.bin", "");

            var resolver = new ExcludePathsResolver(workspace, path -> true, gitIgnored);

            assertEquals(List.of("tmp/cache.bin"), resolver.resolve(List.of()));
        }
    }

    @Nested
    @DisplayName("Resolution")
    class ResolutionTests {

        @Test
        @DisplayName("configuration patterns come first, then ignored files, without duplicates")
        void orderAndDeduplication() throws IOException {
            makeFile("vendor/a.log", "");
            makeFile("vendor/b.rb", "");
            makeFile("app.log", "");

            var excluded = resolverIgnoring(List.of("app.log", "vendor/a.log"), path -> true)
                    .resolve(List.of("vendor/**"));

            assertEquals(List.of("vendor/a.log", "vendor/b.rb", "app.log"), excluded);
        }

        @Test
        @DisplayName("unreadable files are excluded last")
        void unreadableFilesAreAppended() throws IOException {
            makeFile("tmp/cache", "");
            makeFile("config/secrets.yml", "");
            makeFile("app.rb", "");
            var resolver = resolverIgnoring(List.of("tmp/cache"),
                    path -> !path.getFileName().toString().equals("secrets.yml"));

            assertEquals(List.of("tmp/cache", "config/secrets.yml"), resolver.resolve(List.of()));
        }

        @Test
        @DisplayName("readability is not checked for files already excluded")
        void readabilityNotCheckedForExcludedFiles() throws IOException {
            makeFile("private.key", "");
            var resolver = resolverIgnoring(List.of("private.key"), path -> {
                assertNotEquals("private.key", path.getFileName().toString());
                return true;
            });

            assertEquals(List.of("private.key"), resolver.resolve(List.of()));
        }

        @Test
        @DisplayName("a missing workspace excludes nothing")
        void missingWorkspace() throws IOException {
            var resolver = new ExcludePathsResolver(workspace.resolve("absent"), path -> true);

            assertEquals(List.of(), resolver.resolve(List.of("**/*.rb")));
            assertEquals(List.of(), resolver.gitIgnoredFiles());
        }

        @Test
        @DisplayName("readability failures propagate")
        void readabilityFailure() throws IOException {
            makeFile("a.rb", "");
            var resolver = new ExcludePathsResolver(workspace, path -> {
                throw new IOException("stat failed");
            });

            var error = assertThrows(IOException.class, () -> resolver.resolve(List.of()));
            assertEquals("stat failed", error.getMessage());
        }
    }
}
