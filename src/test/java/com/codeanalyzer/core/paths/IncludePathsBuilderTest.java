package com.codeanalyzer.core.paths;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IncludePathsBuilderTest {

    @TempDir
    Path root;

    private IncludePathsBuilder builder;

    @BeforeEach
    void setUp() throws IOException {
        builder = new IncludePathsBuilder(root);
        Files.createDirectories(root.resolve(".git"));
        makeFile("README.md");
        makeFile("app/models/user.rb");
        makeFile("app/models/post.rb");
        makeFile("app/controllers/users_controller.rb");
        makeFile("lib/tasks/seed.rake");
        makeFile("vendor/jquery.js");
    }

    private void makeFile(String relativePath) throws IOException {
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
    }

    @Nested
    @DisplayName("Whole tree")
    class WholeTreeTests {

        @Test
        @DisplayName("nothing excluded collapses to the root marker")
        void nothingExcluded() throws IOException {
            assertEquals(List.of("./"), builder.build(List.of(), List.of()));
        }

        @Test
        @DisplayName("an excluded file expands only the directories above it")
        void excludedFileExpandsItsAncestors() throws IOException {
            var included = builder.build(List.of("app/models/post.rb"), List.of());

            assertEquals(List.of(
                    "README.md",
                    "app/controllers/",
                    "app/models/user.rb",
                    "lib/",
                    "vendor/"), included);
        }

        @Test
        @DisplayName("an excluded directory is dropped entirely")
        void excludedDirectory() throws IOException {
            var included = builder.build(List.of("vendor/"), List.of());

            assertEquals(List.of("README.md", "app/", "lib/"), included);
        }

        @Test
        @DisplayName("excluded paths are normalized before comparison")
        void excludedPathsAreNormalized() throws IOException {
            var included = builder.build(List.of("./lib/tasks/", "vendor"), List.of());

            assertEquals(List.of("README.md", "app/"), included);
        }

        @Test
        @DisplayName("excluding every file yields an empty list")
        void everythingExcluded() throws IOException {
            var included = builder.build(List.of("README.md", "app", "lib", "vendor"), List.of());

            assertEquals(List.of(), included);
        }

        @Test
        @DisplayName("the .git directory is never listed")
        void gitDirectoryNeverListed() throws IOException {
            var included = builder.build(List.of("README.md"), List.of());

            assertFalse(included.stream().anyMatch(path -> path.startsWith(".git")));
        }
    }

    @Nested
    @DisplayName("Requested paths")
    class RequestedPathTests {

        @Test
        @DisplayName("requested paths are resolved in request order")
        void requestOrder() throws IOException {
            var included = builder.build(List.of(), List.of("lib", "README.md", "app/models/"));

            assertEquals(List.of("lib/", "README.md", "app/models/"), included);
        }

        @Test
        @DisplayName("a requested directory with excluded content is expanded")
        void requestedDirectoryIsExpanded() throws IOException {
            var included = builder.build(List.of("app/models/user.rb"), List.of("app"));

            assertEquals(List.of("app/controllers/", "app/models/post.rb"), included);
        }

        @Test
        @DisplayName("excluded and missing requested paths are skipped")
        void excludedAndMissingAreSkipped() throws IOException {
            var included = builder.build(List.of("vendor"), List.of("vendor/jquery.js", "missing.rb", "lib"));

            assertEquals(List.of("lib/"), included);
        }

        @Test
        @DisplayName("paths escaping the root are skipped")
        void pathsOutsideTheRootAreSkipped() throws IOException {
            var included = builder.build(List.of(), List.of("../", "/etc", "lib/../../outside", "lib/../README.md"));

            assertEquals(List.of("README.md"), included);
        }

        @Test
        @DisplayName("an absolute path inside the root is accepted")
        void absolutePathInsideTheRoot() throws IOException {
            var included = builder.build(List.of(), List.of(root.resolve("lib").toString()));

            assertEquals(List.of("lib/"), included);
        }

        @Test
        @DisplayName("requesting the root behaves like requesting nothing")
        void requestingTheRoot() throws IOException {
            assertEquals(List.of("./"), builder.build(List.of(), List.of(".")));
        }
    }
}
