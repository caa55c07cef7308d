package com.codeanalyzer.core.paths;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;

/**
 * {@link FileReadability} based on the POSIX "others may read" bit.
 * Falls back to {@link Files#isReadable(Path)} on file systems without POSIX attributes.
 */
public class PosixFileReadability implements FileReadability {

    @Override
    public boolean readableByAll(Path path) throws IOException {
        var view = Files.getFileAttributeView(path, PosixFileAttributeView.class, LinkOption.NOFOLLOW_LINKS);
        if (view == null) {
            return Files.isReadable(path);
        }
        return view.readAttributes().permissions().contains(PosixFilePermission.OTHERS_READ);
    }
}
