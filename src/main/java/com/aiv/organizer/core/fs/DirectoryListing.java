package com.aiv.organizer.core.fs;

import java.nio.file.Path;
import java.util.List;

/**
 * One step of a recursive walk: a directory and the regular files directly inside it.
 */
public record DirectoryListing(Path directory, List<String> fileNames) {
    public DirectoryListing {
        fileNames = List.copyOf(fileNames);
    }

    public String directoryName() {
        Path name = directory.getFileName();
        return name == null ? directory.toString() : name.toString();
    }
}
