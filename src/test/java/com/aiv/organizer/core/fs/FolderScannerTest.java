package com.aiv.organizer.core.fs;

import com.aiv.organizer.core.match.FormatSelection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FolderScannerTest {

    @TempDir
    Path tempDir;

    private final List<String> errors = new ArrayList<>();
    private final FolderScanner scanner = new FolderScanner(errors::add);

    @Test
    void listsSubfoldersSortedWithoutIgnoredNames() throws IOException {
        Files.createDirectories(tempDir.resolve("S002"));
        Files.createDirectories(tempDir.resolve("S001"));
        Files.createDirectories(tempDir.resolve("OK"));
        Files.createDirectories(tempDir.resolve("thumbnail"));
        Files.writeString(tempDir.resolve("notes.txt"), "x");

        List<String> folders = scanner.listImmediateSubfolders(tempDir, IgnoredFolders.DEFAULT);

        assertEquals(List.of("S001", "S002"), folders);
        assertTrue(errors.isEmpty());
    }

    @Test
    void listsOnlyFilesAcceptedByTheFormats() throws IOException {
        Files.writeString(tempDir.resolve("fov1_a.jpg"), "x");
        Files.writeString(tempDir.resolve("org.jpg"), "x");
        Files.writeString(tempDir.resolve("img.bmp"), "x");
        Files.createDirectories(tempDir.resolve("sub.bmp"));

        List<String> files = scanner.listMatchingFiles(tempDir, FormatSelection.of(".bmp", "fov_jpg"));

        assertEquals(List.of("fov1_a.jpg", "img.bmp"), files);
    }

    @Test
    void missingFolderIsReportedAndYieldsNothing() {
        Path missing = tempDir.resolve("gone");

        assertTrue(scanner.listFiles(missing).isEmpty());
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("gone"));
    }

    @Test
    void walkPrunesIgnoredFoldersAndStartsAtTheRoot() throws IOException {
        Files.createDirectories(tempDir.resolve("A/inner"));
        Files.createDirectories(tempDir.resolve("NG/deep"));
        Files.writeString(tempDir.resolve("root.bmp"), "x");
        Files.writeString(tempDir.resolve("A/a.bmp"), "x");
        Files.writeString(tempDir.resolve("A/inner/b.bmp"), "x");
        Files.writeString(tempDir.resolve("NG/deep/c.bmp"), "x");

        List<DirectoryListing> listings = scanner.walkRecursive(tempDir, IgnoredFolders.DEFAULT)
            .collect(Collectors.toList());

        assertEquals(tempDir, listings.get(0).directory());
        assertEquals(List.of("root.bmp"), listings.get(0).fileNames());
        Set<String> names = listings.stream().map(DirectoryListing::directoryName).collect(Collectors.toSet());
        assertEquals(Set.of(tempDir.getFileName().toString(), "A", "inner"), names);
    }

    @Test
    void walkDoesNotFollowDirectoryLinks() throws IOException {
        Path a = Files.createDirectories(tempDir.resolve("a"));
        Files.writeString(a.resolve("x.jpg"), "x");
        assumeTrue(link(a.resolve("l1"), tempDir) && link(a.resolve("l2"), tempDir), "symbolic links unsupported");

        List<DirectoryListing> listings = scanner.walkRecursive(tempDir, Set.of())
            .limit(100)
            .collect(Collectors.toList());

        assertEquals(2, listings.size());
        assertEquals(a, listings.get(1).directory());
        assertEquals(List.of("x.jpg"), listings.get(1).fileNames());
    }

    private static boolean link(Path link, Path target) {
        try {
            Files.createSymbolicLink(link, target);
            return true;
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            return false;
        }
    }
}
