package com.aiv.organizer.core.fs;

import com.aiv.organizer.core.match.FormatSelection;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Enumerates sample folders and image files on disk. Folders that vanish or cannot be read
 * are reported to the error sink and skipped; scanning never aborts on a single entry.
 */
public final class FolderScanner {
    private final Consumer<String> errorSink;

    public FolderScanner(Consumer<String> errorSink) {
        this.errorSink = Objects.requireNonNull(errorSink, "errorSink");
    }

    /**
     * Names of the folders directly under {@code path}, sorted, minus the ignored names.
     */
    public List<String> listImmediateSubfolders(Path path, Set<String> ignoreNames) {
        List<String> folders = new ArrayList<>();
        List<Path> children = readChildren(path);
        for (Path child : children) {
            if (!Files.isDirectory(child)) {
                continue;
            }
            String name = child.getFileName().toString();
            if (IgnoredFolders.isIgnored(name, ignoreNames)) {
                continue;
            }
            folders.add(name);
        }
        return folders;
    }

    /**
     * Names of the regular files directly under {@code folder} that pass the format selection.
     */
    public List<String> listMatchingFiles(Path folder, FormatSelection formats) {
        List<String> files = new ArrayList<>();
        for (String name : listFiles(folder)) {
            if (formats.accepts(name)) {
                files.add(name);
            }
        }
        return files;
    }

    public List<String> listFiles(Path folder) {
        List<String> files = new ArrayList<>();
        for (Path child : readChildren(folder)) {
            if (Files.isRegularFile(child)) {
                files.add(child.getFileName().toString());
            }
        }
        return files;
    }

    /**
     * Lazily walks {@code root} depth-first. Ignored folders are pruned, so nothing beneath them
     * is read. Symbolic links to directories are not followed, which keeps the walk finite.
     * Each call starts a fresh walk.
     */
    public Stream<DirectoryListing> walkRecursive(Path root, Set<String> ignoreNames) {
        Iterator<DirectoryListing> iterator = new WalkIterator(root, ignoreNames);
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
            false
        );
    }

    private List<Path> readChildren(Path folder) {
        List<Path> children = new ArrayList<>();
        if (folder == null || !Files.isDirectory(folder)) {
            errorSink.accept("Folder not found: " + folder);
            return children;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (Path child : stream) {
                children.add(child);
            }
        } catch (IOException | SecurityException e) {
            errorSink.accept("Could not read folder " + folder + ": " + e.getMessage());
            children.clear();
        }
        children.sort((a, b) -> a.getFileName().toString().compareToIgnoreCase(b.getFileName().toString()));
        return children;
    }

    private final class WalkIterator implements Iterator<DirectoryListing> {
        private final Deque<Path> pending = new ArrayDeque<>();
        private final Set<String> ignoreNames;

        WalkIterator(Path root, Set<String> ignoreNames) {
            this.ignoreNames = ignoreNames;
            pending.push(root);
        }

        @Override
        public boolean hasNext() {
            return !pending.isEmpty();
        }

        @Override
        public DirectoryListing next() {
            if (pending.isEmpty()) {
                throw new NoSuchElementException();
            }
            Path directory = pending.pop();
            List<String> files = new ArrayList<>();
            List<Path> subfolders = new ArrayList<>();
            for (Path child : readChildren(directory)) {
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    if (!IgnoredFolders.isIgnored(child.getFileName().toString(), ignoreNames)) {
                        subfolders.add(child);
                    }
                } else if (Files.isRegularFile(child)) {
                    files.add(child.getFileName().toString());
                }
            }
            for (int i = subfolders.size() - 1; i >= 0; i--) {
                pending.push(subfolders.get(i));
            }
            return new DirectoryListing(directory, files);
        }
    }
}
