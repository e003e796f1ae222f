package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.fs.DirectoryListing;
import com.aiv.organizer.core.fs.FolderScanner;
import com.aiv.organizer.core.fs.IgnoredFolders;
import com.aiv.organizer.core.image.FovImageAttacher;
import com.aiv.organizer.core.image.FovImageAttacher.AttachKey;
import com.aiv.organizer.core.match.IdentifierMatcher;
import com.aiv.organizer.core.task.BatchOutcome;
import com.aiv.organizer.core.task.ProgressState;
import com.aiv.organizer.core.task.TaskContext;
import com.aiv.organizer.core.task.TaskDescriptor.AttachFovTask;
import com.aiv.organizer.core.task.WorkItem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Pairs FOV captures of the same sample found in two trees and writes each pair side by side.
 * Samples are matched on the last characters of their folder names.
 */
public final class AttachFov implements Procedure<AttachFovTask> {
    static final Comparator<AttachKey> KEY_ORDER = Comparator.comparing(AttachKey::sampleKey)
        .thenComparing(AttachKey::fovNumber, Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder()));

    @Override
    public ProcedureOutcome run(AttachFovTask task, TaskContext context) throws IOException {
        Set<String> fovNumbers = Summaries.fovFilter(context, task.fovExpression());
        FolderScanner scanner = context.scanner();
        Map<AttachKey, List<Path>> first = index(scanner, task.search1());
        Map<AttachKey, List<Path>> second = index(scanner, task.search2());

        FovImageAttacher attacher = new FovImageAttacher(context.logger());
        List<WorkItem> items = new ArrayList<>();
        for (Map.Entry<AttachKey, List<Path>> entry : first.entrySet()) {
            AttachKey key = entry.getKey();
            List<Path> others = second.get(key);
            if (others == null || (fovNumbers != null && !fovNumbers.contains(key.fovNumber()))) {
                continue;
            }
            List<Path> mine = entry.getValue();
            int pairs = Math.min(mine.size(), others.size());
            for (int i = 0; i < pairs; i++) {
                Path left = mine.get(i);
                Path right = others.get(i);
                Path destination = task.target().resolve(FovImageAttacher.outputName(key, i));
                items.add(WorkItem.of(left.toString(), () -> attacher.attach(left, right, key, destination)));
            }
        }

        if (items.isEmpty()) {
            return Summaries.nothingToDo(context, "No FOV image found in both search folders.");
        }
        Files.createDirectories(task.target());
        context.log("Pairs to attach: " + items.size());
        BatchOutcome outcome = context.newExecutor().execute(items, ProgressState.of(items.size()));
        return Summaries.finish(context, outcome, "Attached pairs: " + outcome.succeeded()
            + ", failed: " + outcome.failed());
    }

    /**
     * {@code fov*.jpg} files below {@code root}, keyed by sample and FOV number. Each list keeps the
     * walk order, so equal positions in two trees pair up.
     */
    static Map<AttachKey, List<Path>> index(FolderScanner scanner, Path root) {
        Map<AttachKey, List<Path>> index = new TreeMap<>(KEY_ORDER);
        try (Stream<DirectoryListing> walk = scanner.walkRecursive(root, IgnoredFolders.DEFAULT)) {
            Iterator<DirectoryListing> listings = walk.iterator();
            while (listings.hasNext()) {
                DirectoryListing listing = listings.next();
                String sampleKey = IdentifierMatcher.sampleKey(listing.directoryName());
                for (String name : listing.fileNames()) {
                    if (!IdentifierMatcher.startsWithFovTag(name)
                            || !name.toLowerCase(Locale.ROOT).endsWith(".jpg")) {
                        continue;
                    }
                    String fovNumber = IdentifierMatcher.extractFovNumber(name);
                    if (fovNumber == null) {
                        continue;
                    }
                    index.computeIfAbsent(new AttachKey(sampleKey, fovNumber), k -> new ArrayList<>())
                        .add(listing.directory().resolve(name));
                }
            }
        }
        return index;
    }
}
