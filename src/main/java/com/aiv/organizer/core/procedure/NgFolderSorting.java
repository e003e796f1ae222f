package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.fs.FolderScanner;
import com.aiv.organizer.core.fs.IgnoredFolders;
import com.aiv.organizer.core.task.BatchOutcome;
import com.aiv.organizer.core.task.ProgressState;
import com.aiv.organizer.core.task.TaskContext;
import com.aiv.organizer.core.task.TaskDescriptor.NgSortingTask;
import com.aiv.organizer.core.task.WorkItem;
import com.aiv.organizer.core.transfer.FileTransfers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Copies the images of every inner ID found both among the NG folders ({@code sources1}) and in
 * the original image root ({@code source2}) into {@code target/<id>}. Destinations that already
 * exist are left alone, so a re-run copies nothing new.
 */
public final class NgFolderSorting implements Procedure<NgSortingTask> {

    @Override
    public ProcedureOutcome run(NgSortingTask task, TaskContext context) throws IOException {
        context.log("Sources1: " + task.sources1());
        context.log("Source2: " + task.source2());
        context.log("Target: " + task.target());
        context.log("Formats: " + task.formats().tokens());

        FolderScanner scanner = context.scanner();
        Set<String> matched = innerIdsOf(task.sources1(), context);
        matched.retainAll(scanner.listImmediateSubfolders(task.source2(), IgnoredFolders.DEFAULT));
        if (matched.isEmpty()) {
            return Summaries.nothingToDo(context, "No Inner ID exists in both sources1 and source2. Matched Inner IDs: 0");
        }
        context.log("Matched Inner IDs: " + matched.size());
        Files.createDirectories(task.target());

        FileTransfers transfers = context.transfers();
        List<WorkItem> items = new ArrayList<>();
        int existing = 0;
        for (String innerId : matched) {
            if (context.isCancelled()) {
                return Summaries.stopped(context, "Matched Inner IDs: " + matched.size() + ", copied: 0");
            }
            Path sourceFolder = task.source2().resolve(innerId);
            Path targetFolder = task.target().resolve(innerId);
            for (String name : scanner.listMatchingFiles(sourceFolder, task.formats())) {
                Path destination = targetFolder.resolve(name);
                if (Files.exists(destination)) {
                    context.log("File already exists, skipping: " + destination);
                    existing++;
                    continue;
                }
                if (!Files.isDirectory(targetFolder) && !createFolder(targetFolder, context)) {
                    break;
                }
                Path source = sourceFolder.resolve(name);
                items.add(WorkItem.of(source.toString(), () -> transfers.copyFileChunked(source, destination)));
            }
        }

        if (items.isEmpty()) {
            return Summaries.nothingToDo(context, "Matched Inner IDs: " + matched.size()
                + ". No image to copy (already present: " + existing + ").");
        }
        context.log("Images to copy: " + items.size());
        BatchOutcome outcome = context.newExecutor().execute(items, ProgressState.of(items.size()));
        return Summaries.finish(context, outcome, "Matched Inner IDs: " + matched.size()
            + ", copied: " + outcome.succeeded()
            + ", already present: " + existing
            + ", failed: " + outcome.failed());
    }

    private static Set<String> innerIdsOf(List<Path> sources, TaskContext context) {
        Set<String> ids = new TreeSet<>();
        for (Path source : sources) {
            if (!Files.isDirectory(source)) {
                context.log("Source path does not exist: " + source);
                continue;
            }
            Path name = source.toAbsolutePath().normalize().getFileName();
            if (name == null || IgnoredFolders.isIgnored(name.toString(), IgnoredFolders.DEFAULT)) {
                continue;
            }
            ids.add(name.toString());
        }
        return ids;
    }

    private static boolean createFolder(Path folder, TaskContext context) {
        try {
            Files.createDirectories(folder);
            context.log("Created target folder: " + folder);
            return true;
        } catch (IOException e) {
            context.log("Could not create target folder " + folder + ": " + e.getMessage());
            return false;
        }
    }
}
