package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.fs.FolderScanner;
import com.aiv.organizer.core.fs.IgnoredFolders;
import com.aiv.organizer.core.match.IdentifierMatcher;
import com.aiv.organizer.core.task.BatchOutcome;
import com.aiv.organizer.core.task.ProgressState;
import com.aiv.organizer.core.task.TaskContext;
import com.aiv.organizer.core.task.TaskDescriptor.BasicSortingTask;
import com.aiv.organizer.core.task.WorkItem;
import com.aiv.organizer.core.transfer.FileTransfers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Flattens the images of selected inner-ID folders into one target folder, prefixing every file
 * with its folder name. With a FOV expression only the matching captures are taken.
 */
public final class BasicSorting implements Procedure<BasicSortingTask> {

    @Override
    public ProcedureOutcome run(BasicSortingTask task, TaskContext context) throws IOException {
        Set<String> fovNumbers = Summaries.fovFilter(context, task.fovExpression());
        FolderScanner scanner = context.scanner();
        Set<String> innerIds = resolveInnerIds(task, scanner, context);
        if (innerIds.isEmpty()) {
            return Summaries.nothingToDo(context, "No valid Inner ID.");
        }
        context.log("Inner IDs: " + innerIds.size());
        if (fovNumbers != null) {
            context.log("FOV numbers: " + String.join(", ", fovNumbers));
        }

        FileTransfers transfers = context.transfers();
        List<WorkItem> items = new ArrayList<>();
        int folders = 0;
        for (String innerId : innerIds) {
            if (context.isCancelled()) {
                return Summaries.stopped(context, "Folders: " + folders + ", images: 0");
            }
            Path folder = task.source().resolve(innerId);
            if (!Files.isDirectory(folder)) {
                context.log("Folder '" + innerId + "' does not exist in the source path.");
                continue;
            }
            int before = items.size();
            for (String name : scanner.listMatchingFiles(folder, task.formats())) {
                if (fovNumbers != null && !fovNumbers.contains(IdentifierMatcher.extractNumericPrefix(name))) {
                    continue;
                }
                Path source = folder.resolve(name);
                Path destination = task.target().resolve(innerId + "_" + name);
                items.add(WorkItem.of(source.toString(), () -> transfers.copyFileChunked(source, destination)));
            }
            if (items.size() == before) {
                context.log("No matching file in folder '" + innerId + "'.");
            } else {
                folders++;
            }
        }

        if (items.isEmpty()) {
            return Summaries.nothingToDo(context, fovNumbers != null
                ? "No image matches the selected FOV numbers."
                : "No image matches the selected formats.");
        }
        Files.createDirectories(task.target());
        context.log("Images to copy: " + items.size());
        BatchOutcome outcome = context.newExecutor().execute(items, ProgressState.of(items.size()));
        return Summaries.finish(context, outcome, "Folders: " + folders
            + ", images: " + outcome.succeeded()
            + ", failed: " + outcome.failed());
    }

    /**
     * Inner IDs from the listing folder (two levels deep in double-path mode), else the single
     * manual ID, else the subfolders of the source itself.
     */
    static Set<String> resolveInnerIds(BasicSortingTask task, FolderScanner scanner, TaskContext context) {
        Set<String> ids = new LinkedHashSet<>();
        Path listPath = task.innerIdListPath();
        if (listPath != null) {
            if (task.doublePath()) {
                for (String code : scanner.listImmediateSubfolders(listPath, IgnoredFolders.DEFAULT)) {
                    ids.addAll(scanner.listImmediateSubfolders(listPath.resolve(code), IgnoredFolders.DEFAULT));
                }
            } else {
                ids.addAll(scanner.listImmediateSubfolders(listPath, IgnoredFolders.DEFAULT));
            }
            context.log("Inner IDs read from " + listPath);
        } else if (task.innerId() != null && !task.innerId().isBlank()) {
            ids.add(task.innerId().trim());
        } else {
            ids.addAll(scanner.listImmediateSubfolders(task.source(), IgnoredFolders.DEFAULT));
            context.log("No Inner ID list or Inner ID given; using the folders of " + task.source());
        }
        return ids;
    }
}
