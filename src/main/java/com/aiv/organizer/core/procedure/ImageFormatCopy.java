package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.fs.FolderScanner;
import com.aiv.organizer.core.task.BatchOutcome;
import com.aiv.organizer.core.task.ProgressState;
import com.aiv.organizer.core.task.TaskContext;
import com.aiv.organizer.core.task.TaskDescriptor.ImageCopyTask;
import com.aiv.organizer.core.task.WorkItem;
import com.aiv.organizer.core.transfer.FileTransfers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies the eligible files of each source folder into its paired target folder, keeping names.
 */
public final class ImageFormatCopy implements Procedure<ImageCopyTask> {

    @Override
    public ProcedureOutcome run(ImageCopyTask task, TaskContext context) {
        int pairs = Math.min(task.sources().size(), task.targets().size());
        if (task.sources().size() != task.targets().size()) {
            context.log("Source and target lists differ in length; using the first " + pairs + " pair(s).");
        }

        FolderScanner scanner = context.scanner();
        FileTransfers transfers = context.transfers();
        List<WorkItem> items = new ArrayList<>();
        int paths = 0;
        for (int i = 0; i < pairs; i++) {
            if (context.isCancelled()) {
                return Summaries.stopped(context, "Paths: " + paths + ", images: 0");
            }
            Path source = task.sources().get(i);
            Path target = task.targets().get(i);
            if (!Files.isDirectory(source)) {
                context.log("Source path does not exist: " + source);
                continue;
            }
            List<String> names = scanner.listMatchingFiles(source, task.formats());
            if (names.isEmpty()) {
                continue;
            }
            try {
                Files.createDirectories(target);
            } catch (IOException e) {
                context.log("Could not create target path " + target + ": " + e.getMessage());
                continue;
            }
            paths++;
            for (String name : names) {
                Path from = source.resolve(name);
                Path to = target.resolve(name);
                items.add(WorkItem.of(from.toString(), () -> transfers.copyFileChunked(from, to)));
            }
        }

        if (items.isEmpty()) {
            return Summaries.nothingToDo(context, "No image matches the selected formats.");
        }
        context.log("Images to copy: " + items.size());
        BatchOutcome outcome = context.newExecutor().execute(items, ProgressState.of(items.size()));
        return Summaries.finish(context, outcome, "Paths: " + paths
            + ", images: " + outcome.succeeded()
            + ", failed: " + outcome.failed());
    }
}
