package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.fs.FolderScanner;
import com.aiv.organizer.core.match.IdentifierMatcher;
import com.aiv.organizer.core.task.BatchOutcome;
import com.aiv.organizer.core.task.ProgressState;
import com.aiv.organizer.core.task.TaskContext;
import com.aiv.organizer.core.task.TaskDescriptor.DateCopyTask;
import com.aiv.organizer.core.task.TaskDescriptor.DateCopyTask.Mode;
import com.aiv.organizer.core.task.TaskDescriptor.DateCopyTask.SelectionPolicy;
import com.aiv.organizer.core.task.WorkItem;
import com.aiv.organizer.core.transfer.FileTransfers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Copies the sample folders modified since a given time, either whole (folder mode) or only their
 * images of selected FOV numbers, renamed {@code <folder>_<fov><ext>} (image mode).
 */
public final class DateBasedCopy implements Procedure<DateCopyTask> {
    private static final DateTimeFormatter SINCE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public ProcedureOutcome run(DateCopyTask task, TaskContext context) throws IOException {
        context.log("Mode: " + task.mode().name().toLowerCase(Locale.ROOT) + ", selection: " + task.policy());
        context.log("Specified date and time: " + SINCE_FORMAT.format(task.since()));

        List<Path> eligible = eligibleFolders(task, context);
        if (eligible.isEmpty()) {
            return Summaries.nothingToDo(context, "No folder modified since " + SINCE_FORMAT.format(task.since()) + ".");
        }
        List<Path> selected = select(eligible, task);
        context.log("Folders selected: " + selected.size() + " of " + eligible.size());
        if (selected.isEmpty()) {
            return Summaries.nothingToDo(context, "No folder selected.");
        }
        Files.createDirectories(task.target());

        if (task.mode() == Mode.FOLDER) {
            return copyFolders(selected, task, context);
        }
        return copyImages(selected, task, context);
    }

    private ProcedureOutcome copyFolders(List<Path> selected, DateCopyTask task, TaskContext context) {
        FileTransfers transfers = context.transfers();
        List<WorkItem> items = new ArrayList<>();
        for (Path folder : selected) {
            Path destination = task.target().resolve(folder.getFileName().toString());
            context.log("Source folder: " + folder + " -> " + destination);
            items.add(WorkItem.of(folder.toString(), () -> transfers.copyFolderFiltered(folder, destination, task.formats())));
        }
        BatchOutcome outcome = context.newExecutor().execute(items, ProgressState.of(items.size()));
        return Summaries.finish(context, outcome, "Folders: " + outcome.succeeded()
            + ", images: " + outcome.transferred()
            + ", failed: " + outcome.failed());
    }

    private ProcedureOutcome copyImages(List<Path> selected, DateCopyTask task, TaskContext context) {
        if (task.fovNumbers().isEmpty()) {
            return Summaries.nothingToDo(context, "Image mode needs FOV numbers.");
        }
        FolderScanner scanner = context.scanner();
        FileTransfers transfers = context.transfers();
        ProgressState folderProgress = ProgressState.of(selected.size());
        BatchOutcome total = BatchOutcome.empty();
        int folders = 0;
        int existing = 0;

        for (Path folder : selected) {
            if (context.isCancelled()) {
                return Summaries.stopped(context, imageCounts(folders, total, existing));
            }
            String folderName = folder.getFileName().toString();
            List<WorkItem> items = new ArrayList<>();
            Set<String> planned = new HashSet<>();
            for (String name : scanner.listMatchingFiles(folder, task.formats())) {
                String fov = IdentifierMatcher.extractNumericPrefix(name);
                if (fov == null) {
                    context.log("Unexpected file name format: " + name);
                    continue;
                }
                if (!task.fovNumbers().contains(fov)) {
                    continue;
                }
                String newName = folderName + "_" + fov + IdentifierMatcher.extension(name);
                Path destination = task.target().resolve(newName);
                if (!planned.add(newName) || Files.exists(destination)) {
                    context.log("File already exists, skipping: " + destination);
                    existing++;
                    continue;
                }
                Path source = folder.resolve(name);
                items.add(WorkItem.of(source.toString(), () -> transfers.copyFileChunked(source, destination)));
            }

            if (items.isEmpty()) {
                context.log("No image matching the FOV numbers in " + folder);
                context.markRunning();
            } else {
                context.log("Copying " + items.size() + " image(s) from " + folder);
                BatchOutcome outcome = context.newExecutor().execute(items, ProgressState.silent(items.size()));
                total = total.plus(outcome);
                if (outcome.cancelled()) {
                    return Summaries.stopped(context, imageCounts(folders, total, existing));
                }
            }
            folders++;
            context.progress(folderProgress.complete());
        }
        return Summaries.completed(context, imageCounts(folders, total, existing));
    }

    private static String imageCounts(int folders, BatchOutcome total, int existing) {
        return "Folders: " + folders
            + ", images: " + total.succeeded()
            + ", already present: " + existing
            + ", failed: " + total.failed();
    }

    /** Immediate subfolders modified at or after {@code since}, oldest first. */
    private static List<Path> eligibleFolders(DateCopyTask task, TaskContext context) {
        List<Candidate> candidates = new ArrayList<>();
        for (String name : context.scanner().listImmediateSubfolders(task.source(), Set.of())) {
            Path folder = task.source().resolve(name);
            try {
                FileTime modified = Files.getLastModifiedTime(folder);
                LocalDateTime local = LocalDateTime.ofInstant(modified.toInstant(), ZoneId.systemDefault());
                if (!local.isBefore(task.since())) {
                    candidates.add(new Candidate(folder, modified));
                }
            } catch (IOException e) {
                context.log("Could not read modification time of " + folder + ": " + e.getMessage());
            }
        }
        candidates.sort(Comparator.comparing(Candidate::modified).thenComparing(c -> c.folder().getFileName().toString()));
        List<Path> folders = new ArrayList<>(candidates.size());
        candidates.forEach(c -> folders.add(c.folder()));
        return folders;
    }

    static List<Path> select(List<Path> sorted, DateCopyTask task) {
        int count = task.count();
        SelectionPolicy policy = task.policy();
        if (policy == SelectionPolicy.STRONG_RANDOM) {
            if (sorted.size() <= count) {
                return sorted;
            }
            List<Integer> indexes = new ArrayList<>(sorted.size());
            for (int i = 0; i < sorted.size(); i++) {
                indexes.add(i);
            }
            Collections.shuffle(indexes, task.random());
            List<Integer> picked = new ArrayList<>(indexes.subList(0, count));
            Collections.sort(picked);
            List<Path> sample = new ArrayList<>(count);
            picked.forEach(i -> sample.add(sorted.get(i)));
            return sample;
        }
        if (policy == SelectionPolicy.CONDITIONAL_RANDOM) {
            int stride = SelectionPolicy.strideFor(task.mode(), task.randomCount());
            List<Path> picked = new ArrayList<>();
            for (int index = 0; index < sorted.size() && picked.size() < count; index += stride) {
                picked.add(sorted.get(index));
            }
            return picked;
        }
        return sorted.subList(0, Math.min(count, sorted.size()));
    }

    private record Candidate(Path folder, FileTime modified) {
    }
}
