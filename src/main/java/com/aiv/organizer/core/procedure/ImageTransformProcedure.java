package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.image.ImageConverter;
import com.aiv.organizer.core.task.BatchOutcome;
import com.aiv.organizer.core.task.ProgressState;
import com.aiv.organizer.core.task.TaskContext;
import com.aiv.organizer.core.task.TaskDescriptor.ImageTransformTask;
import com.aiv.organizer.core.task.WorkItem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Resizes, flips or rotates the eligible files directly inside the source folder.
 */
public final class ImageTransformProcedure implements Procedure<ImageTransformTask> {

    @Override
    public ProcedureOutcome run(ImageTransformTask task, TaskContext context) throws IOException {
        List<String> names = context.scanner().listMatchingFiles(task.source(), task.formats());
        if (names.isEmpty()) {
            return Summaries.nothingToDo(context, "No image matches the selected formats.");
        }
        Files.createDirectories(task.target());
        context.log("Transform: " + task.transform().label());

        ImageConverter converter = new ImageConverter(context.logger());
        List<WorkItem> items = new ArrayList<>(names.size());
        for (String name : names) {
            Path source = task.source().resolve(name);
            Path destination = task.target().resolve(name);
            items.add(WorkItem.of(source.toString(), () -> converter.convertFormat(source, destination, task.transform())));
        }
        BatchOutcome outcome = context.newExecutor().execute(items, ProgressState.of(items.size()));
        return Summaries.finish(context, outcome, "Images: " + outcome.succeeded()
            + ", failed: " + outcome.failed());
    }
}
