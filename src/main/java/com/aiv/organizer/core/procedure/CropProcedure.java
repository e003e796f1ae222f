package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.fs.DirectoryListing;
import com.aiv.organizer.core.fs.IgnoredFolders;
import com.aiv.organizer.core.image.AnnotationCropper;
import com.aiv.organizer.core.image.ImageCropper;
import com.aiv.organizer.core.match.IdentifierMatcher;
import com.aiv.organizer.core.task.BatchOutcome;
import com.aiv.organizer.core.task.ProgressState;
import com.aiv.organizer.core.task.TaskContext;
import com.aiv.organizer.core.task.TaskDescriptor.CropTask;
import com.aiv.organizer.core.task.WorkItem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Crops every eligible image below the source folder into the target folder. An image with a
 * same-named {@code .json} sidecar is cropped together with its annotation.
 */
public final class CropProcedure implements Procedure<CropTask> {
    static final String SIDECAR_EXTENSION = ".json";
    static final String DEBUG_SUFFIX = "_debug.png";

    @Override
    public ProcedureOutcome run(CropTask task, TaskContext context) throws IOException {
        Set<String> fovNumbers = Summaries.fovFilter(context, task.fovExpression());
        context.log("Cropping area: " + task.box());

        ImageCropper cropper = new ImageCropper(context.logger());
        AnnotationCropper annotationCropper = new AnnotationCropper(cropper, context.logger());
        List<WorkItem> items = new ArrayList<>();
        Set<String> planned = new HashSet<>();
        int annotated = 0;

        try (Stream<DirectoryListing> walk = context.scanner().walkRecursive(task.source(), IgnoredFolders.DEFAULT)) {
            Iterator<DirectoryListing> listings = walk.iterator();
            while (listings.hasNext()) {
                if (context.isCancelled()) {
                    return Summaries.stopped(context, "Cropped: 0");
                }
                DirectoryListing listing = listings.next();
                boolean atRoot = listing.directory().equals(task.source());
                for (String name : listing.fileNames()) {
                    if (!task.formats().accepts(name)) {
                        continue;
                    }
                    if (fovNumbers != null && !fovNumbers.contains(IdentifierMatcher.extractNumericPrefix(name))) {
                        continue;
                    }
                    String outputName = atRoot ? name : listing.directoryName() + "_" + name;
                    if (!planned.add(outputName)) {
                        context.log("Duplicate output name, skipping: " + listing.directory().resolve(name));
                        continue;
                    }
                    Path source = listing.directory().resolve(name);
                    Path destination = task.target().resolve(outputName);
                    Path sidecar = listing.directory().resolve(IdentifierMatcher.stripExtension(name) + SIDECAR_EXTENSION);
                    if (Files.isRegularFile(sidecar)) {
                        String base = IdentifierMatcher.stripExtension(outputName);
                        Path sidecarOut = task.target().resolve(base + SIDECAR_EXTENSION);
                        Path debug = task.debugOverlay() == null ? null : task.debugOverlay().resolve(base + DEBUG_SUFFIX);
                        items.add(WorkItem.of(source.toString(), () -> annotationCropper.cropImageAndJsonPair(
                            source, destination, sidecar, sidecarOut, task.box(), debug)));
                        annotated++;
                    } else {
                        items.add(WorkItem.of(source.toString(), () -> cropper.cropImage(source, destination, task.box())));
                    }
                }
            }
        }

        if (items.isEmpty()) {
            return Summaries.nothingToDo(context, "No image matches the selected formats.");
        }
        Files.createDirectories(task.target());
        if (task.debugOverlay() != null) {
            Files.createDirectories(task.debugOverlay());
        }
        context.log("Images to crop: " + items.size() + " (with annotation: " + annotated + ")");
        BatchOutcome outcome = context.newExecutor().execute(items, ProgressState.of(items.size()));
        return Summaries.finish(context, outcome, "Cropped: " + outcome.succeeded()
            + ", skipped: " + outcome.skipped()
            + ", failed: " + outcome.failed());
    }
}
