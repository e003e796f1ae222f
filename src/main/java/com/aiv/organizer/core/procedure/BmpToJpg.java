package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.fs.DirectoryListing;
import com.aiv.organizer.core.image.ImageConverter;
import com.aiv.organizer.core.match.IdentifierMatcher;
import com.aiv.organizer.core.task.BatchOutcome;
import com.aiv.organizer.core.task.ProgressState;
import com.aiv.organizer.core.task.TaskContext;
import com.aiv.organizer.core.task.TaskDescriptor.BmpToJpgTask;
import com.aiv.organizer.core.task.WorkItem;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Converts every {@code .bmp} below the source into a JPEG at the same relative path under the
 * target.
 */
public final class BmpToJpg implements Procedure<BmpToJpgTask> {

    @Override
    public ProcedureOutcome run(BmpToJpgTask task, TaskContext context) {
        Path source = task.source();
        Path target = task.resolvedTarget();
        context.log("Source: " + source);
        context.log("Target: " + target);

        ImageConverter converter = new ImageConverter(context.logger());
        List<WorkItem> items = new ArrayList<>();
        try (Stream<DirectoryListing> walk = context.scanner().walkRecursive(source, Set.of())) {
            Iterator<DirectoryListing> listings = walk.iterator();
            while (listings.hasNext()) {
                if (context.isCancelled()) {
                    return Summaries.stopped(context, "Converted: 0");
                }
                DirectoryListing listing = listings.next();
                Path outputFolder = target.resolve(source.relativize(listing.directory()).toString());
                for (String name : listing.fileNames()) {
                    if (!name.toLowerCase(Locale.ROOT).endsWith(".bmp")) {
                        continue;
                    }
                    Path from = listing.directory().resolve(name);
                    Path to = outputFolder.resolve(IdentifierMatcher.stripExtension(name) + ".jpg");
                    items.add(WorkItem.of(from.toString(), () -> {
                        Files.createDirectories(outputFolder);
                        return converter.bmpToJpg(from, to);
                    }));
                }
            }
        }

        if (items.isEmpty()) {
            return Summaries.nothingToDo(context, "No BMP file under " + source + ".");
        }
        context.log("Images to convert: " + items.size());
        BatchOutcome outcome = context.newExecutor().execute(items, ProgressState.of(items.size()));
        return Summaries.finish(context, outcome, "Converted: " + outcome.succeeded()
            + ", failed: " + outcome.failed()
            + ", output: " + target);
    }
}
