package com.aiv.organizer.core.task;

import com.aiv.organizer.core.match.FormatSelection;
import com.aiv.organizer.core.match.FovRangeParseResult;
import com.aiv.organizer.core.match.FovRangeParser;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a descriptor before anything is touched on disk. Invalid FOV tokens are a problem only
 * under {@link FovPolicy#REJECT}; otherwise the procedures drop them while running.
 */
public final class TaskValidator {
    private TaskValidator() {
    }

    /** Returns the problems found; an empty list means the task may run. */
    public static List<String> validate(TaskDescriptor descriptor, FovPolicy fovPolicy) {
        boolean strictFov = fovPolicy == FovPolicy.REJECT;
        List<String> problems = new ArrayList<>();
        if (descriptor instanceof TaskDescriptor.NgSortingTask task) {
            if (task.sources1().isEmpty()) {
                problems.add("At least one NG folder (sources1) is required");
            }
            requireDirectory(task.source2(), "Source2", problems);
            requireFormats(task.formats(), problems);
        } else if (descriptor instanceof TaskDescriptor.DateCopyTask task) {
            requireDirectory(task.source(), "Source", problems);
            requireFormats(task.formats(), problems);
            if (task.count() < 1) {
                problems.add("Count must be at least 1");
            }
            if (task.randomCount() < 0) {
                problems.add("Random count must not be negative");
            }
            if (task.mode() == TaskDescriptor.DateCopyTask.Mode.IMAGE && task.fovNumbers().isEmpty()) {
                problems.add("Image mode needs FOV numbers");
            }
        } else if (descriptor instanceof TaskDescriptor.ImageCopyTask task) {
            if (task.sources().isEmpty() || task.targets().isEmpty()) {
                problems.add("Source and target paths are required");
            } else if (task.sources().size() != task.targets().size()) {
                problems.add("Every source path needs exactly one target path");
            }
            requireFormats(task.formats(), problems);
        } else if (descriptor instanceof TaskDescriptor.NgCountTask task) {
            requireDirectory(task.ngFolder(), "NG folder", problems);
        } else if (descriptor instanceof TaskDescriptor.BasicSortingTask task) {
            requireDirectory(task.source(), "Source", problems);
            requireFormats(task.formats(), problems);
            if (task.innerIdListPath() != null) {
                requireDirectory(task.innerIdListPath(), "Inner ID list path", problems);
            }
            if (strictFov) {
                checkFovExpression(task.fovExpression(), problems);
            }
        } else if (descriptor instanceof TaskDescriptor.CropTask task) {
            requireDirectory(task.source(), "Source", problems);
            requireFormats(task.formats(), problems);
            if (strictFov) {
                checkFovExpression(task.fovExpression(), problems);
            }
        } else if (descriptor instanceof TaskDescriptor.AttachFovTask task) {
            requireDirectory(task.search1(), "Search folder 1", problems);
            requireDirectory(task.search2(), "Search folder 2", problems);
            if (strictFov) {
                checkFovExpression(task.fovExpression(), problems);
            }
        } else if (descriptor instanceof TaskDescriptor.BmpToJpgTask task) {
            requireDirectory(task.source(), "Source", problems);
        } else if (descriptor instanceof TaskDescriptor.ImageTransformTask task) {
            requireDirectory(task.source(), "Source", problems);
            requireFormats(task.formats(), problems);
        }
        return problems;
    }

    private static void requireDirectory(Path path, String label, List<String> problems) {
        if (path == null) {
            problems.add(label + " path is required");
        } else if (!Files.isDirectory(path)) {
            problems.add(label + " path does not exist: " + path);
        }
    }

    private static void requireFormats(FormatSelection formats, List<String> problems) {
        if (formats.isEmpty()) {
            problems.add("Select at least one image format");
        }
    }

    private static void checkFovExpression(String expression, List<String> problems) {
        if (expression == null || expression.isBlank()) {
            return;
        }
        FovRangeParseResult parsed = FovRangeParser.parse(expression);
        if (parsed.hasRejectedTokens()) {
            problems.add("Invalid FOV numbers: " + String.join(", ", parsed.rejectedTokens()));
        }
    }
}
