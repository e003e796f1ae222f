package com.aiv.organizer.cli;

import com.aiv.organizer.core.task.FovPolicy;
import com.aiv.organizer.core.task.NgCountReport;
import com.aiv.organizer.core.task.NgCountRow;
import com.aiv.organizer.core.task.TaskDescriptor;
import com.aiv.organizer.core.task.TaskDescriptorException;
import com.aiv.organizer.core.task.TaskDescriptorReader;
import com.aiv.organizer.core.task.TaskHandle;
import com.aiv.organizer.core.task.TaskListener;
import com.aiv.organizer.core.task.TaskRunner;
import com.aiv.organizer.core.task.TaskState;
import com.aiv.organizer.logging.AppLogger;

import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line entry point: runs the task described by a JSON task file and streams its
 * progress and log lines to the console. Ctrl+C requests a stop and waits for the run to wind down.
 * With {@code --strict-fov} an invalid FOV number rejects the task instead of being skipped.
 */
public final class OrganizerTool {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILED = 1;
    static final String STRICT_FOV = "--strict-fov";

    private OrganizerTool() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Logger logger = AppLogger.get();
        boolean strict = args.length == 2 && STRICT_FOV.equals(args[0]);
        if (args.length != 1 && !strict) {
            logger.severe("Usage: organizer [" + STRICT_FOV + "] <task.json>");
            return EXIT_USAGE;
        }

        TaskDescriptor descriptor;
        try {
            descriptor = TaskDescriptorReader.read(Path.of(args[args.length - 1]));
        } catch (TaskDescriptorException e) {
            String field = e.getKey() == null ? "" : " [" + e.getKey() + "]";
            logger.log(Level.SEVERE, e.getMessage() + field);
            return EXIT_USAGE;
        }

        TaskRunner runner = new TaskRunner(descriptor, new ConsoleListener(logger), logger,
            strict ? FovPolicy.REJECT : FovPolicy.DROP);
        TaskHandle handle = runner.start();
        Thread stopHook = new Thread(() -> {
            if (!handle.isDone()) {
                handle.stop();
                awaitQuietly(handle, logger);
            }
        }, "organizer-stop");
        Runtime.getRuntime().addShutdownHook(stopHook);

        TaskState state = awaitQuietly(handle, logger);
        try {
            Runtime.getRuntime().removeShutdownHook(stopHook);
        } catch (IllegalStateException ignored) {
            // the JVM is already shutting down
        }
        return exitCode(state);
    }

    private static TaskState awaitQuietly(TaskHandle handle, Logger logger) {
        try {
            return handle.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.stop();
            logger.warning("Interrupted while waiting for the task; stop requested");
            return handle.state();
        }
    }

    static int exitCode(TaskState state) {
        return switch (state) {
            case COMPLETED, CANCELLED -> EXIT_OK;
            case REJECTED -> EXIT_USAGE;
            default -> EXIT_FAILED;
        };
    }

    /** Writes task events to the application logger. */
    static final class ConsoleListener implements TaskListener {
        private final Logger logger;
        private int lastReported = -1;

        ConsoleListener(Logger logger) {
            this.logger = logger;
        }

        @Override
        public void progress(int percent) {
            // one line per 10 percent
            int bucket = percent / 10;
            if (bucket != lastReported) {
                lastReported = bucket;
                logger.info("Progress: " + percent + "%");
            }
        }

        @Override
        public void log(String message) {
            logger.info(message);
        }

        @Override
        public void ngCount(NgCountReport report) {
            logger.info(String.format("%-20s %-30s %s", "Camera", "Defect", "Count"));
            for (NgCountRow row : report.rows()) {
                logger.info(String.format("%-20s %-30s %d", row.cameraName(), row.defectName(), row.instanceCount()));
            }
            logger.info("Total defects: " + report.totalDefects()
                + ", inspected folders: " + report.inspectedFolderCount());
        }

        @Override
        public void finished(String summary) {
            logger.info(summary);
        }
    }
}
