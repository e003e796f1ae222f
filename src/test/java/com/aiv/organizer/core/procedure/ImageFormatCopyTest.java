package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.match.FormatSelection;
import com.aiv.organizer.core.task.RecordingListener;
import com.aiv.organizer.core.task.TaskDescriptor.ImageCopyTask;
import com.aiv.organizer.core.task.TaskRunner;
import com.aiv.organizer.core.task.TaskState;
import com.aiv.organizer.logging.TaskFailureLog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageFormatCopyTest {

    private static final Logger LOGGER = Logger.getLogger(ImageFormatCopyTest.class.getName());

    @TempDir
    Path tempDir;

    @Test
    void copiesEachSourceIntoItsPairedTarget() throws IOException {
        Path first = Files.createDirectories(tempDir.resolve("in1"));
        Path second = Files.createDirectories(tempDir.resolve("in2"));
        Files.writeString(first.resolve("x.png"), "x");
        Files.writeString(first.resolve("y.bmp"), "y");
        Files.writeString(second.resolve("z.png"), "z");
        Path out1 = tempDir.resolve("out1");
        Path out2 = tempDir.resolve("out2");
        ImageCopyTask task = new ImageCopyTask(List.of(first, second), List.of(out1, out2), FormatSelection.of(".png"));
        RecordingListener listener = new RecordingListener();

        TaskState state = new TaskRunner(task, listener, LOGGER,
            new TaskFailureLog(tempDir.resolve("failures.csv")), 2, 4096).run();

        assertEquals(TaskState.COMPLETED, state);
        assertTrue(Files.exists(out1.resolve("x.png")));
        assertFalse(Files.exists(out1.resolve("y.bmp")));
        assertTrue(Files.exists(out2.resolve("z.png")));
        assertTrue(listener.summary().contains("Paths: 2, images: 2, failed: 0"), listener.summary());
    }
}
