package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.image.ImageTransform;
import com.aiv.organizer.core.match.FormatSelection;
import com.aiv.organizer.core.task.OperationKind;
import com.aiv.organizer.core.task.RecordingListener;
import com.aiv.organizer.core.task.TaskDescriptor.ImageTransformTask;
import com.aiv.organizer.core.task.TaskRunner;
import com.aiv.organizer.core.task.TaskState;
import com.aiv.organizer.logging.TaskFailureLog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageTransformProcedureTest {

    private static final Logger LOGGER = Logger.getLogger(ImageTransformProcedureTest.class.getName());

    @TempDir
    Path tempDir;

    @Test
    void rotatesEveryImageOfTheFolderKeepingNames() throws IOException {
        Path source = Files.createDirectories(tempDir.resolve("in"));
        ImageIO.write(new BufferedImage(8, 4, BufferedImage.TYPE_INT_RGB), "png", source.resolve("a.png").toFile());
        Files.createDirectories(source.resolve("nested"));
        ImageIO.write(new BufferedImage(8, 4, BufferedImage.TYPE_INT_RGB), "png",
            source.resolve("nested/b.png").toFile());
        Path target = tempDir.resolve("out");
        ImageTransformTask task = new ImageTransformTask(source, target, FormatSelection.of(".png"),
            new ImageTransform.Rotate(90));
        RecordingListener listener = new RecordingListener();

        TaskState state = new TaskRunner(task, listener, LOGGER,
            new TaskFailureLog(tempDir.resolve("failures.csv")), 2, 4096).run();

        assertEquals(TaskState.COMPLETED, state);
        assertEquals(OperationKind.ROTATE, task.kind());
        BufferedImage rotated = ImageIO.read(target.resolve("a.png").toFile());
        assertEquals(4, rotated.getWidth());
        assertEquals(8, rotated.getHeight());
        assertFalse(Files.exists(target.resolve("b.png")));
        assertTrue(listener.summary().startsWith("Rotate completed."), listener.summary());
    }

    @Test
    void jpegConversionIsNotATransformTask() {
        assertThrows(IllegalArgumentException.class, () -> new ImageTransformTask(tempDir, tempDir,
            FormatSelection.of(".bmp"), new ImageTransform.ToJpeg()));
    }
}
