package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.task.RecordingListener;
import com.aiv.organizer.core.task.TaskDescriptor.BmpToJpgTask;
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
import static org.junit.jupiter.api.Assertions.assertTrue;

class BmpToJpgTest {

    private static final Logger LOGGER = Logger.getLogger(BmpToJpgTest.class.getName());

    @TempDir
    Path tempDir;

    @Test
    void mirrorsTheFolderTreeAsJpeg() throws IOException {
        Path source = tempDir.resolve("bmp");
        Path sub = Files.createDirectories(source.resolve("sub"));
        bmp(source.resolve("a.bmp"));
        bmp(sub.resolve("b.BMP"));
        Files.writeString(source.resolve("c.txt"), "x");
        Path target = tempDir.resolve("jpg");
        RecordingListener listener = new RecordingListener();

        TaskState state = new TaskRunner(new BmpToJpgTask(source, target), listener, LOGGER,
            new TaskFailureLog(tempDir.resolve("failures.csv")), 2, 4096).run();

        assertEquals(TaskState.COMPLETED, state);
        assertTrue(Files.exists(target.resolve("a.jpg")));
        assertTrue(Files.exists(target.resolve("sub/b.jpg")));
        assertFalse(Files.exists(target.resolve("c.jpg")));
        assertTrue(listener.summary().contains("Converted: 2, failed: 0"), listener.summary());
    }

    @Test
    void defaultTargetIsASiblingFolder() {
        Path source = tempDir.resolve("images");

        assertEquals(tempDir.resolve("images_JPG").toAbsolutePath().normalize(),
            new BmpToJpgTask(source, null).resolvedTarget());
    }

    private static void bmp(Path path) throws IOException {
        ImageIO.write(new BufferedImage(6, 4, BufferedImage.TYPE_INT_RGB), "bmp", path.toFile());
    }
}
