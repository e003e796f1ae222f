package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.image.CropBox;
import com.aiv.organizer.core.match.FormatSelection;
import com.aiv.organizer.core.task.RecordingListener;
import com.aiv.organizer.core.task.TaskDescriptor.CropTask;
import com.aiv.organizer.core.task.TaskRunner;
import com.aiv.organizer.core.task.TaskState;
import com.aiv.organizer.logging.TaskFailureLog;
import org.json.JSONObject;
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

class CropProcedureTest {

    private static final Logger LOGGER = Logger.getLogger(CropProcedureTest.class.getName());

    @TempDir
    Path tempDir;

    @Test
    void cropsTheTreeWithFolderPrefixesAndSidecars() throws IOException {
        Path source = tempDir.resolve("source");
        Path sample = Files.createDirectories(source.resolve("S1"));
        Path ng = Files.createDirectories(source.resolve("NG"));
        image(source.resolve("fov1_root.png"), 20, 20);
        image(sample.resolve("fov1_b.png"), 20, 20);
        Files.writeString(sample.resolve("fov1_b.json"), "{\"shapes\": [], \"imageWidth\": 20, \"imageHeight\": 20}");
        image(sample.resolve("fov2_c.png"), 20, 20);
        image(ng.resolve("fov1_ng.png"), 20, 20);
        Path target = tempDir.resolve("cropped");
        Path debug = tempDir.resolve("debug");
        CropTask task = new CropTask(source, target, FormatSelection.of(".png"), new CropBox(5, 5, 15, 13), "1", debug);
        RecordingListener listener = new RecordingListener();

        TaskState state = new TaskRunner(task, listener, LOGGER,
            new TaskFailureLog(tempDir.resolve("failures.csv")), 2, 4096).run();

        assertEquals(TaskState.COMPLETED, state);
        assertTrue(listener.summary().contains("Cropped: 2, skipped: 0, failed: 0"), listener.summary());
        BufferedImage root = ImageIO.read(target.resolve("fov1_root.png").toFile());
        assertEquals(10, root.getWidth());
        assertEquals(8, root.getHeight());
        assertTrue(Files.exists(target.resolve("S1_fov1_b.png")));
        JSONObject annotation = new JSONObject(Files.readString(target.resolve("S1_fov1_b.json")));
        assertEquals(10, annotation.getInt("imageWidth"));
        assertEquals("S1_fov1_b.png", annotation.getString("imagePath"));
        assertTrue(Files.exists(debug.resolve("S1_fov1_b_debug.png")));
        assertFalse(Files.exists(target.resolve("S1_fov2_c.png")));
        assertFalse(Files.exists(target.resolve("NG_fov1_ng.png")));
    }

    @Test
    void boxOutsideEveryImageSkipsThem() throws IOException {
        Path source = Files.createDirectories(tempDir.resolve("source"));
        image(source.resolve("a.png"), 10, 10);
        Path target = tempDir.resolve("cropped");
        CropTask task = new CropTask(source, target, FormatSelection.of(".png"), new CropBox(50, 50, 60, 60), null, null);
        RecordingListener listener = new RecordingListener();

        new TaskRunner(task, listener, LOGGER, new TaskFailureLog(tempDir.resolve("failures.csv")), 2, 4096).run();

        assertTrue(listener.summary().contains("Cropped: 0, skipped: 1, failed: 0"), listener.summary());
        assertFalse(Files.exists(target.resolve("a.png")));
    }

    private static void image(Path path, int width, int height) throws IOException {
        ImageIO.write(new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB), "png", path.toFile());
    }
}
