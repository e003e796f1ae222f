package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.task.NgCountReport;
import com.aiv.organizer.core.task.NgCountRow;
import com.aiv.organizer.core.task.RecordingListener;
import com.aiv.organizer.core.task.TaskDescriptor.NgCountTask;
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
import static org.junit.jupiter.api.Assertions.assertTrue;

class NgCountTest {

    private static final Logger LOGGER = Logger.getLogger(NgCountTest.class.getName());

    @TempDir
    Path tempDir;

    @Test
    void countsDefectInstancesPerCamera() throws IOException {
        Path lot = tempDir.resolve("lot");
        Path ng = lot.resolve("NG");
        Files.createDirectories(ng.resolve("Cam_1/Scratch/i1"));
        Files.createDirectories(ng.resolve("Cam_1/Scratch/i2"));
        Files.createDirectories(ng.resolve("Cam_1/Dent/i1"));
        Files.createDirectories(ng.resolve("Cam_2/Scratch/i1"));
        Files.createDirectories(ng.resolve("cam_3/Scratch/i1"));
        Files.createDirectories(lot.resolve("OK"));
        Files.createDirectories(lot.resolve("S1"));
        Files.createDirectories(lot.resolve("S2"));
        Files.createDirectories(lot.resolve("S3"));
        RecordingListener listener = new RecordingListener();

        TaskState state = new TaskRunner(new NgCountTask(ng), listener, LOGGER,
            new TaskFailureLog(tempDir.resolve("failures.csv")), 2, 4096).run();

        assertEquals(TaskState.COMPLETED, state);
        NgCountReport report = listener.reports().get(0);
        assertEquals(List.of(
            new NgCountRow("Cam_1", "Dent", 1),
            new NgCountRow("Cam_1", "Scratch", 2),
            new NgCountRow("Cam_2", "Scratch", 1)), report.rows());
        assertEquals(4, report.totalDefects());
        assertEquals(2, report.cameraCount());
        assertEquals(3, report.inspectedFolderCount());
        assertTrue(listener.summary().contains("Cameras: 2, defects: 4, inspected folders: 3"), listener.summary());
    }

    @Test
    void noCameraFolderStillReportsAnEmptyTable() throws IOException {
        Path ng = Files.createDirectories(tempDir.resolve("lot/NG/misc"));
        RecordingListener listener = new RecordingListener();

        TaskState state = new TaskRunner(new NgCountTask(ng.getParent()), listener, LOGGER,
            new TaskFailureLog(tempDir.resolve("failures.csv")), 2, 4096).run();

        assertEquals(TaskState.COMPLETED, state);
        assertEquals(1, listener.reports().size());
        assertTrue(listener.reports().get(0).rows().isEmpty());
    }
}
