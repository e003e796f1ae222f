package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.match.FormatSelection;
import com.aiv.organizer.core.task.RecordingListener;
import com.aiv.organizer.core.task.TaskDescriptor;
import com.aiv.organizer.core.task.TaskDescriptor.BasicSortingTask;
import com.aiv.organizer.core.task.TaskRunner;
import com.aiv.organizer.core.task.TaskState;
import com.aiv.organizer.logging.TaskFailureLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BasicSortingTest {

    private static final Logger LOGGER = Logger.getLogger(BasicSortingTest.class.getName());

    @TempDir
    Path tempDir;

    private Path source;
    private Path target;

    @BeforeEach
    void createSamples() throws IOException {
        source = tempDir.resolve("source");
        target = tempDir.resolve("target");
        Path id1 = Files.createDirectories(source.resolve("ID1"));
        Path id2 = Files.createDirectories(source.resolve("ID2"));
        Files.createDirectories(source.resolve("OK"));
        Files.writeString(id1.resolve("fov1_a.jpg"), "a");
        Files.writeString(id1.resolve("fov2_b.jpg"), "b");
        Files.writeString(id1.resolve("org.jpg"), "o");
        Files.writeString(id2.resolve("fov1_c.jpg"), "c");
    }

    @Test
    void fovFilterKeepsOnlyMatchingCapturesWithFolderPrefix() throws IOException {
        BasicSortingTask task = new BasicSortingTask(source, target, null, false, null, "1",
            FormatSelection.of(FormatSelection.FOV_JPG));
        RecordingListener listener = new RecordingListener();

        TaskState state = runner(task, listener).run();

        assertEquals(TaskState.COMPLETED, state);
        assertEquals(List.of("ID1_fov1_a.jpg", "ID2_fov1_c.jpg"), targetFiles());
        assertTrue(listener.summary().contains("Folders: 2, images: 2, failed: 0"), listener.summary());
    }

    @Test
    void fovFilterScenarioProducesExactlyOneFile() throws IOException {
        Path scenarioSource = tempDir.resolve("scenario/source");
        Path scenarioTarget = tempDir.resolve("scenario/target");
        Files.createDirectories(scenarioSource.resolve("A"));
        Files.createDirectories(scenarioSource.resolve("B"));
        Files.writeString(scenarioSource.resolve("A/fov1_x.jpg"), "x");
        Files.writeString(scenarioSource.resolve("B/fov2_y.jpg"), "y");
        BasicSortingTask task = new BasicSortingTask(scenarioSource, scenarioTarget, null, false, null, "1",
            FormatSelection.of(FormatSelection.FOV_JPG));

        runner(task, new RecordingListener()).run();

        try (Stream<Path> files = Files.list(scenarioTarget)) {
            assertEquals(List.of("A_fov1_x.jpg"),
                files.map(p -> p.getFileName().toString()).collect(Collectors.toList()));
        }
    }

    @Test
    void manualInnerIdLimitsTheRun() throws IOException {
        BasicSortingTask task = new BasicSortingTask(source, target, null, false, "ID1", null,
            FormatSelection.of(FormatSelection.FOV_JPG, FormatSelection.ORIGINAL_JPG));

        runner(task, new RecordingListener()).run();

        assertEquals(List.of("ID1_fov1_a.jpg", "ID1_fov2_b.jpg", "ID1_org.jpg"), targetFiles());
    }

    @Test
    void doublePathListReadsInnerIdsTwoLevelsDown() throws IOException {
        Path list = tempDir.resolve("list");
        Files.createDirectories(list.resolve("CODE_A/ID2"));
        Files.createDirectories(list.resolve("CODE_B/MISSING"));
        BasicSortingTask task = new BasicSortingTask(source, target, list, true, null, null,
            FormatSelection.of(FormatSelection.FOV_JPG));
        RecordingListener listener = new RecordingListener();

        TaskState state = runner(task, listener).run();

        assertEquals(TaskState.COMPLETED, state);
        assertEquals(List.of("ID2_fov1_c.jpg"), targetFiles());
        assertTrue(listener.logged("'MISSING' does not exist"));
    }

    private List<String> targetFiles() throws IOException {
        try (Stream<Path> files = Files.list(target)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    private TaskRunner runner(TaskDescriptor task, RecordingListener listener) {
        return new TaskRunner(task, listener, LOGGER, new TaskFailureLog(tempDir.resolve("failures.csv")), 2, 4096);
    }
}
