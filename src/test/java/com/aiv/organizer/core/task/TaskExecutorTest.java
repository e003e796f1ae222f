package com.aiv.organizer.core.task;

import com.aiv.organizer.core.transfer.CancellationToken;
import com.aiv.organizer.core.transfer.TransferResult;
import com.aiv.organizer.logging.TaskFailureLog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskExecutorTest {

    private static final Logger LOGGER = Logger.getLogger(TaskExecutorTest.class.getName());

    @TempDir
    Path tempDir;

    @Test
    void progressClimbsToOneHundredAndFailuresDoNotStopTheBatch() throws IOException {
        RecordingListener listener = new RecordingListener();
        Path ledger = tempDir.resolve("failures.csv");
        TaskExecutor executor = executor(new CancellationToken(), listener, ledger);
        List<WorkItem> items = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            int n = i;
            items.add(WorkItem.of("item" + n, () -> {
                if (n == 3) {
                    throw new IOException("disk full");
                }
                if (n == 5) {
                    return TransferResult.skipped("item5", "exists");
                }
                return TransferResult.success("item" + n, "done " + n);
            }));
        }

        BatchOutcome outcome = executor.execute(items, ProgressState.of(items.size()));

        assertEquals(10, outcome.submitted());
        assertEquals(8, outcome.succeeded());
        assertEquals(1, outcome.failed());
        assertEquals(1, outcome.skipped());
        assertFalse(outcome.cancelled());
        List<Integer> progress = listener.progress();
        assertEquals(100, progress.get(progress.size() - 1));
        for (int i = 1; i < progress.size(); i++) {
            assertTrue(progress.get(i) >= progress.get(i - 1));
        }
        assertTrue(Files.readString(ledger, StandardCharsets.UTF_8).contains("disk full"));
    }

    @Test
    void silentProgressIsNotReported() {
        RecordingListener listener = new RecordingListener();
        TaskExecutor executor = executor(new CancellationToken(), listener, tempDir.resolve("f.csv"));

        BatchOutcome outcome = executor.execute(
            List.of(WorkItem.of("a", () -> TransferResult.success("a", "ok", 3))), ProgressState.silent(1));

        assertEquals(3, outcome.transferred());
        assertTrue(listener.progress().isEmpty());
        assertTrue(listener.logged("ok"));
    }

    @Test
    void cancellationStopsTheDrainAndSkipsQueuedItems() throws InterruptedException {
        RecordingListener listener = new RecordingListener();
        CancellationToken token = new CancellationToken();
        TaskExecutor executor = new TaskExecutor(OperationKind.IMAGE_COPY, token, new TaskEvents(listener),
            new TaskFailureLog(tempDir.resolve("f.csv")), LOGGER, 1);
        CountDownLatch firstStarted = new CountDownLatch(1);
        AtomicInteger ran = new AtomicInteger();
        List<WorkItem> items = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            items.add(WorkItem.of("item" + i, () -> {
                if (token.isCancelled()) {
                    return TransferResult.cancelled("item");
                }
                ran.incrementAndGet();
                firstStarted.countDown();
                while (!token.isCancelled()) {
                    Thread.sleep(5);
                }
                return TransferResult.cancelled("item");
            }));
        }

        Thread canceller = new Thread(() -> {
            try {
                if (firstStarted.await(5, TimeUnit.SECONDS)) {
                    token.cancel();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        canceller.start();
        BatchOutcome outcome = executor.execute(items, ProgressState.of(items.size()));
        canceller.join();

        assertTrue(outcome.cancelled());
        assertEquals(0, outcome.succeeded());
        assertEquals(1, ran.get());
    }

    @Test
    void emptyBatchDoesNothing() {
        RecordingListener listener = new RecordingListener();

        BatchOutcome outcome = executor(new CancellationToken(), listener, tempDir.resolve("f.csv"))
            .execute(List.of(), ProgressState.of(0));

        assertEquals(BatchOutcome.empty(), outcome);
    }

    private static TaskExecutor executor(CancellationToken token, RecordingListener listener, Path ledger) {
        return new TaskExecutor(OperationKind.IMAGE_COPY, token, new TaskEvents(listener),
            new TaskFailureLog(ledger), LOGGER, 3);
    }
}
