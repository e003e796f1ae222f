package com.aiv.organizer.core.task;

import com.aiv.organizer.config.ConfigService;
import com.aiv.organizer.core.procedure.AttachFov;
import com.aiv.organizer.core.procedure.BasicSorting;
import com.aiv.organizer.core.procedure.BmpToJpg;
import com.aiv.organizer.core.procedure.CropProcedure;
import com.aiv.organizer.core.procedure.DateBasedCopy;
import com.aiv.organizer.core.procedure.ImageFormatCopy;
import com.aiv.organizer.core.procedure.ImageTransformProcedure;
import com.aiv.organizer.core.procedure.MimToBmp;
import com.aiv.organizer.core.procedure.NgCount;
import com.aiv.organizer.core.procedure.NgFolderSorting;
import com.aiv.organizer.core.procedure.ProcedureOutcome;
import com.aiv.organizer.core.procedure.SimulationFoldering;
import com.aiv.organizer.core.transfer.CancellationToken;
import com.aiv.organizer.logging.TaskFailureLog;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one {@link TaskDescriptor}: validates it, hands it to its procedure and reports exactly one
 * terminal summary. A runner is single-use.
 */
public final class TaskRunner {
    private final TaskDescriptor descriptor;
    private final TaskEvents events;
    private final Logger logger;
    private final TaskFailureLog failureLog;
    private final int poolSize;
    private final int chunkBytes;
    private final FovPolicy fovPolicy;
    private final CancellationToken token = new CancellationToken();
    private final Object stateLock = new Object();
    private TaskState state = TaskState.IDLE;

    public TaskRunner(TaskDescriptor descriptor, TaskListener listener, Logger logger) {
        this(descriptor, listener, logger, FovPolicy.DROP);
    }

    public TaskRunner(TaskDescriptor descriptor, TaskListener listener, Logger logger, FovPolicy fovPolicy) {
        this(descriptor, listener, logger, TaskFailureLog.fromConfig(),
            ConfigService.getInstance().getWorkerPoolSize(),
            ConfigService.getInstance().getCopyChunkBytes(), fovPolicy);
    }

    public TaskRunner(TaskDescriptor descriptor,
                      TaskListener listener,
                      Logger logger,
                      TaskFailureLog failureLog,
                      int poolSize,
                      int chunkBytes) {
        this(descriptor, listener, logger, failureLog, poolSize, chunkBytes, FovPolicy.DROP);
    }

    public TaskRunner(TaskDescriptor descriptor,
                      TaskListener listener,
                      Logger logger,
                      TaskFailureLog failureLog,
                      int poolSize,
                      int chunkBytes,
                      FovPolicy fovPolicy) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.events = new TaskEvents(Objects.requireNonNull(listener, "listener"));
        this.logger = Objects.requireNonNull(logger, "logger");
        this.failureLog = Objects.requireNonNull(failureLog, "failureLog");
        this.poolSize = poolSize;
        this.chunkBytes = chunkBytes;
        this.fovPolicy = Objects.requireNonNull(fovPolicy, "fovPolicy");
    }

    /**
     * Runs the task on the calling thread and returns its terminal state.
     *
     * @throws IllegalStateException when this runner was already started
     */
    public TaskState run() {
        synchronized (stateLock) {
            if (state != TaskState.IDLE) {
                throw new IllegalStateException("Task already started: " + state);
            }
            state = TaskState.VALIDATING;
        }
        OperationKind kind = descriptor.kind();

        List<String> problems = TaskValidator.validate(descriptor, fovPolicy);
        if (!problems.isEmpty()) {
            problems.forEach(events::log);
            events.finish(kind.displayName() + " rejected: " + String.join("; ", problems));
            return moveTo(TaskState.REJECTED);
        }

        moveTo(TaskState.PLANNING);
        events.log("------ " + kind.displayName() + " started ------");
        TaskContext context = new TaskContext(kind, token, events, failureLog, logger, poolSize, chunkBytes,
            this::markRunning);
        try {
            ProcedureOutcome outcome = dispatch(descriptor, context);
            if (outcome.cancelled()) {
                moveTo(TaskState.CANCELLED);
            } else {
                moveTo(TaskState.COMPLETED);
                events.progress(100);
                events.log("------ " + kind.displayName() + " finished ------");
            }
            events.finish(outcome.summary());
        } catch (IOException | RuntimeException e) {
            logger.log(Level.SEVERE, kind.displayName() + " failed", e);
            moveTo(TaskState.FAILED);
            events.log("ERROR: " + e.getMessage());
            events.finish(kind.displayName() + " failed: " + e.getMessage());
        }
        return state();
    }

    /**
     * Starts the task on its own thread.
     */
    public TaskHandle start() {
        CompletableFuture<TaskState> completion = new CompletableFuture<>();
        Thread thread = new Thread(() -> {
            try {
                completion.complete(run());
            } finally {
                if (!completion.isDone()) {
                    completion.complete(state());
                }
            }
        }, "task-" + descriptor.kind().tag());
        thread.start();
        return new TaskHandle(this, completion);
    }

    /** Requests cooperative cancellation; work stops at the next safe point. */
    public void stop() {
        token.cancel();
    }

    public TaskState state() {
        synchronized (stateLock) {
            return state;
        }
    }

    private void markRunning() {
        synchronized (stateLock) {
            if (state == TaskState.PLANNING) {
                state = TaskState.RUNNING;
            }
        }
    }

    private TaskState moveTo(TaskState next) {
        synchronized (stateLock) {
            state = next;
            return next;
        }
    }

    private static ProcedureOutcome dispatch(TaskDescriptor descriptor, TaskContext context) throws IOException {
        return switch (descriptor.kind()) {
            case NG_SORTING -> new NgFolderSorting().run((TaskDescriptor.NgSortingTask) descriptor, context);
            case DATE_COPY -> new DateBasedCopy().run((TaskDescriptor.DateCopyTask) descriptor, context);
            case IMAGE_COPY -> new ImageFormatCopy().run((TaskDescriptor.ImageCopyTask) descriptor, context);
            case SIMULATION_FOLDERING ->
                new SimulationFoldering().run((TaskDescriptor.SimulationFolderingTask) descriptor, context);
            case NG_COUNT -> new NgCount().run((TaskDescriptor.NgCountTask) descriptor, context);
            case BASIC_SORTING -> new BasicSorting().run((TaskDescriptor.BasicSortingTask) descriptor, context);
            case CROP -> new CropProcedure().run((TaskDescriptor.CropTask) descriptor, context);
            case ATTACH_FOV -> new AttachFov().run((TaskDescriptor.AttachFovTask) descriptor, context);
            case MIM_TO_BMP -> new MimToBmp().run((TaskDescriptor.MimToBmpTask) descriptor, context);
            case BTJ -> new BmpToJpg().run((TaskDescriptor.BmpToJpgTask) descriptor, context);
            case RESIZE, FLIP, ROTATE ->
                new ImageTransformProcedure().run((TaskDescriptor.ImageTransformTask) descriptor, context);
        };
    }
}
