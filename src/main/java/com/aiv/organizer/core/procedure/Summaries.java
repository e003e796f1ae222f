package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.match.FovRangeParseResult;
import com.aiv.organizer.core.match.FovRangeParser;
import com.aiv.organizer.core.task.BatchOutcome;
import com.aiv.organizer.core.task.TaskContext;

import java.util.Set;

/**
 * Summary wording and the batch FOV policy shared by the procedures.
 */
final class Summaries {
    private Summaries() {
    }

    static ProcedureOutcome nothingToDo(TaskContext context, String reason) {
        context.log(reason);
        context.progress(100);
        return ProcedureOutcome.completed(context.operation().displayName() + " completed. " + reason);
    }

    static ProcedureOutcome finish(TaskContext context, BatchOutcome outcome, String counts) {
        return outcome.cancelled() ? stopped(context, counts) : completed(context, counts);
    }

    static ProcedureOutcome completed(TaskContext context, String counts) {
        return ProcedureOutcome.completed(context.operation().displayName() + " completed. " + counts);
    }

    static ProcedureOutcome stopped(TaskContext context, String counts) {
        context.log("Stop requested. " + counts);
        return ProcedureOutcome.stopped(context.operation().displayName() + " stopped. " + counts);
    }

    /**
     * Batch reading of a FOV expression: invalid tokens are logged and dropped. Returns null for a
     * blank expression (no filtering) and an empty set when no token survived.
     */
    static Set<String> fovFilter(TaskContext context, String expression) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        FovRangeParseResult parsed = FovRangeParser.parse(expression);
        if (parsed.hasRejectedTokens()) {
            context.log("Ignoring invalid FOV numbers: " + String.join(", ", parsed.rejectedTokens()));
        }
        return parsed.fovNumbers();
    }
}
