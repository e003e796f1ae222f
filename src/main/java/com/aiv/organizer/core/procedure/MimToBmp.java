package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.task.TaskContext;
import com.aiv.organizer.core.task.TaskDescriptor.MimToBmpTask;

/**
 * MIM files are decoded by a vendor converter executable that this tool does not launch; the
 * operation only reports that.
 */
public final class MimToBmp implements Procedure<MimToBmpTask> {

    @Override
    public ProcedureOutcome run(MimToBmpTask task, TaskContext context) {
        return Summaries.nothingToDo(context,
            "MIM to BMP conversion requires the external converter; nothing was converted.");
    }
}
