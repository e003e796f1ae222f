package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.task.TaskContext;
import com.aiv.organizer.core.task.TaskDescriptor.SimulationFolderingTask;

/**
 * Placeholder operation; it accepts the task and changes nothing.
 */
public final class SimulationFoldering implements Procedure<SimulationFolderingTask> {

    @Override
    public ProcedureOutcome run(SimulationFolderingTask task, TaskContext context) {
        return Summaries.nothingToDo(context, "Simulation foldering has no actions yet.");
    }
}
