package com.aiv.organizer.core.procedure;

/**
 * Final summary of a procedure and whether it ended through cancellation.
 */
public record ProcedureOutcome(String summary, boolean cancelled) {

    public static ProcedureOutcome completed(String summary) {
        return new ProcedureOutcome(summary, false);
    }

    public static ProcedureOutcome stopped(String summary) {
        return new ProcedureOutcome(summary, true);
    }
}
