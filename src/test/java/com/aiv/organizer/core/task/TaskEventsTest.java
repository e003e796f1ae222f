package com.aiv.organizer.core.task;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskEventsTest {

    @Test
    void progressIsClampedAndNeverGoesBack() {
        RecordingListener listener = new RecordingListener();
        TaskEvents events = new TaskEvents(listener);

        events.progress(-5);
        events.progress(40);
        events.progress(30);
        events.progress(140);

        assertEquals(List.of(0, 40, 100), listener.progress());
        assertEquals(100, events.lastProgress());
    }

    @Test
    void summaryIsDeliveredOnceAndSilencesLaterEvents() {
        RecordingListener listener = new RecordingListener();
        TaskEvents events = new TaskEvents(listener);

        assertTrue(events.finish("done"));
        assertFalse(events.finish("again"));
        events.log("late");
        events.progress(100);

        assertEquals(List.of("done"), listener.summaries());
        assertTrue(listener.logs().isEmpty());
        assertTrue(listener.progress().isEmpty());
        assertTrue(events.isFinished());
    }

    @Test
    void progressPercentRoundsDownAndTreatsEmptyAsDone() {
        assertEquals(33, ProgressState.percent(1, 3));
        assertEquals(100, ProgressState.percent(0, 0));
        ProgressState state = ProgressState.of(4);
        assertEquals(25, state.complete());
        assertEquals(1, state.processed());
        assertFalse(ProgressState.silent(2).isReporting());
    }
}
