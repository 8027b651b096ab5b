package com.taskrelay.dispatch;

import com.taskrelay.core.model.AgentRun;
import com.taskrelay.core.model.Task;

/**
 * Outcome of admitting one dispatch event.
 *
 * @param task the task as seen inside the admission transaction, null if it no longer exists
 * @param run the run opened for a launch, otherwise null
 * @param teardownNow true for a cleanup event whose task has no active run
 */
public record Admission(DispatchDecision decision, Task task, AgentRun run, boolean teardownNow) {

    static Admission of(DispatchDecision decision, Task task) {
        return new Admission(decision, task, null, false);
    }

    static Admission launched(Task task, AgentRun run) {
        return new Admission(DispatchDecision.LAUNCHED, task, run, false);
    }

    static Admission cleanup(Task task, boolean teardownNow) {
        return new Admission(DispatchDecision.CLEANUP, task, null, teardownNow);
    }

    public boolean isLaunch() {
        return decision == DispatchDecision.LAUNCHED;
    }
}
