package dk.cloudcreate.essentials.components.eventsourced.deciders.workflow;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The one and only <code>evolve</code> function for workflows, shared by every {@link WorkflowProcess}:
 * <ul>
 *     <li>{@link WorkflowEvent.TaskStarted} marks the task {@link TaskStatus#STARTED}</li>
 *     <li>{@link WorkflowEvent.TaskCompleted} marks the task {@link TaskStatus#FINISHED}</li>
 * </ul>
 * Nothing is deduplicated here. Starting an already finished task moves it back to {@link TaskStatus#STARTED},
 * so a workflow that wants idempotent tasks must check {@link WorkflowState#isTaskStarted(Object)} in its <code>decide</code> function.
 */
public final class WorkflowEvolution {
    private WorkflowEvolution() {
    }

    public static <T> WorkflowState<T> evolve(WorkflowState<T> state, WorkflowEvent<T> event) {
        requireNonNull(state, "No state provided");
        requireNonNull(event, "No event provided");
        return event.fold(taskStarted -> state.withTaskStatus(taskStarted.taskName, TaskStatus.STARTED),
                          taskCompleted -> state.withTaskStatus(taskCompleted.taskName, TaskStatus.FINISHED));
    }
}
