package dk.cloudcreate.essentials.components.eventsourced.deciders.workflow;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Immutable state of a workflow: the {@link TaskStatus} of every task that has been started.<br>
 * A task that isn't present is {@link TaskStatus#NOT_STARTED}.
 *
 * @param <T> the task name type, e.g. an enum or a {@link String}
 */
public final class WorkflowState<T> {
    private static final WorkflowState<?> EMPTY = new WorkflowState<>(Map.of());

    private final Map<T, TaskStatus> tasks;

    private WorkflowState(Map<T, TaskStatus> tasks) {
        this.tasks = tasks;
    }

    /**
     * @return a {@link WorkflowState} where no tasks have been started
     */
    @SuppressWarnings("unchecked")
    public static <T> WorkflowState<T> empty() {
        return (WorkflowState<T>) EMPTY;
    }

    /**
     * Create a {@link WorkflowState} from the given task statuses. {@link TaskStatus#NOT_STARTED} entries are ignored
     *
     * @param tasks the task statuses
     * @return the workflow state
     */
    public static <T> WorkflowState<T> of(Map<T, TaskStatus> tasks) {
        requireNonNull(tasks, "No tasks provided");
        var startedTasks = new LinkedHashMap<T, TaskStatus>();
        tasks.forEach((taskName, status) -> {
            requireNonNull(taskName, "Task name cannot be null");
            requireNonNull(status, "Task status cannot be null");
            if (status != TaskStatus.NOT_STARTED) {
                startedTasks.put(taskName, status);
            }
        });
        return new WorkflowState<>(Collections.unmodifiableMap(startedTasks));
    }

    public TaskStatus taskStatus(T taskName) {
        requireNonNull(taskName, "No taskName provided");
        return tasks.getOrDefault(taskName, TaskStatus.NOT_STARTED);
    }

    /**
     * @return true if the task is {@link TaskStatus#STARTED} or {@link TaskStatus#FINISHED}
     */
    public boolean isTaskStarted(T taskName) {
        return taskStatus(taskName) != TaskStatus.NOT_STARTED;
    }

    public boolean isTaskCompleted(T taskName) {
        return taskStatus(taskName) == TaskStatus.FINISHED;
    }

    /**
     * @return all started (or finished) tasks and their status
     */
    public Map<T, TaskStatus> tasks() {
        return tasks;
    }

    /**
     * @return a new {@link WorkflowState} where the given task has the given status
     */
    public WorkflowState<T> withTaskStatus(T taskName, TaskStatus status) {
        requireNonNull(taskName, "No taskName provided");
        requireNonNull(status, "No status provided");
        var newTasks = new LinkedHashMap<>(tasks);
        newTasks.put(taskName, status);
        return of(newTasks);
    }

    /**
     * Merge the tasks of this state with the tasks of <code>other</code>.
     * When both contain the same task, <code>other</code>'s status wins
     *
     * @param other the other state
     * @return the merged state
     */
    public WorkflowState<T> merge(WorkflowState<T> other) {
        requireNonNull(other, "No other state provided");
        var newTasks = new LinkedHashMap<>(tasks);
        newTasks.putAll(other.tasks);
        return of(newTasks);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowState)) return false;
        return tasks.equals(((WorkflowState<?>) o).tasks);
    }

    @Override
    public int hashCode() {
        return tasks.hashCode();
    }

    @Override
    public String toString() {
        return "WorkflowState{" +
                "tasks=" + tasks +
                '}';
    }
}
