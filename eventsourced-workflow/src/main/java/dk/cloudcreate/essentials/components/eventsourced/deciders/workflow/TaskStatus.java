package dk.cloudcreate.essentials.components.eventsourced.deciders.workflow;

/**
 * The status of a single task in a {@link WorkflowState}:
 * <code>NOT_STARTED --TaskStarted--&gt; STARTED --TaskCompleted--&gt; FINISHED</code>
 */
public enum TaskStatus {
    NOT_STARTED,
    STARTED,
    FINISHED
}
