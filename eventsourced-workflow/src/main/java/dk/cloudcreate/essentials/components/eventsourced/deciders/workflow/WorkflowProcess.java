package dk.cloudcreate.essentials.components.eventsourced.deciders.workflow;

import dk.cloudcreate.essentials.components.eventsourced.deciders.process.*;
import dk.cloudcreate.essentials.components.eventsourced.deciders.process.Process;
import dk.cloudcreate.essentials.components.eventsourced.deciders.types.Union;

import java.util.*;
import java.util.function.*;

import static dk.cloudcreate.essentials.components.eventsourced.deciders.types.Lists.*;
import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A process that tracks a set of named tasks: its state is a {@link WorkflowState} and its events are {@link WorkflowEvent}s,
 * which are always evolved by {@link WorkflowEvolution#evolve(WorkflowState, WorkflowEvent)}.<br>
 * Only <code>decide</code> (which tasks an action result starts/completes), <code>react</code> and <code>pending</code>
 * are specific to a workflow:
 * <pre>{@code
 * var fulfillment = new WorkflowProcess<OrderActionResult, OrderAction, String>(
 *         (actionResult, state) -> {
 *             if (actionResult instanceof OrderCreated && !state.isTaskStarted("processPayment")) {
 *                 return List.of(WorkflowEvent.taskStarted("processPayment"));
 *             }
 *             ...
 *         },
 *         (state, event) -> ...,
 *         state -> ...);
 * }</pre>
 *
 * @param <AR> the action result type
 * @param <A>  the action type
 * @param <T>  the task name type
 */
public final class WorkflowProcess<AR, A, T> implements StateStoredProcessModel<AR, WorkflowState<T>, WorkflowEvent<T>, A> {
    private final AggregateProcess<AR, WorkflowState<T>, WorkflowEvent<T>, A> process;

    /**
     * Create a workflow that starts from {@link WorkflowState#empty()}
     *
     * @param decide  decide which workflow events an action result results in
     * @param react   the actions a workflow event triggers
     * @param pending the actions that are outstanding for a given workflow state
     */
    public WorkflowProcess(BiFunction<? super AR, ? super WorkflowState<T>, ? extends List<? extends WorkflowEvent<T>>> decide,
                           BiFunction<? super WorkflowState<T>, ? super WorkflowEvent<T>, ? extends List<? extends A>> react,
                           Function<? super WorkflowState<T>, ? extends List<? extends A>> pending) {
        this(decide, react, pending, WorkflowState.empty());
    }

    /**
     * @param decide       decide which workflow events an action result results in
     * @param react        the actions a workflow event triggers
     * @param pending      the actions that are outstanding for a given workflow state
     * @param initialState the initial workflow state
     */
    public WorkflowProcess(BiFunction<? super AR, ? super WorkflowState<T>, ? extends List<? extends WorkflowEvent<T>>> decide,
                           BiFunction<? super WorkflowState<T>, ? super WorkflowEvent<T>, ? extends List<? extends A>> react,
                           Function<? super WorkflowState<T>, ? extends List<? extends A>> pending,
                           WorkflowState<T> initialState) {
        this(new AggregateProcess<AR, WorkflowState<T>, WorkflowEvent<T>, A>(decide,
                                                                             WorkflowEvolution::evolve,
                                                                             initialState,
                                                                             react,
                                                                             pending));
    }

    private WorkflowProcess(AggregateProcess<AR, WorkflowState<T>, WorkflowEvent<T>, A> process) {
        this.process = requireNonNull(process, "No process provided");
    }

    @Override
    public List<WorkflowEvent<T>> decide(AR actionResult, WorkflowState<T> state) {
        return process.decide(actionResult, state);
    }

    @Override
    public WorkflowState<T> evolve(WorkflowState<T> state, WorkflowEvent<T> event) {
        return process.evolve(state, event);
    }

    @Override
    public WorkflowState<T> initialState() {
        return process.initialState();
    }

    @Override
    public List<A> react(WorkflowState<T> state, WorkflowEvent<T> event) {
        return process.react(state, event);
    }

    @Override
    public List<A> pending(WorkflowState<T> state) {
        return process.pending(state);
    }

    // ------------------------------------------ Task helpers ------------------------------------------

    public WorkflowEvent.TaskStarted<T> taskStarted(T taskName) {
        return WorkflowEvent.taskStarted(taskName);
    }

    public WorkflowEvent.TaskStarted<T> taskStarted(T taskName, Map<String, ?> metadata) {
        return WorkflowEvent.taskStarted(taskName, metadata);
    }

    public WorkflowEvent.TaskCompleted<T> taskCompleted(T taskName) {
        return WorkflowEvent.taskCompleted(taskName);
    }

    public WorkflowEvent.TaskCompleted<T> taskCompleted(T taskName, Object result) {
        return WorkflowEvent.taskCompleted(taskName, result);
    }

    public WorkflowEvent.TaskCompleted<T> taskCompleted(T taskName, Object result, Map<String, ?> metadata) {
        return WorkflowEvent.taskCompleted(taskName, result, metadata);
    }

    public TaskStatus taskStatus(WorkflowState<T> state, T taskName) {
        requireNonNull(state, "No state provided");
        return state.taskStatus(taskName);
    }

    public boolean isTaskStarted(WorkflowState<T> state, T taskName) {
        requireNonNull(state, "No state provided");
        return state.isTaskStarted(taskName);
    }

    public boolean isTaskCompleted(WorkflowState<T> state, T taskName) {
        requireNonNull(state, "No state provided");
        return state.isTaskCompleted(taskName);
    }

    // ------------------------------------------ Combinators ------------------------------------------

    public <ARn> WorkflowProcess<ARn, A, T> mapContraOnActionResult(Function<? super ARn, ? extends AR> f) {
        return new WorkflowProcess<>(process.<ARn>mapContraOnActionResult(f));
    }

    public <An> WorkflowProcess<AR, An, T> mapOnAction(Function<? super A, ? extends An> f) {
        return new WorkflowProcess<>(process.<An>mapOnAction(f));
    }

    /**
     * Combine this workflow with <code>other</code>.<br>
     * The two workflows share the task name space, so unlike {@link Process#combine}
     * the state and events aren't split: an action result is decided by the workflow that owns it, every event
     * evolves the one shared {@link WorkflowState}, and both workflows react to every event.
     * <code>react</code> and <code>pending</code> return <code>other</code>'s actions followed by this workflow's actions.
     *
     * @param other the other workflow
     * @return the combined workflow
     */
    public <AR2, A2> WorkflowProcess<Union<AR, AR2>, Union<A, A2>, T> combine(WorkflowProcess<AR2, A2, T> other) {
        requireNonNull(other, "No other workflow provided");
        return new WorkflowProcess<Union<AR, AR2>, Union<A, A2>, T>(
                (actionResult, state) -> actionResult.fold(ar -> decide(ar, state),
                                                           ar2 -> other.decide(ar2, state)),
                (state, event) -> concat(mapAll(other.react(state, event), Union::<A, A2>second),
                                         mapAll(react(state, event), Union::<A, A2>first)),
                state -> concat(mapAll(other.pending(state), Union::<A, A2>second),
                                mapAll(pending(state), Union::<A, A2>first)),
                initialState().merge(other.initialState()));
    }

    /**
     * Workflow states can't be kept apart in a tuple, as the tasks share one name space, so this is the same as
     * {@link #combine(WorkflowProcess)}
     */
    public <AR2, A2> WorkflowProcess<Union<AR, AR2>, Union<A, A2>, T> combineViaTuples(WorkflowProcess<AR2, A2, T> other) {
        return combine(other);
    }

    public Process<AR, WorkflowState<T>, WorkflowState<T>, WorkflowEvent<T>, WorkflowEvent<T>, A> asProcess() {
        return process.asProcess();
    }

    public DcbProcess<AR, WorkflowState<T>, WorkflowEvent<T>, WorkflowEvent<T>, A> asDcbProcess() {
        return process.asDcbProcess();
    }

    public AggregateProcess<AR, WorkflowState<T>, WorkflowEvent<T>, A> asAggregateProcess() {
        return process;
    }

    @Override
    public String toString() {
        return "WorkflowProcess{" +
                "initialState=" + initialState() +
                '}';
    }
}
