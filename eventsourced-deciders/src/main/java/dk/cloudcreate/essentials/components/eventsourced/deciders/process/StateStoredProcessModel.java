package dk.cloudcreate.essentials.components.eventsourced.deciders.process;

import dk.cloudcreate.essentials.components.eventsourced.deciders.decider.StateStoredDecisionModel;

/**
 * {@link ProcessModel} where the input and output state types are the same and the input and output event types are the same
 *
 * @param <AR> the action result type
 * @param <S>  the state type
 * @param <E>  the event type
 * @param <A>  the action type
 * @see AggregateProcess
 */
public interface StateStoredProcessModel<AR, S, E, A> extends EventSourcedProcessModel<AR, S, E, E, A>, StateStoredDecisionModel<AR, S, E> {
}
