package dk.cloudcreate.essentials.components.eventsourced.deciders.process;

import dk.cloudcreate.essentials.components.eventsourced.deciders.decider.EventSourcedDecisionModel;

/**
 * {@link ProcessModel} where the input and output state types are the same
 *
 * @param <AR> the action result type
 * @param <S>  the state type
 * @param <Ei> the input event type
 * @param <Eo> the output event type
 * @param <A>  the action type
 * @see DcbProcess
 */
public interface EventSourcedProcessModel<AR, S, Ei, Eo, A> extends ProcessModel<AR, S, S, Ei, Eo, A>, EventSourcedDecisionModel<AR, S, Ei, Eo> {
}
