package dk.cloudcreate.essentials.components.eventsourced.deciders.decider;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link EventSourcedDecisionModel} where the input and output event types are the same, which means that the
 * events a command results in can be applied directly to the current state (aka. the aggregate level).<br>
 * Such a model can be used both as an event sourced aggregate and as a state stored aggregate.
 *
 * @param <C> the command type
 * @param <S> the state type
 * @param <E> the event type
 * @see AggregateDecider
 */
public interface StateStoredDecisionModel<C, S, E> extends EventSourcedDecisionModel<C, S, E, E> {
    /**
     * Decide the events for the <code>command</code> and apply them, in order, to the <code>state</code>
     *
     * @param state   the current state
     * @param command the command
     * @return the new state
     */
    default S computeNewState(S state, C command) {
        requireNonNull(state, "No state provided");
        requireNonNull(command, "No command provided");
        var events       = decide(command, state);
        var currentState = state;
        for (E event : events) {
            currentState = evolve(currentState, event);
        }
        eventSourcedLog.trace("Command '{}' resulted in {} event(s) applied to the stored state",
                              command.getClass().getSimpleName(),
                              events.size());
        return currentState;
    }
}
