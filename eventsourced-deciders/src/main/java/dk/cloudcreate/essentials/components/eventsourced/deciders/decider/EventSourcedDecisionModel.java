package dk.cloudcreate.essentials.components.eventsourced.deciders.decider;

import org.slf4j.*;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link DecisionModel} where the input and output state types are the same, which allows the current state
 * to be rebuilt from the events that were previously stored.<br>
 * The input and output event types may differ, which is what a Dynamic Consistency Boundary
 * decider needs: it reads more event types than it produces.
 *
 * @param <C>  the command type
 * @param <S>  the state type
 * @param <Ei> the input event type
 * @param <Eo> the output event type
 * @see DcbDecider
 */
public interface EventSourcedDecisionModel<C, S, Ei, Eo> extends DecisionModel<C, S, S, Ei, Eo> {
    Logger eventSourcedLog = LoggerFactory.getLogger(EventSourcedDecisionModel.class);

    /**
     * Fold the <code>events</code> into the current state, starting from {@link #initialState()},
     * and decide which new events the <code>command</code> results in
     *
     * @param events  the previously stored events (oldest first)
     * @param command the command
     * @return the new events. Never null
     */
    default List<Eo> computeNewEvents(List<? extends Ei> events, C command) {
        requireNonNull(events, "No events provided");
        requireNonNull(command, "No command provided");
        var currentState = initialState();
        for (Ei event : events) {
            currentState = evolve(currentState, event);
        }
        var newEvents = decide(command, currentState);
        eventSourcedLog.trace("Command '{}' applied to state rebuilt from {} event(s) resulted in {} new event(s)",
                              command.getClass().getSimpleName(),
                              events.size(),
                              newEvents.size());
        return newEvents;
    }
}
