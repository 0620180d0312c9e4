package dk.cloudcreate.essentials.components.eventsourced.deciders.view;

import org.slf4j.*;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link ViewModel} where the input and the output state types are the same, which means
 * that a sequence of events can be folded into the state
 *
 * @param <S> the state type
 * @param <E> the event type
 * @see Projection
 */
public interface ProjectionModel<S, E> extends ViewModel<S, S, E> {
    Logger projectionLog = LoggerFactory.getLogger(ProjectionModel.class);

    /**
     * Compute the new state of the projection after applying a single event
     *
     * @param state the current state, e.g. loaded from a read model store
     * @param event the new event
     * @return the new state, which is the value to persist
     */
    default S computeNewState(S state, E event) {
        requireNonNull(state, "No state provided");
        requireNonNull(event, "No event provided");
        return evolve(state, event);
    }

    /**
     * Fold all <code>events</code> (oldest first) into a state starting from {@link #initialState()}
     *
     * @param events the events in causal order
     * @return the resulting state
     */
    default S project(List<? extends E> events) {
        requireNonNull(events, "No events provided");
        var state = initialState();
        for (E event : events) {
            state = evolve(state, event);
        }
        projectionLog.trace("Projected {} event(s) into state '{}'", events.size(), state);
        return state;
    }
}
