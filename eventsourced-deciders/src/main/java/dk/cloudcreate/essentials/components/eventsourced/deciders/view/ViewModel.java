package dk.cloudcreate.essentials.components.eventsourced.deciders.view;

/**
 * The most generic view contract: evolve an input state using an event into an output state.<br>
 * A view never decides anything, it only folds events into state (aka. a projection or read model).
 *
 * @param <Si> the input state type
 * @param <So> the output state type
 * @param <E>  the event type
 * @see View
 * @see ProjectionModel
 */
public interface ViewModel<Si, So, E> {
    /**
     * Evolve the <code>state</code> using the <code>event</code>.<br>
     * Must be pure and total for every event variant the view can receive
     *
     * @param state the current state
     * @param event the event
     * @return the next state
     */
    So evolve(Si state, E event);

    /**
     * The seed value for folding events
     */
    So initialState();
}
