package dk.cloudcreate.essentials.components.eventsourced.deciders.process;

import dk.cloudcreate.essentials.components.eventsourced.deciders.decider.DecisionModel;

import java.util.List;

/**
 * A process (aka. process manager or saga) is a {@link DecisionModel} whose commands are the results of
 * actions performed by other parts of the system (<code>AR</code>), and which additionally emits actions (<code>A</code>):
 * <ul>
 *     <li>{@link #react(Object, Object)} - the actions an event triggers right now</li>
 *     <li>{@link #pending(Object)} - every action that is still outstanding given the state</li>
 * </ul>
 * The actions returned by <code>react</code> for an event are expected to be included in <code>pending</code> of the
 * state after the event has been applied.
 *
 * @param <AR> the action result type
 * @param <Si> the input state type
 * @param <So> the output state type
 * @param <Ei> the input event type
 * @param <Eo> the output event type
 * @param <A>  the action type
 * @see Process
 */
public interface ProcessModel<AR, Si, So, Ei, Eo, A> extends DecisionModel<AR, Si, So, Ei, Eo> {
    /**
     * The actions the <code>event</code> triggers
     *
     * @param state the state the event is applied to
     * @param event the event
     * @return the actions (in order), possibly empty. Never null
     */
    List<A> react(Si state, Ei event);

    /**
     * Every action that is still outstanding for the <code>state</code>, e.g. used to resume a process after a restart
     *
     * @param state the state
     * @return the pending actions, possibly empty. Never null
     */
    List<A> pending(Si state);
}
