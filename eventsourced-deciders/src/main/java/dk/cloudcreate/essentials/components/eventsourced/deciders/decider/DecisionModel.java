package dk.cloudcreate.essentials.components.eventsourced.deciders.decider;

import java.util.List;

/**
 * The most generic decision contract. A decision model
 * <ul>
 *     <li>decides which events a command results in, given the current state</li>
 *     <li>evolves a state using an event</li>
 *     <li>has an initial state to fold events from</li>
 * </ul>
 * A rejected command is either signalled by returning no events or by throwing a
 * {@link dk.cloudcreate.essentials.components.eventsourced.deciders.DomainRuleViolationException}
 *
 * @param <C>  the command type
 * @param <Si> the input state type
 * @param <So> the output state type
 * @param <Ei> the input event type (the events that {@link #evolve(Object, Object)} accepts)
 * @param <Eo> the output event type (the events that {@link #decide(Object, Object)} produces)
 * @see Decider
 */
public interface DecisionModel<C, Si, So, Ei, Eo> {
    /**
     * Decide which events the <code>command</code> results in
     *
     * @param command the command
     * @param state   the current state
     * @return the events (in order), possibly empty. Never null
     */
    List<Eo> decide(C command, Si state);

    /**
     * Evolve the <code>state</code> using the <code>event</code>
     *
     * @param state the current state
     * @param event the event
     * @return the next state
     */
    So evolve(Si state, Ei event);

    So initialState();
}
