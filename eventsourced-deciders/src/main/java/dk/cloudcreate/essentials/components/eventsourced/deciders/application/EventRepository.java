package dk.cloudcreate.essentials.components.eventsourced.deciders.application;

import java.util.List;

/**
 * Storage of the events that an {@link EventSourcedCommandHandler} folds into the current state and appends new events to.<br>
 * The implementation is provided by the application, e.g. backed by an event store
 *
 * @param <K>  the key type, e.g. an aggregate id or a set of tags for a Dynamic Consistency Boundary
 * @param <Ei> the type of events loaded
 * @param <Eo> the type of events appended
 */
public interface EventRepository<K, Ei, Eo> {
    /**
     * Load all events relevant for the <code>key</code>
     *
     * @param key the key
     * @return the events in causal order (oldest first), or an empty list if there are none
     */
    List<Ei> loadEvents(K key);

    /**
     * Append the <code>events</code> (in order) to the events related to the <code>key</code>
     *
     * @param key    the key
     * @param events the new events (never empty)
     */
    void append(K key, List<Eo> events);
}
