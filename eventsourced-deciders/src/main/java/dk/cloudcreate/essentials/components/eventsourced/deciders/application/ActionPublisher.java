package dk.cloudcreate.essentials.components.eventsourced.deciders.application;

import java.util.List;

/**
 * Publishes the actions emitted by a process, e.g. by sending them as commands to other components or by queueing them
 *
 * @param <A> the action type
 */
public interface ActionPublisher<A> {
    /**
     * @param actions the actions to publish (in order, never empty)
     */
    void publish(List<A> actions);
}
