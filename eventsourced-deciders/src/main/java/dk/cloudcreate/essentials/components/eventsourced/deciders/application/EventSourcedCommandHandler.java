package dk.cloudcreate.essentials.components.eventsourced.deciders.application;

import dk.cloudcreate.essentials.components.eventsourced.deciders.decider.*;
import org.slf4j.*;

import java.util.List;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Handles commands using an event sourced {@link EventSourcedDecisionModel} (e.g. a {@link DcbDecider} or an {@link AggregateDecider}):
 * <ol>
 *     <li>resolve the key from the command</li>
 *     <li>load the events for the key from the {@link EventRepository}</li>
 *     <li>compute the new events using {@link EventSourcedDecisionModel#computeNewEvents(List, Object)}</li>
 *     <li>append the new events (if any) to the {@link EventRepository}</li>
 * </ol>
 * If the decider throws, the exception propagates unchanged and nothing is appended.
 * <p>
 * Example:
 * <pre>{@code
 * var handler = EventSourcedCommandHandler.from(orderDecider,
 *                                               orderEventRepository,
 *                                               OrderCommand::orderId);
 * var newEvents = handler.handle(new PlaceOrder(orderId, customerId, menuItemId, 2));
 * }</pre>
 *
 * @param <C>  the command type
 * @param <K>  the key type
 * @param <Ei> the input event type
 * @param <Eo> the output event type
 */
public interface EventSourcedCommandHandler<C, K, Ei, Eo> {
    /**
     * Create an {@link EventSourcedCommandHandler}
     *
     * @param decider         the decider that decides on commands
     * @param eventRepository the repository to load and append events
     * @param keyResolver     resolves the key that events are loaded by and appended to from a command
     * @return the command handler
     */
    static <C, K, S, Ei, Eo> EventSourcedCommandHandler<C, K, Ei, Eo> from(EventSourcedDecisionModel<C, S, Ei, Eo> decider,
                                                                           EventRepository<K, Ei, Eo> eventRepository,
                                                                           Function<? super C, ? extends K> keyResolver) {
        return new DefaultEventSourcedCommandHandler<>(decider, eventRepository, keyResolver);
    }

    /**
     * Handle the <code>command</code>
     *
     * @param command the command
     * @return the new events that were appended (possibly none)
     */
    List<Eo> handle(C command);

    class DefaultEventSourcedCommandHandler<C, K, S, Ei, Eo> implements EventSourcedCommandHandler<C, K, Ei, Eo> {
        private static final Logger log = LoggerFactory.getLogger(EventSourcedCommandHandler.class);

        private final EventSourcedDecisionModel<C, S, Ei, Eo> decider;
        private final EventRepository<K, Ei, Eo>              eventRepository;
        private final Function<? super C, ? extends K>        keyResolver;

        public DefaultEventSourcedCommandHandler(EventSourcedDecisionModel<C, S, Ei, Eo> decider,
                                                 EventRepository<K, Ei, Eo> eventRepository,
                                                 Function<? super C, ? extends K> keyResolver) {
            this.decider = requireNonNull(decider, "You must supply a decider");
            this.eventRepository = requireNonNull(eventRepository, "You must supply an eventRepository");
            this.keyResolver = requireNonNull(keyResolver, "You must supply a keyResolver");
        }

        @Override
        public List<Eo> handle(C command) {
            requireNonNull(command, "No command provided");
            K key = requireNonNull(keyResolver.apply(command), "keyResolver returned a null key");
            log.trace("Handling command '{}' for key '{}'", command.getClass().getSimpleName(), key);
            var events    = eventRepository.loadEvents(key);
            var newEvents = decider.computeNewEvents(events, command);
            if (newEvents.isEmpty()) {
                log.debug("Command '{}' for key '{}' didn't result in any new events", command.getClass().getSimpleName(), key);
            } else {
                log.debug("Appending {} new event(s) for key '{}' as a result of command '{}'",
                          newEvents.size(),
                          key,
                          command.getClass().getSimpleName());
                eventRepository.append(key, newEvents);
            }
            return newEvents;
        }

        @Override
        public String toString() {
            return "EventSourcedCommandHandler{" +
                    "decider=" + decider +
                    '}';
        }
    }
}
