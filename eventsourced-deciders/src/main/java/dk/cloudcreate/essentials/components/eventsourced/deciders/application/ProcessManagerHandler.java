package dk.cloudcreate.essentials.components.eventsourced.deciders.application;

import dk.cloudcreate.essentials.components.eventsourced.deciders.process.*;
import org.slf4j.*;

import java.util.*;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Runs a state stored {@link StateStoredProcessModel} (e.g. an {@link AggregateProcess}) as a process manager:
 * <ol>
 *     <li>resolve the key from the action result</li>
 *     <li>load the process state for the key from the {@link StateRepository}, or use the process' initial state</li>
 *     <li>decide which events the action result results in</li>
 *     <li>for each event (in order): collect the actions returned by <code>react</code> and evolve the state</li>
 *     <li>save the new state and publish the collected actions using the {@link ActionPublisher}</li>
 * </ol>
 * If the process throws, the exception propagates unchanged and nothing is saved or published.<br>
 * The state is saved before the actions are published. If publishing fails, the exception propagates, the saved state
 * has already advanced and the reacted actions are not returned again by {@link #handle(Object)}.
 * They are recovered through {@link #pendingActions(Object)}, which recomputes every outstanding action for a key
 * (e.g. to resume processes after a restart or a failed publish).
 *
 * @param <AR> the action result type
 * @param <K>  the key type
 * @param <S>  the process state type
 * @param <A>  the action type
 */
public interface ProcessManagerHandler<AR, K, S, A> {
    static <AR, K, S, E, A> ProcessManagerHandler<AR, K, S, A> from(StateStoredProcessModel<AR, S, E, A> process,
                                                                    StateRepository<K, S> stateRepository,
                                                                    ActionPublisher<A> actionPublisher,
                                                                    Function<? super AR, ? extends K> keyResolver) {
        return new DefaultProcessManagerHandler<>(process, stateRepository, actionPublisher, keyResolver);
    }

    /**
     * Handle the <code>actionResult</code>
     *
     * @param actionResult the action result
     * @return the actions that were published (possibly none)
     */
    List<A> handle(AR actionResult);

    /**
     * Compute all actions that are still outstanding for the process with the given <code>key</code>
     *
     * @param key the key
     * @return the pending actions (possibly none)
     */
    List<A> pendingActions(K key);

    class DefaultProcessManagerHandler<AR, K, S, E, A> implements ProcessManagerHandler<AR, K, S, A> {
        private static final Logger log = LoggerFactory.getLogger(ProcessManagerHandler.class);

        private final StateStoredProcessModel<AR, S, E, A> process;
        private final StateRepository<K, S>                stateRepository;
        private final ActionPublisher<A>                   actionPublisher;
        private final Function<? super AR, ? extends K>    keyResolver;

        public DefaultProcessManagerHandler(StateStoredProcessModel<AR, S, E, A> process,
                                            StateRepository<K, S> stateRepository,
                                            ActionPublisher<A> actionPublisher,
                                            Function<? super AR, ? extends K> keyResolver) {
            this.process = requireNonNull(process, "You must supply a process");
            this.stateRepository = requireNonNull(stateRepository, "You must supply a stateRepository");
            this.actionPublisher = requireNonNull(actionPublisher, "You must supply an actionPublisher");
            this.keyResolver = requireNonNull(keyResolver, "You must supply a keyResolver");
        }

        @Override
        public List<A> handle(AR actionResult) {
            requireNonNull(actionResult, "No actionResult provided");
            K key       = requireNonNull(keyResolver.apply(actionResult), "keyResolver returned a null key");
            var state   = loadState(key);
            var events  = process.decide(actionResult, state);
            var actions = new ArrayList<A>();
            for (E event : events) {
                actions.addAll(process.react(state, event));
                state = process.evolve(state, event);
            }
            log.debug("Action result '{}' for key '{}' resulted in {} event(s) and {} action(s)",
                      actionResult.getClass().getSimpleName(),
                      key,
                      events.size(),
                      actions.size());
            stateRepository.save(key, state);
            if (!actions.isEmpty()) {
                actionPublisher.publish(List.copyOf(actions));
            }
            return List.copyOf(actions);
        }

        @Override
        public List<A> pendingActions(K key) {
            requireNonNull(key, "No key provided");
            var pending = process.pending(loadState(key));
            log.trace("Found {} pending action(s) for key '{}'", pending.size(), key);
            return pending;
        }

        private S loadState(K key) {
            return stateRepository.loadState(key)
                                  .orElseGet(process::initialState);
        }

        @Override
        public String toString() {
            return "ProcessManagerHandler{" +
                    "process=" + process +
                    '}';
        }
    }
}
