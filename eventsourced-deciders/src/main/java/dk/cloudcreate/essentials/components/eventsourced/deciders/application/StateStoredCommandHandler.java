package dk.cloudcreate.essentials.components.eventsourced.deciders.application;

import dk.cloudcreate.essentials.components.eventsourced.deciders.decider.*;
import org.slf4j.*;

import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Handles commands using a {@link StateStoredDecisionModel} (e.g. an {@link AggregateDecider}) where the current state,
 * and not the events, is what's stored:
 * <ol>
 *     <li>resolve the key from the command</li>
 *     <li>load the state for the key from the {@link StateRepository}, or use the decider's initial state if none is stored</li>
 *     <li>compute the new state using {@link StateStoredDecisionModel#computeNewState(Object, Object)}</li>
 *     <li>save the new state</li>
 * </ol>
 * If the decider throws, the exception propagates unchanged and nothing is saved.
 *
 * @param <C> the command type
 * @param <K> the key type
 * @param <S> the state type
 */
public interface StateStoredCommandHandler<C, K, S> {
    static <C, K, S, E> StateStoredCommandHandler<C, K, S> from(StateStoredDecisionModel<C, S, E> decider,
                                                                StateRepository<K, S> stateRepository,
                                                                Function<? super C, ? extends K> keyResolver) {
        return new DefaultStateStoredCommandHandler<>(decider, stateRepository, keyResolver);
    }

    /**
     * Handle the <code>command</code>
     *
     * @param command the command
     * @return the new state that was saved
     */
    S handle(C command);

    class DefaultStateStoredCommandHandler<C, K, S, E> implements StateStoredCommandHandler<C, K, S> {
        private static final Logger log = LoggerFactory.getLogger(StateStoredCommandHandler.class);

        private final StateStoredDecisionModel<C, S, E> decider;
        private final StateRepository<K, S>            stateRepository;
        private final Function<? super C, ? extends K>  keyResolver;

        public DefaultStateStoredCommandHandler(StateStoredDecisionModel<C, S, E> decider,
                                                StateRepository<K, S> stateRepository,
                                                Function<? super C, ? extends K> keyResolver) {
            this.decider = requireNonNull(decider, "You must supply a decider");
            this.stateRepository = requireNonNull(stateRepository, "You must supply a stateRepository");
            this.keyResolver = requireNonNull(keyResolver, "You must supply a keyResolver");
        }

        @Override
        public S handle(C command) {
            requireNonNull(command, "No command provided");
            K key = requireNonNull(keyResolver.apply(command), "keyResolver returned a null key");
            var currentState = stateRepository.loadState(key)
                                              .orElseGet(() -> {
                                                  log.trace("No state stored for key '{}'. Using the initial state", key);
                                                  return decider.initialState();
                                              });
            var newState = decider.computeNewState(currentState, command);
            log.debug("Saving new state for key '{}' as a result of command '{}'", key, command.getClass().getSimpleName());
            stateRepository.save(key, newState);
            return newState;
        }

        @Override
        public String toString() {
            return "StateStoredCommandHandler{" +
                    "decider=" + decider +
                    '}';
        }
    }
}
