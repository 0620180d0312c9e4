package dk.cloudcreate.essentials.components.eventsourced.deciders.application;

import dk.cloudcreate.essentials.components.eventsourced.deciders.view.*;
import org.slf4j.*;

import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Keeps a materialized view (read model) up to date using a {@link ProjectionModel} (e.g. a {@link Projection}):
 * <ol>
 *     <li>resolve the key from the event</li>
 *     <li>load the view state for the key from the {@link ViewStateRepository}, or use the projection's initial state</li>
 *     <li>compute the new view state using {@link ProjectionModel#computeNewState(Object, Object)}</li>
 *     <li>save the new view state</li>
 * </ol>
 *
 * @param <E> the event type
 * @param <K> the key type
 * @param <S> the view state type
 */
public interface MaterializedViewHandler<E, K, S> {
    static <E, K, S> MaterializedViewHandler<E, K, S> from(ProjectionModel<S, E> projection,
                                                           ViewStateRepository<K, S> viewStateRepository,
                                                           Function<? super E, ? extends K> keyResolver) {
        return new DefaultMaterializedViewHandler<>(projection, viewStateRepository, keyResolver);
    }

    /**
     * Apply the <code>event</code> to the view
     *
     * @param event the event
     * @return the new view state that was saved
     */
    S handle(E event);

    class DefaultMaterializedViewHandler<E, K, S> implements MaterializedViewHandler<E, K, S> {
        private static final Logger log = LoggerFactory.getLogger(MaterializedViewHandler.class);

        private final ProjectionModel<S, E>            projection;
        private final ViewStateRepository<K, S>        viewStateRepository;
        private final Function<? super E, ? extends K> keyResolver;

        public DefaultMaterializedViewHandler(ProjectionModel<S, E> projection,
                                              ViewStateRepository<K, S> viewStateRepository,
                                              Function<? super E, ? extends K> keyResolver) {
            this.projection = requireNonNull(projection, "You must supply a projection");
            this.viewStateRepository = requireNonNull(viewStateRepository, "You must supply a viewStateRepository");
            this.keyResolver = requireNonNull(keyResolver, "You must supply a keyResolver");
        }

        @Override
        public S handle(E event) {
            requireNonNull(event, "No event provided");
            K key = requireNonNull(keyResolver.apply(event), "keyResolver returned a null key");
            var currentState = viewStateRepository.loadViewState(key)
                                                  .orElseGet(projection::initialState);
            var newState = projection.computeNewState(currentState, event);
            log.trace("Saving view state for key '{}' after applying event '{}'", key, event.getClass().getSimpleName());
            viewStateRepository.save(key, newState);
            return newState;
        }

        @Override
        public String toString() {
            return "MaterializedViewHandler{" +
                    "projection=" + projection +
                    '}';
        }
    }
}
