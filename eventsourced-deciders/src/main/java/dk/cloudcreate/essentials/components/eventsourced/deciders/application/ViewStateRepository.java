package dk.cloudcreate.essentials.components.eventsourced.deciders.application;

import java.util.Optional;

/**
 * Storage of materialized view (read model) state used by a {@link MaterializedViewHandler}
 *
 * @param <K> the key type
 * @param <S> the view state type
 */
public interface ViewStateRepository<K, S> {
    Optional<S> loadViewState(K key);

    void save(K key, S viewState);
}
