package dk.cloudcreate.essentials.components.eventsourced.deciders.application;

import java.util.Optional;

/**
 * Storage of the current state used by a {@link StateStoredCommandHandler} or a {@link ProcessManagerHandler}
 *
 * @param <K> the key type
 * @param <S> the state type
 */
public interface StateRepository<K, S> {
    /**
     * @param key the key
     * @return the stored state or {@link Optional#empty()} if no state has been stored for the <code>key</code>
     */
    Optional<S> loadState(K key);

    void save(K key, S state);
}
