package dk.cloudcreate.essentials.components.eventsourced.deciders.types;

import java.util.Objects;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Explicit intersection ("field") merge of two component states into one combined state type.<br>
 * The combined state <code>S</code> contains all the fields of <code>S1</code> and all the fields of <code>S2</code>,
 * and the two halves can be extracted again:
 * <pre>{@code
 * var merge = StateMerge.of((RestaurantState restaurant, OrderState order) -> new RestaurantAndOrderState(restaurant, order),
 *                           RestaurantAndOrderState::restaurantState,
 *                           RestaurantAndOrderState::orderState);
 * }</pre>
 * A merge must satisfy <code>first(merge(s1, s2)).equals(s1)</code> and <code>second(merge(s1, s2)).equals(s2)</code>.
 * If the two halves share a field, the round trip fails for one of them. <code>combine</code> detects this using
 * {@link #requireLosslessMerge(Object, Object)} on the two initial states and on every state produced by the combined
 * <code>evolve</code>, so two halves that collide only after some events still fail loudly.
 *
 * @param <S1> the first component's state type
 * @param <S2> the second component's state type
 * @param <S>  the combined state type
 */
public interface StateMerge<S1, S2, S> {
    /**
     * Create a {@link StateMerge} from its three functions
     *
     * @param merge  merge the two halves into the combined state
     * @param first  extract the first half from the combined state
     * @param second extract the second half from the combined state
     * @return the {@link StateMerge}
     */
    static <S1, S2, S> StateMerge<S1, S2, S> of(BiFunction<? super S1, ? super S2, ? extends S> merge,
                                                Function<? super S, ? extends S1> first,
                                                Function<? super S, ? extends S2> second) {
        requireNonNull(merge, "No merge function provided");
        requireNonNull(first, "No first function provided");
        requireNonNull(second, "No second function provided");
        return new StateMerge<>() {
            @Override
            public S merge(S1 firstState, S2 secondState) {
                return merge.apply(firstState, secondState);
            }

            @Override
            public S1 first(S mergedState) {
                return first.apply(mergedState);
            }

            @Override
            public S2 second(S mergedState) {
                return second.apply(mergedState);
            }
        };
    }

    S merge(S1 firstState, S2 secondState);

    S1 first(S mergedState);

    S2 second(S mergedState);

    /**
     * Verify that merging <code>firstState</code> and <code>secondState</code> doesn't lose information
     *
     * @param firstState  the first state
     * @param secondState the second state
     * @return the merged state
     * @throws IllegalArgumentException if either half can't be extracted unchanged from the merged state
     */
    default S requireLosslessMerge(S1 firstState, S2 secondState) {
        var merged = merge(firstState, secondState);
        if (!Objects.equals(first(merged), firstState)) {
            throw new IllegalArgumentException(msg("The first state '{}' isn't preserved by the merged state '{}'. The two states most likely share a field",
                                                   firstState,
                                                   merged));
        }
        if (!Objects.equals(second(merged), secondState)) {
            throw new IllegalArgumentException(msg("The second state '{}' isn't preserved by the merged state '{}'. The two states most likely share a field",
                                                   secondState,
                                                   merged));
        }
        return merged;
    }
}
