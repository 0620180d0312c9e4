package dk.cloudcreate.essentials.components.eventsourced.deciders.types;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Immutable list operations used by the combinators
 */
public final class Lists {
    private Lists() {
    }

    /**
     * @return an unmodifiable list with all of <code>first</code>'s elements followed by all of <code>second</code>'s elements
     */
    public static <T> List<T> concat(List<? extends T> first, List<? extends T> second) {
        requireNonNull(first, "No first list provided");
        requireNonNull(second, "No second list provided");
        if (first.isEmpty()) {
            return List.copyOf(second);
        }
        if (second.isEmpty()) {
            return List.copyOf(first);
        }
        var result = new ArrayList<T>(first.size() + second.size());
        result.addAll(first);
        result.addAll(second);
        return Collections.unmodifiableList(result);
    }

    /**
     * @return an unmodifiable list with <code>mapper</code> applied to each element (in order)
     */
    public static <T, R> List<R> mapAll(List<? extends T> values, Function<? super T, ? extends R> mapper) {
        requireNonNull(values, "No values provided");
        requireNonNull(mapper, "No mapper provided");
        return values.stream()
                     .map(mapper)
                     .collect(Collectors.toUnmodifiableList());
    }
}
