package dk.cloudcreate.essentials.components.eventsourced.deciders.types;

import java.util.*;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A closed union of exactly two types: a value is either a {@link First} wrapping a <code>A</code>
 * or a {@link Second} wrapping a <code>B</code>.<br>
 * <code>combine</code> and <code>combineViaTuples</code> use {@link Union} to represent the union of two components'
 * command, event, action result and action types. The injections {@link #first(Object)} and {@link #second(Object)}
 * are total, and the projections {@link #firstValue()}/{@link #secondValue()} tell a component whether a value
 * belongs to it, so no casts are involved when routing values to the component that owns them.
 * <p>
 * Nesting builds larger unions, e.g. combining three deciders yields commands of type
 * <code>Union&lt;Union&lt;IncrementCommand, DecrementCommand&gt;, ResetCommand&gt;</code>. Use <code>mapContraOnCommand</code>
 * and <code>dimapOnEvent</code> to present such a nested union as a flat domain type.
 *
 * @param <A> the first type
 * @param <B> the second type
 */
public abstract class Union<A, B> {
    private Union() {
    }

    /**
     * Inject a value of the first type
     *
     * @param value the value (not null)
     * @param <A>   the first type
     * @param <B>   the second type
     * @return the union value
     */
    public static <A, B> Union<A, B> first(A value) {
        return new First<>(value);
    }

    /**
     * Inject a value of the second type
     *
     * @param value the value (not null)
     * @param <A>   the first type
     * @param <B>   the second type
     * @return the union value
     */
    public static <A, B> Union<A, B> second(B value) {
        return new Second<>(value);
    }

    /**
     * Exhaustively fold this union into a single result
     *
     * @param ifFirst  function applied when this is a {@link First}
     * @param ifSecond function applied when this is a {@link Second}
     * @param <R>      the result type
     * @return the result of the matching function
     */
    public abstract <R> R fold(Function<? super A, ? extends R> ifFirst, Function<? super B, ? extends R> ifSecond);

    public abstract boolean isFirst();

    public final boolean isSecond() {
        return !isFirst();
    }

    /**
     * @return the wrapped value if this is a {@link First}, otherwise {@link Optional#empty()}
     */
    public abstract Optional<A> firstValue();

    /**
     * @return the wrapped value if this is a {@link Second}, otherwise {@link Optional#empty()}
     */
    public abstract Optional<B> secondValue();

    /**
     * The wrapped value, regardless of which side it belongs to
     */
    public abstract Object value();

    public <R> Union<R, B> mapFirst(Function<? super A, ? extends R> mapper) {
        requireNonNull(mapper, "No mapper provided");
        return fold(a -> Union.<R, B>first(mapper.apply(a)), b -> Union.<R, B>second(b));
    }

    public <R> Union<A, R> mapSecond(Function<? super B, ? extends R> mapper) {
        requireNonNull(mapper, "No mapper provided");
        return fold(a -> Union.<A, R>first(a), b -> Union.<A, R>second(mapper.apply(b)));
    }

    /**
     * @return a {@link Union} with the two sides swapped
     */
    public Union<B, A> swap() {
        return fold(a -> Union.<B, A>second(a), b -> Union.<B, A>first(b));
    }

    public static final class First<A, B> extends Union<A, B> {
        private final A value;

        private First(A value) {
            this.value = requireNonNull(value, "No first value provided");
        }

        @Override
        public <R> R fold(Function<? super A, ? extends R> ifFirst, Function<? super B, ? extends R> ifSecond) {
            requireNonNull(ifFirst, "No ifFirst function provided");
            return ifFirst.apply(value);
        }

        @Override
        public boolean isFirst() {
            return true;
        }

        @Override
        public Optional<A> firstValue() {
            return Optional.of(value);
        }

        @Override
        public Optional<B> secondValue() {
            return Optional.empty();
        }

        @Override
        public A value() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof First)) return false;
            return value.equals(((First<?, ?>) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(First.class, value);
        }

        @Override
        public String toString() {
            return "First(" + value + ")";
        }
    }

    public static final class Second<A, B> extends Union<A, B> {
        private final B value;

        private Second(B value) {
            this.value = requireNonNull(value, "No second value provided");
        }

        @Override
        public <R> R fold(Function<? super A, ? extends R> ifFirst, Function<? super B, ? extends R> ifSecond) {
            requireNonNull(ifSecond, "No ifSecond function provided");
            return ifSecond.apply(value);
        }

        @Override
        public boolean isFirst() {
            return false;
        }

        @Override
        public Optional<A> firstValue() {
            return Optional.empty();
        }

        @Override
        public Optional<B> secondValue() {
            return Optional.of(value);
        }

        @Override
        public B value() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Second)) return false;
            return value.equals(((Second<?, ?>) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Second.class, value);
        }

        @Override
        public String toString() {
            return "Second(" + value + ")";
        }
    }
}
