package dk.cloudcreate.essentials.components.eventsourced.deciders.view;

import dk.cloudcreate.essentials.components.eventsourced.deciders.types.*;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;

import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A {@link View} where the input and output state types are the same, i.e. a read model that can
 * be built by folding events.<br>
 * All combinators delegate to the wrapped {@link View}, so the two levels always behave identically.
 * <p>
 * Example:
 * <pre>{@code
 * var orderSummary = new Projection<OrderSummary, OrderEvent>((summary, event) -> summary.apply(event),
 *                                                             OrderSummary.EMPTY);
 * var summary = orderSummary.project(orderEvents);
 * }</pre>
 *
 * @param <S> the state type
 * @param <E> the event type
 */
public final class Projection<S, E> implements ProjectionModel<S, E> {
    private final View<S, S, E> view;

    /**
     * @param evolve       the evolve function
     * @param initialState the initial state
     */
    public Projection(BiFunction<? super S, ? super E, ? extends S> evolve,
                      S initialState) {
        this(new View<>(evolve, initialState));
    }

    private Projection(View<S, S, E> view) {
        this.view = requireNonNull(view, "No view provided");
    }

    /**
     * Refine a {@link View} whose input and output state types are the same
     *
     * @param view the view
     * @return the projection
     */
    public static <S, E> Projection<S, E> from(View<S, S, E> view) {
        return new Projection<>(view);
    }

    public View<S, S, E> asView() {
        return view;
    }

    @Override
    public S evolve(S state, E event) {
        return view.evolve(state, event);
    }

    @Override
    public S initialState() {
        return view.initialState();
    }

    public <Sn> Projection<Sn, E> dimapOnState(Function<? super Sn, ? extends S> fl,
                                               Function<? super S, ? extends Sn> fr) {
        return new Projection<>(view.<Sn, Sn>dimapOnState(fl, fr));
    }

    public <En> Projection<S, En> mapContraOnEvent(Function<? super En, ? extends E> f) {
        return new Projection<>(view.<En>mapContraOnEvent(f));
    }

    /**
     * Combine this projection with <code>other</code>, see {@link View#combine(View, View, StateMerge)}
     */
    public <S2, Sc, E2> Projection<Sc, Union<E, E2>> combine(Projection<S2, E2> other,
                                                             StateMerge<S, S2, Sc> stateMerge) {
        requireNonNull(other, "No other projection provided");
        return new Projection<>(View.combine(view, other.view, stateMerge));
    }

    /**
     * Combine this projection with <code>other</code>, see {@link View#combineViaTuples(View, View)}
     */
    public <S2, E2> Projection<Pair<S, S2>, Union<E, E2>> combineViaTuples(Projection<S2, E2> other) {
        requireNonNull(other, "No other projection provided");
        return new Projection<>(View.combineViaTuples(view, other.view));
    }

    @Override
    public String toString() {
        return "Projection{" +
                "initialState=" + initialState() +
                '}';
    }
}
