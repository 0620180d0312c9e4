package dk.cloudcreate.essentials.components.eventsourced.deciders.view;

import dk.cloudcreate.essentials.components.eventsourced.deciders.types.*;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;

import java.util.Optional;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The generic (and immutable) view: an <code>evolve</code> function and an initial state, where the input state type,
 * the output state type and the event type are all independent.<br>
 * All view combinators are implemented here and {@link Projection} reuses them by delegation.
 *
 * @param <Si> the input state type
 * @param <So> the output state type
 * @param <E>  the event type
 */
public final class View<Si, So, E> implements ViewModel<Si, So, E> {
    private final BiFunction<? super Si, ? super E, ? extends So> evolve;
    private final So                                              initialState;

    /**
     * @param evolve       the evolve function
     * @param initialState the initial state
     */
    public View(BiFunction<? super Si, ? super E, ? extends So> evolve,
                So initialState) {
        this.evolve = requireNonNull(evolve, "No evolve function provided");
        this.initialState = requireNonNull(initialState, "No initialState provided");
    }

    @Override
    public So evolve(Si state, E event) {
        return evolve.apply(state, event);
    }

    @Override
    public So initialState() {
        return initialState;
    }

    /**
     * Contravariant mapping of the input state and covariant mapping of the output state.<br>
     * <code>dimapOnState(identity, identity)</code> behaves exactly as this view
     *
     * @param fl  maps the new input state to this view's input state
     * @param fr  maps this view's output state to the new output state
     * @param <Sin> the new input state type
     * @param <Son> the new output state type
     * @return the mapped view
     */
    public <Sin, Son> View<Sin, Son, E> dimapOnState(Function<? super Sin, ? extends Si> fl,
                                                     Function<? super So, ? extends Son> fr) {
        requireNonNull(fl, "No fl function provided");
        requireNonNull(fr, "No fr function provided");
        return new View<Sin, Son, E>((sin, e) -> fr.apply(evolve(fl.apply(sin), e)),
                                     fr.apply(initialState));
    }

    /**
     * Contravariant mapping of the event type
     *
     * @param f    maps the new event type to this view's event type
     * @param <En> the new event type
     * @return the mapped view
     */
    public <En> View<Si, So, En> mapContraOnEvent(Function<? super En, ? extends E> f) {
        requireNonNull(f, "No f function provided");
        return new View<Si, So, En>((s, en) -> evolve(s, f.apply(en)),
                                    initialState);
    }

    /**
     * Applicative apply on the output state: <code>ff</code>'s output state is a function that is applied to
     * this view's output state
     *
     * @param ff    the view producing output state functions
     * @param <Son> the new output state type
     * @return the resulting view
     */
    public <Son> View<Si, Son, E> applyOnState(View<Si, Function<? super So, ? extends Son>, E> ff) {
        requireNonNull(ff, "No ff view provided");
        return new View<Si, Son, E>((s, e) -> ff.evolve(s, e).apply(evolve(s, e)),
                                    ff.initialState().apply(initialState));
    }

    /**
     * Product of this view and <code>fb</code> where the two output states are merged using <code>merge</code>
     *
     * @param fb    the other view
     * @param merge merges this view's output state with <code>fb</code>'s output state
     * @param <So2> the other view's output state type
     * @param <Son> the merged output state type
     * @return the product view
     */
    public <So2, Son> View<Si, Son, E> productOnState(View<Si, So2, E> fb,
                                                      BiFunction<? super So, ? super So2, ? extends Son> merge) {
        requireNonNull(fb, "No fb view provided");
        requireNonNull(merge, "No merge function provided");
        return applyOnState(fb.<Si, Function<? super So, ? extends Son>>dimapOnState(Function.identity(),
                                                                                   so2 -> so -> merge.apply(so, so2)));
    }

    /**
     * Product of this view and <code>fb</code> where the two output states are kept apart in a {@link Pair}
     *
     * @param fb    the other view
     * @param <So2> the other view's output state type
     * @return the product view
     */
    public <So2> View<Si, Pair<So, So2>, E> productViaTuplesOnState(View<Si, So2, E> fb) {
        return this.<So2, Pair<So, So2>>productOnState(fb, (so, so2) -> new Pair<>(so, so2));
    }

    /**
     * Combine two views into one that handles the union of their events and whose state is the intersection merge of
     * their states. An event belonging to one view leaves the other view's part of the state unchanged
     *
     * @param x          the first view
     * @param y          the second view
     * @param stateMerge merges the two states into the combined state type
     * @return the combined view
     * @throws IllegalArgumentException if merging the two initial states loses information
     *                                  (the combined <code>evolve</code> throws it when merging an evolved state does)
     */
    public static <S1, S2, S, E1, E2> View<S, S, Union<E1, E2>> combine(View<S1, S1, E1> x,
                                                                        View<S2, S2, E2> y,
                                                                        StateMerge<S1, S2, S> stateMerge) {
        requireNonNull(x, "No x view provided");
        requireNonNull(y, "No y view provided");
        requireNonNull(stateMerge, "No stateMerge provided");
        stateMerge.requireLosslessMerge(x.initialState(), y.initialState());

        View<S, S1, Union<E1, E2>> viewX = View.<S1, E1, Union<E1, E2>>onlyOwnEvents(x, Union::firstValue)
                                               .<S, S1>dimapOnState(stateMerge::first, Function.identity());
        View<S, S2, Union<E1, E2>> viewY = View.<S2, E2, Union<E1, E2>>onlyOwnEvents(y, Union::secondValue)
                                               .<S, S2>dimapOnState(stateMerge::second, Function.identity());
        return viewX.productOnState(viewY, stateMerge::requireLosslessMerge);
    }

    /**
     * Combine two views into one that handles the union of their events and whose state is a {@link Pair}
     * of the two states. Each half of the pair is only ever evolved by its own view
     *
     * @param x the first view
     * @param y the second view
     * @return the combined view
     */
    public static <S1, S2, E1, E2> View<Pair<S1, S2>, Pair<S1, S2>, Union<E1, E2>> combineViaTuples(View<S1, S1, E1> x,
                                                                                                    View<S2, S2, E2> y) {
        requireNonNull(x, "No x view provided");
        requireNonNull(y, "No y view provided");

        View<Pair<S1, S2>, S1, Union<E1, E2>> viewX = View.<S1, E1, Union<E1, E2>>onlyOwnEvents(x, Union::firstValue)
                                                          .<Pair<S1, S2>, S1>dimapOnState(Pair::_1, Function.identity());
        View<Pair<S1, S2>, S2, Union<E1, E2>> viewY = View.<S2, E2, Union<E1, E2>>onlyOwnEvents(y, Union::secondValue)
                                                          .<Pair<S1, S2>, S2>dimapOnState(Pair::_2, Function.identity());
        return viewX.productViaTuplesOnState(viewY);
    }

    /**
     * Widen the event type of a view to <code>En</code>, where events that the <code>projection</code> doesn't map to
     * the view's own event type leave the state unchanged
     */
    private static <S, E, En> View<S, S, En> onlyOwnEvents(View<S, S, E> view,
                                                           Function<? super En, Optional<E>> projection) {
        return new View<S, S, En>((s, en) -> projection.apply(en)
                                                       .map(e -> view.evolve(s, e))
                                                       .orElse(s),
                                  view.initialState());
    }

    @Override
    public String toString() {
        return "View{" +
                "initialState=" + initialState +
                '}';
    }
}
