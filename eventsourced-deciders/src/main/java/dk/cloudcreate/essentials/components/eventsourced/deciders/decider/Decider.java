package dk.cloudcreate.essentials.components.eventsourced.deciders.decider;

import dk.cloudcreate.essentials.components.eventsourced.deciders.types.*;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;

import java.util.List;
import java.util.function.*;

import static dk.cloudcreate.essentials.components.eventsourced.deciders.types.Lists.*;
import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The generic (and immutable) decider: a <code>decide</code> function, an <code>evolve</code> function and an initial state,
 * where the command, the input/output state and the input/output event types are all independent.<br>
 * All decider combinators are implemented here. {@link DcbDecider} and {@link AggregateDecider} wrap a {@link Decider}
 * and delegate to these combinators.
 *
 * @param <C>  the command type
 * @param <Si> the input state type
 * @param <So> the output state type
 * @param <Ei> the input event type
 * @param <Eo> the output event type
 */
public final class Decider<C, Si, So, Ei, Eo> implements DecisionModel<C, Si, So, Ei, Eo> {
    private final BiFunction<? super C, ? super Si, ? extends List<? extends Eo>> decide;
    private final BiFunction<? super Si, ? super Ei, ? extends So>                 evolve;
    private final So                                                               initialState;

    /**
     * @param decide       the decide function
     * @param evolve       the evolve function
     * @param initialState the initial state
     */
    public Decider(BiFunction<? super C, ? super Si, ? extends List<? extends Eo>> decide,
                   BiFunction<? super Si, ? super Ei, ? extends So> evolve,
                   So initialState) {
        this.decide = requireNonNull(decide, "No decide function provided");
        this.evolve = requireNonNull(evolve, "No evolve function provided");
        this.initialState = requireNonNull(initialState, "No initialState provided");
    }

    @Override
    public List<Eo> decide(C command, Si state) {
        return List.copyOf(decide.apply(command, state));
    }

    @Override
    public So evolve(Si state, Ei event) {
        return evolve.apply(state, event);
    }

    @Override
    public So initialState() {
        return initialState;
    }

    /**
     * Contravariant mapping of the command type
     *
     * @param f    maps the new command type to this decider's command type
     * @param <Cn> the new command type
     * @return the mapped decider
     */
    public <Cn> Decider<Cn, Si, So, Ei, Eo> mapContraOnCommand(Function<? super Cn, ? extends C> f) {
        requireNonNull(f, "No f function provided");
        return new Decider<Cn, Si, So, Ei, Eo>((cn, s) -> decide(f.apply(cn), s),
                                               evolve,
                                               initialState);
    }

    /**
     * Contravariant mapping of the input event type and covariant mapping of the output event type
     *
     * @param fl    maps the new input event type to this decider's input event type
     * @param fr    maps this decider's output event type to the new output event type
     * @param <Ein> the new input event type
     * @param <Eon> the new output event type
     * @return the mapped decider
     */
    public <Ein, Eon> Decider<C, Si, So, Ein, Eon> dimapOnEvent(Function<? super Ein, ? extends Ei> fl,
                                                                Function<? super Eo, ? extends Eon> fr) {
        requireNonNull(fl, "No fl function provided");
        requireNonNull(fr, "No fr function provided");
        return new Decider<C, Si, So, Ein, Eon>((c, s) -> mapAll(decide(c, s), fr),
                                                (s, ein) -> evolve(s, fl.apply(ein)),
                                                initialState);
    }

    /**
     * Contravariant mapping of the input state type and covariant mapping of the output state type.<br>
     * Both <code>decide</code> and <code>evolve</code> see the state through <code>fl</code>
     *
     * @param fl    maps the new input state type to this decider's input state type
     * @param fr    maps this decider's output state type to the new output state type
     * @param <Sin> the new input state type
     * @param <Son> the new output state type
     * @return the mapped decider
     */
    public <Sin, Son> Decider<C, Sin, Son, Ei, Eo> dimapOnState(Function<? super Sin, ? extends Si> fl,
                                                                Function<? super So, ? extends Son> fr) {
        requireNonNull(fl, "No fl function provided");
        requireNonNull(fr, "No fr function provided");
        return new Decider<C, Sin, Son, Ei, Eo>((c, sin) -> decide(c, fl.apply(sin)),
                                                (sin, e) -> fr.apply(evolve(fl.apply(sin), e)),
                                                fr.apply(initialState));
    }

    /**
     * Applicative apply on the output state.<br>
     * The resulting <code>decide</code> returns <code>ff</code>'s events followed by this decider's events
     *
     * @param ff    the decider producing output state functions
     * @param <Son> the new output state type
     * @return the resulting decider
     */
    public <Son> Decider<C, Si, Son, Ei, Eo> applyOnState(Decider<C, Si, Function<? super So, ? extends Son>, Ei, Eo> ff) {
        requireNonNull(ff, "No ff decider provided");
        return new Decider<C, Si, Son, Ei, Eo>((c, s) -> concat(ff.decide(c, s), decide(c, s)),
                                               (s, e) -> ff.evolve(s, e).apply(evolve(s, e)),
                                               ff.initialState().apply(initialState));
    }

    /**
     * Product of this decider and <code>fb</code> where the two output states are merged using <code>merge</code>.<br>
     * Both deciders see the same commands, input states and events
     *
     * @param fb    the other decider
     * @param merge merges this decider's output state with <code>fb</code>'s output state
     * @param <So2> the other decider's output state type
     * @param <Son> the merged output state type
     * @return the product decider
     */
    public <So2, Son> Decider<C, Si, Son, Ei, Eo> productOnState(Decider<C, Si, So2, Ei, Eo> fb,
                                                                 BiFunction<? super So, ? super So2, ? extends Son> merge) {
        requireNonNull(fb, "No fb decider provided");
        requireNonNull(merge, "No merge function provided");
        return applyOnState(fb.<Si, Function<? super So, ? extends Son>>dimapOnState(Function.identity(),
                                                                                   so2 -> so -> merge.apply(so, so2)));
    }

    /**
     * Product of this decider and <code>fb</code> where the two output states are kept apart in a {@link Pair}
     *
     * @param fb    the other decider
     * @param <So2> the other decider's output state type
     * @return the product decider
     */
    public <So2> Decider<C, Si, Pair<So, So2>, Ei, Eo> productViaTuplesOnState(Decider<C, Si, So2, Ei, Eo> fb) {
        return this.<So2, Pair<So, So2>>productOnState(fb, (so, so2) -> new Pair<>(so, so2));
    }

    /**
     * Lift a decider into the first position of a {@link Union} of command and event types.<br>
     * Commands and events of the second type don't concern the lifted decider: such a command results in no events and
     * such an event leaves the state unchanged.
     *
     * @param decider the decider
     * @return the lifted decider
     */
    public static <C1, C2, S, Ei1, Ei2, Eo1, Eo2> Decider<Union<C1, C2>, S, S, Union<Ei1, Ei2>, Union<Eo1, Eo2>> liftToFirst(Decider<C1, S, S, Ei1, Eo1> decider) {
        requireNonNull(decider, "No decider provided");
        return new Decider<Union<C1, C2>, S, S, Union<Ei1, Ei2>, Union<Eo1, Eo2>>(
                (command, s) -> command.firstValue()
                                       .map(c -> mapAll(decider.decide(c, s), Union::<Eo1, Eo2>first))
                                       .orElse(List.of()),
                (s, event) -> event.firstValue()
                                   .map(e -> decider.evolve(s, e))
                                   .orElse(s),
                decider.initialState());
    }

    /**
     * Lift a decider into the second position of a {@link Union} of command and event types.
     *
     * @param decider the decider
     * @return the lifted decider
     * @see #liftToFirst(Decider)
     */
    public static <C1, C2, S, Ei1, Ei2, Eo1, Eo2> Decider<Union<C1, C2>, S, S, Union<Ei1, Ei2>, Union<Eo1, Eo2>> liftToSecond(Decider<C2, S, S, Ei2, Eo2> decider) {
        requireNonNull(decider, "No decider provided");
        return new Decider<Union<C1, C2>, S, S, Union<Ei1, Ei2>, Union<Eo1, Eo2>>(
                (command, s) -> command.secondValue()
                                       .map(c -> mapAll(decider.decide(c, s), Union::<Eo1, Eo2>second))
                                       .orElse(List.of()),
                (s, event) -> event.secondValue()
                                   .map(e -> decider.evolve(s, e))
                                   .orElse(s),
                decider.initialState());
    }

    /**
     * Combine two deciders into one that handles the union of their commands and events, and whose state is
     * the intersection merge of their states.
     * <ul>
     *     <li>A command is decided only by the decider that owns it, using its half of the combined state</li>
     *     <li>An event evolves only the half of the state owned by the decider that owns the event.
     *     The other half is left unchanged</li>
     *     <li>The combined initial state is <code>stateMerge.merge(x.initialState(), y.initialState())</code></li>
     * </ul>
     *
     * @param x          the first decider
     * @param y          the second decider
     * @param stateMerge merges the two states into the combined state type
     * @return the combined decider
     * @throws IllegalArgumentException if merging the two initial states loses information
     *                                  (the combined <code>evolve</code> throws it when merging an evolved state does)
     */
    public static <C1, C2, S1, S2, S, Ei1, Ei2, Eo1, Eo2> Decider<Union<C1, C2>, S, S, Union<Ei1, Ei2>, Union<Eo1, Eo2>> combine(Decider<C1, S1, S1, Ei1, Eo1> x,
                                                                                                                                Decider<C2, S2, S2, Ei2, Eo2> y,
                                                                                                                                StateMerge<S1, S2, S> stateMerge) {
        requireNonNull(x, "No x decider provided");
        requireNonNull(y, "No y decider provided");
        requireNonNull(stateMerge, "No stateMerge provided");
        stateMerge.requireLosslessMerge(x.initialState(), y.initialState());

        Decider<Union<C1, C2>, S, S1, Union<Ei1, Ei2>, Union<Eo1, Eo2>> deciderX = Decider.<C1, C2, S1, Ei1, Ei2, Eo1, Eo2>liftToFirst(x)
                                                                                          .<S, S1>dimapOnState(stateMerge::first, Function.identity());
        Decider<Union<C1, C2>, S, S2, Union<Ei1, Ei2>, Union<Eo1, Eo2>> deciderY = Decider.<C1, C2, S2, Ei1, Ei2, Eo1, Eo2>liftToSecond(y)
                                                                                          .<S, S2>dimapOnState(stateMerge::second, Function.identity());
        return deciderX.productOnState(deciderY, stateMerge::requireLosslessMerge);
    }

    /**
     * Combine two deciders into one that handles the union of their commands and events, and whose state is
     * a {@link Pair} of their states. Each half of the pair is only ever seen and evolved by its own decider.
     *
     * @param x the first decider
     * @param y the second decider
     * @return the combined decider
     */
    public static <C1, C2, S1, S2, Ei1, Ei2, Eo1, Eo2> Decider<Union<C1, C2>, Pair<S1, S2>, Pair<S1, S2>, Union<Ei1, Ei2>, Union<Eo1, Eo2>> combineViaTuples(Decider<C1, S1, S1, Ei1, Eo1> x,
                                                                                                                                                            Decider<C2, S2, S2, Ei2, Eo2> y) {
        requireNonNull(x, "No x decider provided");
        requireNonNull(y, "No y decider provided");

        Decider<Union<C1, C2>, Pair<S1, S2>, S1, Union<Ei1, Ei2>, Union<Eo1, Eo2>> deciderX = Decider.<C1, C2, S1, Ei1, Ei2, Eo1, Eo2>liftToFirst(x)
                                                                                                     .<Pair<S1, S2>, S1>dimapOnState(Pair::_1, Function.identity());
        Decider<Union<C1, C2>, Pair<S1, S2>, S2, Union<Ei1, Ei2>, Union<Eo1, Eo2>> deciderY = Decider.<C1, C2, S2, Ei1, Ei2, Eo1, Eo2>liftToSecond(y)
                                                                                                     .<Pair<S1, S2>, S2>dimapOnState(Pair::_2, Function.identity());
        return deciderX.productViaTuplesOnState(deciderY);
    }

    @Override
    public String toString() {
        return "Decider{" +
                "initialState=" + initialState +
                '}';
    }
}
