package dk.cloudcreate.essentials.components.eventsourced.deciders.process;

import dk.cloudcreate.essentials.components.eventsourced.deciders.decider.Decider;
import dk.cloudcreate.essentials.components.eventsourced.deciders.types.*;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;

import java.util.List;
import java.util.function.*;

import static dk.cloudcreate.essentials.components.eventsourced.deciders.types.Lists.*;
import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The generic (and immutable) process: a {@link Decider} (deciding on action results) extended with
 * a <code>react</code> and a <code>pending</code> function that emit actions.<br>
 * The decide/evolve/initial state part of every combinator is delegated to the {@link Decider} combinators,
 * so a process and its decider always agree on state and events.
 *
 * @param <AR> the action result type
 * @param <Si> the input state type
 * @param <So> the output state type
 * @param <Ei> the input event type
 * @param <Eo> the output event type
 * @param <A>  the action type
 */
public final class Process<AR, Si, So, Ei, Eo, A> implements ProcessModel<AR, Si, So, Ei, Eo, A> {
    private final Decider<AR, Si, So, Ei, Eo>                                     decider;
    private final BiFunction<? super Si, ? super Ei, ? extends List<? extends A>> react;
    private final Function<? super Si, ? extends List<? extends A>>               pending;

    /**
     * @param decide       decide which events an action result results in
     * @param evolve       the evolve function
     * @param initialState the initial state
     * @param react        the actions an event triggers
     * @param pending      the actions that are outstanding for a given state
     */
    public Process(BiFunction<? super AR, ? super Si, ? extends List<? extends Eo>> decide,
                   BiFunction<? super Si, ? super Ei, ? extends So> evolve,
                   So initialState,
                   BiFunction<? super Si, ? super Ei, ? extends List<? extends A>> react,
                   Function<? super Si, ? extends List<? extends A>> pending) {
        this(new Decider<>(decide, evolve, initialState), react, pending);
    }

    private Process(Decider<AR, Si, So, Ei, Eo> decider,
                    BiFunction<? super Si, ? super Ei, ? extends List<? extends A>> react,
                    Function<? super Si, ? extends List<? extends A>> pending) {
        this.decider = requireNonNull(decider, "No decider provided");
        this.react = requireNonNull(react, "No react function provided");
        this.pending = requireNonNull(pending, "No pending function provided");
    }

    /**
     * Create a process from an existing {@link Decider} and the action functions
     *
     * @param decider the decider deciding on action results
     * @param react   the actions an event triggers
     * @param pending the actions that are outstanding for a given state
     * @return the process
     */
    public static <AR, Si, So, Ei, Eo, A> Process<AR, Si, So, Ei, Eo, A> from(Decider<AR, Si, So, Ei, Eo> decider,
                                                                             BiFunction<? super Si, ? super Ei, ? extends List<? extends A>> react,
                                                                             Function<? super Si, ? extends List<? extends A>> pending) {
        return new Process<>(decider, react, pending);
    }

    /**
     * @return the decide/evolve/initial state part of this process
     */
    public Decider<AR, Si, So, Ei, Eo> asDecider() {
        return decider;
    }

    @Override
    public List<Eo> decide(AR actionResult, Si state) {
        return decider.decide(actionResult, state);
    }

    @Override
    public So evolve(Si state, Ei event) {
        return decider.evolve(state, event);
    }

    @Override
    public So initialState() {
        return decider.initialState();
    }

    @Override
    public List<A> react(Si state, Ei event) {
        return List.copyOf(react.apply(state, event));
    }

    @Override
    public List<A> pending(Si state) {
        return List.copyOf(pending.apply(state));
    }

    /**
     * Contravariant mapping of the action result type
     *
     * @param f     maps the new action result type to this process' action result type
     * @param <ARn> the new action result type
     * @return the mapped process
     */
    public <ARn> Process<ARn, Si, So, Ei, Eo, A> mapContraOnActionResult(Function<? super ARn, ? extends AR> f) {
        return new Process<>(decider.<ARn>mapContraOnCommand(f), react, pending);
    }

    /**
     * Covariant mapping of the action type, applied to both <code>react</code> and <code>pending</code>
     *
     * @param f    maps this process' action type to the new action type
     * @param <An> the new action type
     * @return the mapped process
     */
    public <An> Process<AR, Si, So, Ei, Eo, An> mapOnAction(Function<? super A, ? extends An> f) {
        requireNonNull(f, "No f function provided");
        return new Process<AR, Si, So, Ei, Eo, An>(decider,
                                                   (s, e) -> mapAll(react(s, e), f),
                                                   s -> mapAll(pending(s), f));
    }

    /**
     * Contravariant mapping of the input event type (also seen by <code>react</code>) and covariant mapping of
     * the output event type
     */
    public <Ein, Eon> Process<AR, Si, So, Ein, Eon, A> dimapOnEvent(Function<? super Ein, ? extends Ei> fl,
                                                                    Function<? super Eo, ? extends Eon> fr) {
        requireNonNull(fl, "No fl function provided");
        return new Process<AR, Si, So, Ein, Eon, A>(decider.<Ein, Eon>dimapOnEvent(fl, fr),
                                                    (s, ein) -> react(s, fl.apply(ein)),
                                                    pending);
    }

    /**
     * Contravariant mapping of the input state type (also seen by <code>react</code> and <code>pending</code>) and
     * covariant mapping of the output state type
     */
    public <Sin, Son> Process<AR, Sin, Son, Ei, Eo, A> dimapOnState(Function<? super Sin, ? extends Si> fl,
                                                                    Function<? super So, ? extends Son> fr) {
        requireNonNull(fl, "No fl function provided");
        return new Process<AR, Sin, Son, Ei, Eo, A>(decider.<Sin, Son>dimapOnState(fl, fr),
                                                    (sin, e) -> react(fl.apply(sin), e),
                                                    sin -> pending(fl.apply(sin)));
    }

    /**
     * Applicative apply on the output state.<br>
     * <code>react</code> and <code>pending</code> return <code>ff</code>'s actions followed by this process' actions
     */
    public <Son> Process<AR, Si, Son, Ei, Eo, A> applyOnState(Process<AR, Si, Function<? super So, ? extends Son>, Ei, Eo, A> ff) {
        requireNonNull(ff, "No ff process provided");
        return new Process<AR, Si, Son, Ei, Eo, A>(decider.applyOnState(ff.decider),
                                                   (s, e) -> concat(ff.react(s, e), react(s, e)),
                                                   s -> concat(ff.pending(s), pending(s)));
    }

    public <So2, Son> Process<AR, Si, Son, Ei, Eo, A> productOnState(Process<AR, Si, So2, Ei, Eo, A> fb,
                                                                     BiFunction<? super So, ? super So2, ? extends Son> merge) {
        requireNonNull(fb, "No fb process provided");
        requireNonNull(merge, "No merge function provided");
        return applyOnState(fb.<Si, Function<? super So, ? extends Son>>dimapOnState(Function.identity(),
                                                                                   so2 -> so -> merge.apply(so, so2)));
    }

    public <So2> Process<AR, Si, Pair<So, So2>, Ei, Eo, A> productViaTuplesOnState(Process<AR, Si, So2, Ei, Eo, A> fb) {
        return this.<So2, Pair<So, So2>>productOnState(fb, (so, so2) -> new Pair<>(so, so2));
    }

    /**
     * Lift a process into the first position of a {@link Union} of action result, event and action types.<br>
     * Action results and events of the second type don't concern the lifted process: they result in no events,
     * leave the state unchanged and trigger no actions.
     *
     * @param process the process
     * @return the lifted process
     */
    public static <AR1, AR2, S, Ei1, Ei2, Eo1, Eo2, A1, A2> Process<Union<AR1, AR2>, S, S, Union<Ei1, Ei2>, Union<Eo1, Eo2>, Union<A1, A2>> liftToFirst(Process<AR1, S, S, Ei1, Eo1, A1> process) {
        requireNonNull(process, "No process provided");
        return new Process<Union<AR1, AR2>, S, S, Union<Ei1, Ei2>, Union<Eo1, Eo2>, Union<A1, A2>>(
                Decider.<AR1, AR2, S, Ei1, Ei2, Eo1, Eo2>liftToFirst(process.decider),
                (s, event) -> event.firstValue()
                                   .map(e -> mapAll(process.react(s, e), Union::<A1, A2>first))
                                   .orElse(List.of()),
                s -> mapAll(process.pending(s), Union::<A1, A2>first));
    }

    /**
     * Lift a process into the second position of a {@link Union} of action result, event and action types.
     *
     * @param process the process
     * @return the lifted process
     * @see #liftToFirst(Process)
     */
    public static <AR1, AR2, S, Ei1, Ei2, Eo1, Eo2, A1, A2> Process<Union<AR1, AR2>, S, S, Union<Ei1, Ei2>, Union<Eo1, Eo2>, Union<A1, A2>> liftToSecond(Process<AR2, S, S, Ei2, Eo2, A2> process) {
        requireNonNull(process, "No process provided");
        return new Process<Union<AR1, AR2>, S, S, Union<Ei1, Ei2>, Union<Eo1, Eo2>, Union<A1, A2>>(
                Decider.<AR1, AR2, S, Ei1, Ei2, Eo1, Eo2>liftToSecond(process.decider),
                (s, event) -> event.secondValue()
                                   .map(e -> mapAll(process.react(s, e), Union::<A1, A2>second))
                                   .orElse(List.of()),
                s -> mapAll(process.pending(s), Union::<A1, A2>second));
    }

    /**
     * Combine two processes into one that handles the union of their action results, events and actions, and whose
     * state is the intersection merge of their states.<br>
     * <code>pending</code> of the combined process contains the pending actions of both processes, each computed
     * from its own half of the state.
     *
     * @param x          the first process
     * @param y          the second process
     * @param stateMerge merges the two states into the combined state type
     * @return the combined process
     * @throws IllegalArgumentException if merging the two initial states loses information
     *                                  (the combined <code>evolve</code> throws it when merging an evolved state does)
     * @see Decider#combine(Decider, Decider, StateMerge)
     */
    public static <AR1, AR2, S1, S2, S, Ei1, Ei2, Eo1, Eo2, A1, A2> Process<Union<AR1, AR2>, S, S, Union<Ei1, Ei2>, Union<Eo1, Eo2>, Union<A1, A2>> combine(Process<AR1, S1, S1, Ei1, Eo1, A1> x,
                                                                                                                                                         Process<AR2, S2, S2, Ei2, Eo2, A2> y,
                                                                                                                                                         StateMerge<S1, S2, S> stateMerge) {
        requireNonNull(x, "No x process provided");
        requireNonNull(y, "No y process provided");
        requireNonNull(stateMerge, "No stateMerge provided");
        stateMerge.requireLosslessMerge(x.initialState(), y.initialState());

        Process<Union<AR1, AR2>, S, S1, Union<Ei1, Ei2>, Union<Eo1, Eo2>, Union<A1, A2>> processX =
                Process.<AR1, AR2, S1, Ei1, Ei2, Eo1, Eo2, A1, A2>liftToFirst(x)
                       .<S, S1>dimapOnState(stateMerge::first, Function.identity());
        Process<Union<AR1, AR2>, S, S2, Union<Ei1, Ei2>, Union<Eo1, Eo2>, Union<A1, A2>> processY =
                Process.<AR1, AR2, S2, Ei1, Ei2, Eo1, Eo2, A1, A2>liftToSecond(y)
                       .<S, S2>dimapOnState(stateMerge::second, Function.identity());
        return processX.productOnState(processY, stateMerge::requireLosslessMerge);
    }

    /**
     * Combine two processes into one whose state is a {@link Pair} of their states
     *
     * @param x the first process
     * @param y the second process
     * @return the combined process
     * @see #combine(Process, Process, StateMerge)
     */
    public static <AR1, AR2, S1, S2, Ei1, Ei2, Eo1, Eo2, A1, A2> Process<Union<AR1, AR2>, Pair<S1, S2>, Pair<S1, S2>, Union<Ei1, Ei2>, Union<Eo1, Eo2>, Union<A1, A2>> combineViaTuples(Process<AR1, S1, S1, Ei1, Eo1, A1> x,
                                                                                                                                                                                     Process<AR2, S2, S2, Ei2, Eo2, A2> y) {
        requireNonNull(x, "No x process provided");
        requireNonNull(y, "No y process provided");

        Process<Union<AR1, AR2>, Pair<S1, S2>, S1, Union<Ei1, Ei2>, Union<Eo1, Eo2>, Union<A1, A2>> processX =
                Process.<AR1, AR2, S1, Ei1, Ei2, Eo1, Eo2, A1, A2>liftToFirst(x)
                       .<Pair<S1, S2>, S1>dimapOnState(Pair::_1, Function.identity());
        Process<Union<AR1, AR2>, Pair<S1, S2>, S2, Union<Ei1, Ei2>, Union<Eo1, Eo2>, Union<A1, A2>> processY =
                Process.<AR1, AR2, S2, Ei1, Ei2, Eo1, Eo2, A1, A2>liftToSecond(y)
                       .<Pair<S1, S2>, S2>dimapOnState(Pair::_2, Function.identity());
        return processX.productViaTuplesOnState(processY);
    }

    @Override
    public String toString() {
        return "Process{" +
                "initialState=" + initialState() +
                '}';
    }
}
