package dk.cloudcreate.essentials.components.eventsourced.deciders.process;

import dk.cloudcreate.essentials.components.eventsourced.deciders.decider.DcbDecider;
import dk.cloudcreate.essentials.components.eventsourced.deciders.types.*;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;

import java.util.List;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Dynamic Consistency Boundary process: the state type is fixed, while the input events (the events the process
 * reacts to and evolves from) may be a wider set of event types than the events it produces.<br>
 * All combinators delegate to the wrapped {@link Process}.
 *
 * @param <AR> the action result type
 * @param <S>  the state type
 * @param <Ei> the input event type
 * @param <Eo> the output event type
 * @param <A>  the action type
 */
public final class DcbProcess<AR, S, Ei, Eo, A> implements EventSourcedProcessModel<AR, S, Ei, Eo, A> {
    private final Process<AR, S, S, Ei, Eo, A> process;

    public DcbProcess(BiFunction<? super AR, ? super S, ? extends List<? extends Eo>> decide,
                      BiFunction<? super S, ? super Ei, ? extends S> evolve,
                      S initialState,
                      BiFunction<? super S, ? super Ei, ? extends List<? extends A>> react,
                      Function<? super S, ? extends List<? extends A>> pending) {
        this(new Process<>(decide, evolve, initialState, react, pending));
    }

    private DcbProcess(Process<AR, S, S, Ei, Eo, A> process) {
        this.process = requireNonNull(process, "No process provided");
    }

    public static <AR, S, Ei, Eo, A> DcbProcess<AR, S, Ei, Eo, A> from(Process<AR, S, S, Ei, Eo, A> process) {
        return new DcbProcess<>(process);
    }

    public Process<AR, S, S, Ei, Eo, A> asProcess() {
        return process;
    }

    public DcbDecider<AR, S, Ei, Eo> asDcbDecider() {
        return DcbDecider.from(process.asDecider());
    }

    @Override
    public List<Eo> decide(AR actionResult, S state) {
        return process.decide(actionResult, state);
    }

    @Override
    public S evolve(S state, Ei event) {
        return process.evolve(state, event);
    }

    @Override
    public S initialState() {
        return process.initialState();
    }

    @Override
    public List<A> react(S state, Ei event) {
        return process.react(state, event);
    }

    @Override
    public List<A> pending(S state) {
        return process.pending(state);
    }

    public <ARn> DcbProcess<ARn, S, Ei, Eo, A> mapContraOnActionResult(Function<? super ARn, ? extends AR> f) {
        return new DcbProcess<>(process.<ARn>mapContraOnActionResult(f));
    }

    public <An> DcbProcess<AR, S, Ei, Eo, An> mapOnAction(Function<? super A, ? extends An> f) {
        return new DcbProcess<>(process.<An>mapOnAction(f));
    }

    public <Ein, Eon> DcbProcess<AR, S, Ein, Eon, A> dimapOnEvent(Function<? super Ein, ? extends Ei> fl,
                                                                  Function<? super Eo, ? extends Eon> fr) {
        return new DcbProcess<>(process.<Ein, Eon>dimapOnEvent(fl, fr));
    }

    public <Sn> DcbProcess<AR, Sn, Ei, Eo, A> dimapOnState(Function<? super Sn, ? extends S> fl,
                                                           Function<? super S, ? extends Sn> fr) {
        return new DcbProcess<>(process.<Sn, Sn>dimapOnState(fl, fr));
    }

    /**
     * Combine this process with <code>other</code>, see {@link Process#combine(Process, Process, StateMerge)}
     */
    public <AR2, S2, Sc, Ei2, Eo2, A2> DcbProcess<Union<AR, AR2>, Sc, Union<Ei, Ei2>, Union<Eo, Eo2>, Union<A, A2>> combine(DcbProcess<AR2, S2, Ei2, Eo2, A2> other,
                                                                                                                            StateMerge<S, S2, Sc> stateMerge) {
        requireNonNull(other, "No other process provided");
        return new DcbProcess<>(Process.combine(process, other.process, stateMerge));
    }

    /**
     * Combine this process with <code>other</code>, see {@link Process#combineViaTuples(Process, Process)}
     */
    public <AR2, S2, Ei2, Eo2, A2> DcbProcess<Union<AR, AR2>, Pair<S, S2>, Union<Ei, Ei2>, Union<Eo, Eo2>, Union<A, A2>> combineViaTuples(DcbProcess<AR2, S2, Ei2, Eo2, A2> other) {
        requireNonNull(other, "No other process provided");
        return new DcbProcess<>(Process.combineViaTuples(process, other.process));
    }

    @Override
    public String toString() {
        return "DcbProcess{" +
                "initialState=" + initialState() +
                '}';
    }
}
