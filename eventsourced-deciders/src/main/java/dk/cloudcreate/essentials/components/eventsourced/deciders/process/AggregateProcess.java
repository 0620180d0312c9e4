package dk.cloudcreate.essentials.components.eventsourced.deciders.process;

import dk.cloudcreate.essentials.components.eventsourced.deciders.decider.AggregateDecider;
import dk.cloudcreate.essentials.components.eventsourced.deciders.types.*;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;

import java.util.List;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Aggregate level process: one state type and one event type, so the process can be run both event sourced and
 * state stored.<br>
 * All combinators delegate to the wrapped {@link Process}.
 *
 * @param <AR> the action result type
 * @param <S>  the state type
 * @param <E>  the event type
 * @param <A>  the action type
 */
public final class AggregateProcess<AR, S, E, A> implements StateStoredProcessModel<AR, S, E, A> {
    private final Process<AR, S, S, E, E, A> process;

    public AggregateProcess(BiFunction<? super AR, ? super S, ? extends List<? extends E>> decide,
                            BiFunction<? super S, ? super E, ? extends S> evolve,
                            S initialState,
                            BiFunction<? super S, ? super E, ? extends List<? extends A>> react,
                            Function<? super S, ? extends List<? extends A>> pending) {
        this(new Process<>(decide, evolve, initialState, react, pending));
    }

    private AggregateProcess(Process<AR, S, S, E, E, A> process) {
        this.process = requireNonNull(process, "No process provided");
    }

    public static <AR, S, E, A> AggregateProcess<AR, S, E, A> from(Process<AR, S, S, E, E, A> process) {
        return new AggregateProcess<>(process);
    }

    public static <AR, S, E, A> AggregateProcess<AR, S, E, A> from(DcbProcess<AR, S, E, E, A> process) {
        requireNonNull(process, "No process provided");
        return new AggregateProcess<>(process.asProcess());
    }

    public Process<AR, S, S, E, E, A> asProcess() {
        return process;
    }

    public DcbProcess<AR, S, E, E, A> asDcbProcess() {
        return DcbProcess.from(process);
    }

    public AggregateDecider<AR, S, E> asAggregateDecider() {
        return AggregateDecider.from(process.asDecider());
    }

    @Override
    public List<E> decide(AR actionResult, S state) {
        return process.decide(actionResult, state);
    }

    @Override
    public S evolve(S state, E event) {
        return process.evolve(state, event);
    }

    @Override
    public S initialState() {
        return process.initialState();
    }

    @Override
    public List<A> react(S state, E event) {
        return process.react(state, event);
    }

    @Override
    public List<A> pending(S state) {
        return process.pending(state);
    }

    public <ARn> AggregateProcess<ARn, S, E, A> mapContraOnActionResult(Function<? super ARn, ? extends AR> f) {
        return new AggregateProcess<>(process.<ARn>mapContraOnActionResult(f));
    }

    public <An> AggregateProcess<AR, S, E, An> mapOnAction(Function<? super A, ? extends An> f) {
        return new AggregateProcess<>(process.<An>mapOnAction(f));
    }

    /**
     * Map the event type in both directions, which keeps the aggregate level (input event type = output event type)
     */
    public <En> AggregateProcess<AR, S, En, A> dimapOnEvent(Function<? super En, ? extends E> fl,
                                                            Function<? super E, ? extends En> fr) {
        return new AggregateProcess<>(process.<En, En>dimapOnEvent(fl, fr));
    }

    public <Sn> AggregateProcess<AR, Sn, E, A> dimapOnState(Function<? super Sn, ? extends S> fl,
                                                            Function<? super S, ? extends Sn> fr) {
        return new AggregateProcess<>(process.<Sn, Sn>dimapOnState(fl, fr));
    }

    /**
     * Combine this process with <code>other</code>, see {@link Process#combine(Process, Process, StateMerge)}
     */
    public <AR2, S2, Sc, E2, A2> AggregateProcess<Union<AR, AR2>, Sc, Union<E, E2>, Union<A, A2>> combine(AggregateProcess<AR2, S2, E2, A2> other,
                                                                                                          StateMerge<S, S2, Sc> stateMerge) {
        requireNonNull(other, "No other process provided");
        return new AggregateProcess<>(Process.combine(process, other.process, stateMerge));
    }

    /**
     * Combine this process with <code>other</code>, see {@link Process#combineViaTuples(Process, Process)}
     */
    public <AR2, S2, E2, A2> AggregateProcess<Union<AR, AR2>, Pair<S, S2>, Union<E, E2>, Union<A, A2>> combineViaTuples(AggregateProcess<AR2, S2, E2, A2> other) {
        requireNonNull(other, "No other process provided");
        return new AggregateProcess<>(Process.combineViaTuples(process, other.process));
    }

    @Override
    public String toString() {
        return "AggregateProcess{" +
                "initialState=" + initialState() +
                '}';
    }
}
