package dk.cloudcreate.essentials.components.eventsourced.deciders.decider;

import dk.cloudcreate.essentials.components.eventsourced.deciders.types.*;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;

import java.util.List;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Aggregate level decider: the events that a command results in are the same type of events that the state is
 * evolved from, so the decider can be used both event sourced ({@link #computeNewEvents(List, Object)})
 * and state stored ({@link #computeNewState(Object, Object)}).
 * <p>
 * All combinators delegate to the wrapped {@link Decider}.
 *
 * @param <C> the command type
 * @param <S> the state type
 * @param <E> the event type
 */
public final class AggregateDecider<C, S, E> implements StateStoredDecisionModel<C, S, E> {
    private final Decider<C, S, S, E, E> decider;

    /**
     * @param decide       the decide function
     * @param evolve       the evolve function
     * @param initialState the initial state
     */
    public AggregateDecider(BiFunction<? super C, ? super S, ? extends List<? extends E>> decide,
                            BiFunction<? super S, ? super E, ? extends S> evolve,
                            S initialState) {
        this(new Decider<>(decide, evolve, initialState));
    }

    private AggregateDecider(Decider<C, S, S, E, E> decider) {
        this.decider = requireNonNull(decider, "No decider provided");
    }

    /**
     * Refine a {@link Decider} whose input and output state types, and input and output event types, are the same
     *
     * @param decider the decider
     * @return the aggregate decider
     */
    public static <C, S, E> AggregateDecider<C, S, E> from(Decider<C, S, S, E, E> decider) {
        return new AggregateDecider<>(decider);
    }

    /**
     * Refine a {@link DcbDecider} whose input and output event types are the same
     *
     * @param decider the decider
     * @return the aggregate decider
     */
    public static <C, S, E> AggregateDecider<C, S, E> from(DcbDecider<C, S, E, E> decider) {
        requireNonNull(decider, "No decider provided");
        return new AggregateDecider<>(decider.asDecider());
    }

    public Decider<C, S, S, E, E> asDecider() {
        return decider;
    }

    public DcbDecider<C, S, E, E> asDcbDecider() {
        return DcbDecider.from(decider);
    }

    @Override
    public List<E> decide(C command, S state) {
        return decider.decide(command, state);
    }

    @Override
    public S evolve(S state, E event) {
        return decider.evolve(state, event);
    }

    @Override
    public S initialState() {
        return decider.initialState();
    }

    public <Cn> AggregateDecider<Cn, S, E> mapContraOnCommand(Function<? super Cn, ? extends C> f) {
        return new AggregateDecider<>(decider.<Cn>mapContraOnCommand(f));
    }

    /**
     * Map the event type in both directions, which keeps the aggregate level (input event type = output event type)
     *
     * @param fl   maps the new event type to this decider's event type
     * @param fr   maps this decider's event type to the new event type
     * @param <En> the new event type
     * @return the mapped decider
     */
    public <En> AggregateDecider<C, S, En> dimapOnEvent(Function<? super En, ? extends E> fl,
                                                        Function<? super E, ? extends En> fr) {
        return new AggregateDecider<>(decider.<En, En>dimapOnEvent(fl, fr));
    }

    public <Sn> AggregateDecider<C, Sn, E> dimapOnState(Function<? super Sn, ? extends S> fl,
                                                        Function<? super S, ? extends Sn> fr) {
        return new AggregateDecider<>(decider.<Sn, Sn>dimapOnState(fl, fr));
    }

    /**
     * Combine this decider with <code>other</code>, see {@link Decider#combine(Decider, Decider, StateMerge)}
     */
    public <C2, S2, Sc, E2> AggregateDecider<Union<C, C2>, Sc, Union<E, E2>> combine(AggregateDecider<C2, S2, E2> other,
                                                                                     StateMerge<S, S2, Sc> stateMerge) {
        requireNonNull(other, "No other decider provided");
        return new AggregateDecider<>(Decider.combine(decider, other.decider, stateMerge));
    }

    /**
     * Combine this decider with <code>other</code>, see {@link Decider#combineViaTuples(Decider, Decider)}
     */
    public <C2, S2, E2> AggregateDecider<Union<C, C2>, Pair<S, S2>, Union<E, E2>> combineViaTuples(AggregateDecider<C2, S2, E2> other) {
        requireNonNull(other, "No other decider provided");
        return new AggregateDecider<>(Decider.combineViaTuples(decider, other.decider));
    }

    @Override
    public String toString() {
        return "AggregateDecider{" +
                "initialState=" + initialState() +
                '}';
    }
}
