package dk.cloudcreate.essentials.components.eventsourced.deciders.decider;

import dk.cloudcreate.essentials.components.eventsourced.deciders.types.*;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;

import java.util.List;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Dynamic Consistency Boundary decider: the state is rebuilt by folding every event type that is relevant for the
 * decision (<code>Ei</code>), which may be a wider set of event types than the ones the decider produces (<code>Eo</code>).<br>
 * Example: an order decider that reads <code>RestaurantMenuPublished</code> events to validate menu items, but only
 * produces <code>OrderCreated</code> events.
 * <p>
 * All combinators delegate to the wrapped {@link Decider}.
 *
 * @param <C>  the command type
 * @param <S>  the state type
 * @param <Ei> the input event type
 * @param <Eo> the output event type
 */
public final class DcbDecider<C, S, Ei, Eo> implements EventSourcedDecisionModel<C, S, Ei, Eo> {
    private final Decider<C, S, S, Ei, Eo> decider;

    /**
     * @param decide       the decide function
     * @param evolve       the evolve function
     * @param initialState the initial state
     */
    public DcbDecider(BiFunction<? super C, ? super S, ? extends List<? extends Eo>> decide,
                      BiFunction<? super S, ? super Ei, ? extends S> evolve,
                      S initialState) {
        this(new Decider<>(decide, evolve, initialState));
    }

    private DcbDecider(Decider<C, S, S, Ei, Eo> decider) {
        this.decider = requireNonNull(decider, "No decider provided");
    }

    /**
     * Refine a {@link Decider} whose input and output state types are the same
     *
     * @param decider the decider
     * @return the DCB decider
     */
    public static <C, S, Ei, Eo> DcbDecider<C, S, Ei, Eo> from(Decider<C, S, S, Ei, Eo> decider) {
        return new DcbDecider<>(decider);
    }

    public Decider<C, S, S, Ei, Eo> asDecider() {
        return decider;
    }

    @Override
    public List<Eo> decide(C command, S state) {
        return decider.decide(command, state);
    }

    @Override
    public S evolve(S state, Ei event) {
        return decider.evolve(state, event);
    }

    @Override
    public S initialState() {
        return decider.initialState();
    }

    public <Cn> DcbDecider<Cn, S, Ei, Eo> mapContraOnCommand(Function<? super Cn, ? extends C> f) {
        return new DcbDecider<>(decider.<Cn>mapContraOnCommand(f));
    }

    public <Ein, Eon> DcbDecider<C, S, Ein, Eon> dimapOnEvent(Function<? super Ein, ? extends Ei> fl,
                                                              Function<? super Eo, ? extends Eon> fr) {
        return new DcbDecider<>(decider.<Ein, Eon>dimapOnEvent(fl, fr));
    }

    public <Sn> DcbDecider<C, Sn, Ei, Eo> dimapOnState(Function<? super Sn, ? extends S> fl,
                                                       Function<? super S, ? extends Sn> fr) {
        return new DcbDecider<>(decider.<Sn, Sn>dimapOnState(fl, fr));
    }

    /**
     * Combine this decider with <code>other</code>, see {@link Decider#combine(Decider, Decider, StateMerge)}
     */
    public <C2, S2, Sc, Ei2, Eo2> DcbDecider<Union<C, C2>, Sc, Union<Ei, Ei2>, Union<Eo, Eo2>> combine(DcbDecider<C2, S2, Ei2, Eo2> other,
                                                                                                        StateMerge<S, S2, Sc> stateMerge) {
        requireNonNull(other, "No other decider provided");
        return new DcbDecider<>(Decider.combine(decider, other.decider, stateMerge));
    }

    /**
     * Combine this decider with <code>other</code>, see {@link Decider#combineViaTuples(Decider, Decider)}
     */
    public <C2, S2, Ei2, Eo2> DcbDecider<Union<C, C2>, Pair<S, S2>, Union<Ei, Ei2>, Union<Eo, Eo2>> combineViaTuples(DcbDecider<C2, S2, Ei2, Eo2> other) {
        requireNonNull(other, "No other decider provided");
        return new DcbDecider<>(Decider.combineViaTuples(decider, other.decider));
    }

    @Override
    public String toString() {
        return "DcbDecider{" +
                "initialState=" + initialState() +
                '}';
    }
}
