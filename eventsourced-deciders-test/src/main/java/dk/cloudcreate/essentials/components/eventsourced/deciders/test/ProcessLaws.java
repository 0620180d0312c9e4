package dk.cloudcreate.essentials.components.eventsourced.deciders.test;

import dk.cloudcreate.essentials.components.eventsourced.deciders.process.ProcessModel;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static org.assertj.core.api.Assertions.fail;

/**
 * Assertions for the laws that every process is expected to obey
 */
public final class ProcessLaws {
    private ProcessLaws() {
    }

    /**
     * Walk the <code>events</code> starting from <code>state</code> and assert, for every event, that the actions returned by
     * <code>react(state, event)</code> are contained (as a multiset) in <code>pending(evolve(state, event))</code>
     *
     * @param process the process
     * @param state   the state to start from
     * @param events  the events to apply (in order)
     * @return the state after all events have been applied
     */
    public static <S, E, A> S assertReactIsSubsetOfPending(ProcessModel<?, S, S, E, ?, A> process,
                                                           S state,
                                                           List<? extends E> events) {
        requireNonNull(process, "No process provided");
        requireNonNull(state, "No state provided");
        requireNonNull(events, "No events provided");
        var currentState = state;
        for (E event : events) {
            var reacted = process.react(currentState, event);
            currentState = process.evolve(currentState, event);
            var pending = process.pending(currentState);
            var missing = missingFrom(pending, reacted);
            if (!missing.isEmpty()) {
                fail("Event '%s' triggered action(s) %s that are not pending in the resulting state '%s'. Pending: %s",
                     event,
                     missing,
                     currentState,
                     pending);
            }
        }
        return currentState;
    }

    private static <A> List<A> missingFrom(List<A> pending, List<A> reacted) {
        var remaining = new ArrayList<>(pending);
        var missing   = new ArrayList<A>();
        for (A action : reacted) {
            if (!remaining.remove(action)) {
                missing.add(action);
            }
        }
        return missing;
    }
}
