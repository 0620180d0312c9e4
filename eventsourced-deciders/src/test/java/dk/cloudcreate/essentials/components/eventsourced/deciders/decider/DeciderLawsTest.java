package dk.cloudcreate.essentials.components.eventsourced.deciders.decider;

import dk.cloudcreate.essentials.components.eventsourced.deciders.decider.counter.*;
import dk.cloudcreate.essentials.components.eventsourced.deciders.decider.counter.CounterCommand.*;
import dk.cloudcreate.essentials.components.eventsourced.deciders.decider.counter.CounterEvent.*;
import dk.cloudcreate.essentials.components.eventsourced.deciders.types.Union;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.*;

import java.util.*;
import java.util.stream.*;

import static dk.cloudcreate.essentials.components.eventsourced.deciders.decider.counter.CounterDeciders.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Properties that must hold for any event history, verified against generated histories
 */
@DisplayName("Decider laws")
class DeciderLawsTest {
    private static final int NUMBER_OF_HISTORIES = 50;

    static Stream<Arguments> historiesAndCommands() {
        var random = new Random(4711);
        return IntStream.range(0, NUMBER_OF_HISTORIES)
                        .mapToObj(i -> Arguments.of(randomHistory(random, random.nextInt(12)),
                                                    randomCommand(random)));
    }

    static Stream<Arguments> histories() {
        var random = new Random(1234);
        return IntStream.range(0, NUMBER_OF_HISTORIES)
                        .mapToObj(i -> Arguments.of(randomHistory(random, random.nextInt(20))));
    }

    private static List<CounterEvent> randomHistory(Random random, int length) {
        var history = new ArrayList<CounterEvent>(length);
        for (int i = 0; i < length; i++) {
            switch (random.nextInt(3)) {
                case 0:
                    history.add(new Incremented(random.nextInt(100)));
                    break;
                case 1:
                    history.add(new Decremented(random.nextInt(100)));
                    break;
                default:
                    history.add(new ResetDone());
            }
        }
        return history;
    }

    private static CounterCommand randomCommand(Random random) {
        switch (random.nextInt(3)) {
            case 0:
                return new Increment(random.nextInt(100));
            case 1:
                return new Decrement(random.nextInt(100));
            default:
                return new Reset();
        }
    }

    private static <S, E> S fold(StateStoredDecisionModel<?, S, E> decider, List<? extends E> events) {
        var state = decider.initialState();
        for (E event : events) {
            state = decider.evolve(state, event);
        }
        return state;
    }

    @ParameterizedTest
    @MethodSource("historiesAndCommands")
    void verify_state_stored_and_event_sourced_computations_agree(List<CounterEvent> history, CounterCommand command) {
        // Given
        var decider = combinedCounterDecider();

        // When
        var newEvents       = decider.computeNewEvents(history, command);
        var stateStored     = decider.computeNewState(fold(decider, history), command);
        var extendedHistory = new ArrayList<CounterEvent>(history);
        extendedHistory.addAll(newEvents);

        // Then
        assertThat(stateStored).isEqualTo(fold(decider, extendedHistory));
    }

    @ParameterizedTest
    @MethodSource("histories")
    void verify_each_half_of_a_tuple_combined_state_is_only_evolved_by_its_own_events(List<CounterEvent> history) {
        // Given
        var combined = incrementDecider().combineViaTuples(decrementDecider());
        var unionHistory = history.stream()
                                  .filter(event -> !(event instanceof ResetDone))
                                  .map(event -> event instanceof Incremented ?
                                                Union.<Incremented, Decremented>first((Incremented) event) :
                                                Union.<Incremented, Decremented>second((Decremented) event))
                                  .collect(Collectors.toList());

        // When
        var state = fold(combined, unionHistory);

        // Then
        var incrementEvents = unionHistory.stream().flatMap(event -> event.firstValue().stream()).collect(Collectors.toList());
        var decrementEvents = unionHistory.stream().flatMap(event -> event.secondValue().stream()).collect(Collectors.toList());
        assertThat(state._1()).isEqualTo(fold(incrementDecider(), incrementEvents));
        assertThat(state._2()).isEqualTo(fold(decrementDecider(), decrementEvents));
    }

    @ParameterizedTest
    @MethodSource("histories")
    void verify_the_combined_counter_agrees_with_the_single_counter_per_operation(List<CounterEvent> history) {
        // When
        var combinedState = fold(combinedCounterDecider(), history);

        // Then
        var incremented = history.stream().filter(Incremented.class::isInstance).mapToInt(event -> ((Incremented) event).amount).sum();
        var decremented = history.stream().filter(Decremented.class::isInstance).mapToInt(event -> ((Decremented) event).amount).sum();
        assertThat(combinedState.incrementState).isEqualTo(new CounterState(incremented));
        assertThat(combinedState.decrementState).isEqualTo(new CounterState(-decremented));
        assertThat(combinedState.resetState).isEqualTo(CounterState.ZERO);
    }
}
