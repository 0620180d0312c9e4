package dk.cloudcreate.essentials.components.eventsourced.deciders.application;

import dk.cloudcreate.essentials.components.eventsourced.deciders.DomainRuleViolationException;
import dk.cloudcreate.essentials.components.eventsourced.deciders.process.fulfillment.*;
import dk.cloudcreate.essentials.components.eventsourced.deciders.process.fulfillment.FulfillmentAction.*;
import dk.cloudcreate.essentials.components.eventsourced.deciders.process.fulfillment.OrderActionResult.*;
import org.junit.jupiter.api.*;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ProcessManagerHandlerTest {
    private static final String     ORDER_ID = "order-42";
    private static final BigDecimal AMOUNT   = new BigDecimal("250.00");

    private InMemoryStateRepository<String, FulfillmentState>                          stateRepository;
    private RecordingActionPublisher<FulfillmentAction>                                actionPublisher;
    private ProcessManagerHandler<OrderActionResult, String, FulfillmentState, FulfillmentAction> handler;

    @BeforeEach
    void setup() {
        stateRepository = new InMemoryStateRepository<>();
        actionPublisher = new RecordingActionPublisher<>();
        handler = ProcessManagerHandler.from(OrderFulfillmentProcess.create(),
                                             stateRepository,
                                             actionPublisher,
                                             actionResult -> actionResult.orderId);
    }

    @Test
    void verify_the_reactions_to_all_new_events_are_published() {
        // When
        var actions = handler.handle(new OrderCreated(ORDER_ID, AMOUNT));

        // Then
        assertThat(actions).containsExactly(new UpdateAnalytics("processing"),
                                            new ProcessPayment(ORDER_ID, AMOUNT));
        assertThat(actionPublisher.published()).containsExactly(actions);
        assertThat(stateRepository.loadState(ORDER_ID)).hasValueSatisfying(state -> assertThat(state.isInProgress(FulfillmentTask.PAYMENT)).isTrue());
    }

    @Test
    void verify_the_process_continues_from_the_stored_state() {
        // Given
        handler.handle(new OrderCreated(ORDER_ID, AMOUNT));

        // When
        var afterPayment   = handler.handle(new PaymentProcessed(ORDER_ID));
        var afterInventory = handler.handle(new InventoryReserved(ORDER_ID));
        var afterShipment  = handler.handle(new ShipmentScheduled(ORDER_ID));

        // Then
        assertThat(afterPayment).containsExactly(new ReserveInventory(ORDER_ID));
        assertThat(afterInventory).containsExactly(new ScheduleShipment(ORDER_ID));
        assertThat(afterShipment).containsExactly(new UpdateAnalytics("shipped"));
        assertThat(handler.pendingActions(ORDER_ID)).containsExactly(new UpdateAnalytics("shipped"));
    }

    @Test
    void verify_the_state_is_saved_but_nothing_is_published_when_there_are_no_actions() {
        // Given
        handler.handle(new OrderCreated(ORDER_ID, AMOUNT));
        handler.handle(new PaymentProcessed(ORDER_ID));
        var publishedBefore = actionPublisher.published().size();

        // When the payment result is delivered twice
        var actions = handler.handle(new PaymentProcessed(ORDER_ID));

        // Then
        assertThat(actions).isEmpty();
        assertThat(actionPublisher.published()).hasSize(publishedBefore);
        assertThat(stateRepository.saveCount()).isEqualTo(3);
    }

    @Test
    void verify_pending_actions_can_be_recomputed_for_a_stored_process() {
        // Given
        handler.handle(new OrderCreated(ORDER_ID, AMOUNT));

        // Then
        assertThat(handler.pendingActions(ORDER_ID)).containsExactly(new ProcessPayment(ORDER_ID, AMOUNT),
                                                                     new UpdateAnalytics("processing"));
        assertThat(handler.pendingActions("unknown-order")).isEqualTo(List.of());
    }

    @Test
    void verify_nothing_is_saved_or_published_when_the_process_throws() {
        assertThatThrownBy(() -> handler.handle(new PaymentProcessed(ORDER_ID)))
                .isExactlyInstanceOf(DomainRuleViolationException.class);
        assertThat(stateRepository.saveCount()).isZero();
        assertThat(actionPublisher.published()).isEmpty();
    }

    @Test
    void verify_actions_lost_by_a_failed_publish_are_recovered_from_the_pending_actions() {
        // Given
        var failingHandler = ProcessManagerHandler.<OrderActionResult, String, FulfillmentState, FulfillmentEvent, FulfillmentAction>from(
                OrderFulfillmentProcess.create(),
                stateRepository,
                actions -> {
                    throw new IllegalStateException("Transport unavailable");
                },
                actionResult -> actionResult.orderId);

        // When
        assertThatThrownBy(() -> failingHandler.handle(new OrderCreated(ORDER_ID, AMOUNT)))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Transport unavailable");

        // Then the state has advanced and the payment action is still pending
        assertThat(stateRepository.saveCount()).isEqualTo(1);
        assertThat(failingHandler.pendingActions(ORDER_ID)).contains(new ProcessPayment(ORDER_ID, AMOUNT));
        assertThat(handler.handle(new OrderCreated(ORDER_ID, AMOUNT))).isEmpty();
    }
}
