package dk.cloudcreate.essentials.components.eventsourced.deciders.application;

import dk.cloudcreate.essentials.components.eventsourced.deciders.DomainRuleViolationException;
import dk.cloudcreate.essentials.components.eventsourced.deciders.decider.restaurant.*;
import org.junit.jupiter.api.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class EventSourcedCommandHandlerTest {
    private static final RestaurantId restaurantId = RestaurantId.of("restaurant-123");
    private static final MenuItemId   menuItemId   = MenuItemId.of("item-789");
    private static final Instant      placedAt     = Instant.parse("2026-03-01T18:30:00Z");

    private InMemoryEventRepository<RestaurantId, PlaceOrderInputEvent, OrderCreated> eventRepository;
    private EventSourcedCommandHandler<PlaceOrder, RestaurantId, PlaceOrderInputEvent, OrderCreated> handler;

    @BeforeEach
    void setup() {
        eventRepository = new InMemoryEventRepository<>();
        handler = EventSourcedCommandHandler.from(PlaceOrderDecider.create(),
                                                  eventRepository,
                                                  command -> command.restaurantId);
    }

    @Test
    void verify_new_events_are_appended_and_loaded_for_the_next_command() {
        // Given
        eventRepository.given(restaurantId, List.of(new RestaurantMenuPublished(restaurantId,
                                                                                List.of(new MenuItem(menuItemId, "Lasagne", new BigDecimal("15.00"), true)))));
        var placeOrder = new PlaceOrder(restaurantId, OrderId.of("order-1"), CustomerId.of("customer-1"), menuItemId, 1, placedAt);

        // When
        var newEvents = handler.handle(placeOrder);

        // Then
        assertThat(newEvents).hasSize(1);
        assertThat(newEvents.get(0).totalAmount).isEqualByComparingTo("15.00");
        assertThat(eventRepository.loadEvents(restaurantId)).hasSize(2);
        assertThat(eventRepository.appendCount()).isEqualTo(1);

        // And when the same order is placed again, the appended OrderCreated is part of the decision
        assertThat(handler.handle(placeOrder)).isEmpty();
        assertThat(eventRepository.appendCount()).isEqualTo(1);
    }

    @Test
    void verify_nothing_is_appended_when_the_decider_throws() {
        var invalidOrder = new PlaceOrder(restaurantId, OrderId.of("order-1"), CustomerId.of("customer-1"), menuItemId, -1, placedAt);

        assertThatThrownBy(() -> handler.handle(invalidOrder))
                .isExactlyInstanceOf(DomainRuleViolationException.class);
        assertThat(eventRepository.appendCount()).isZero();
        assertThat(eventRepository.loadEvents(restaurantId)).isEmpty();
    }

    @Test
    void verify_missing_collaborators_are_rejected() {
        assertThatThrownBy(() -> EventSourcedCommandHandler.from(PlaceOrderDecider.create(), null, (PlaceOrder command) -> command.restaurantId))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
