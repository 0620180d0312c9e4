package dk.cloudcreate.essentials.components.eventsourced.deciders.decider.restaurant;

import dk.cloudcreate.essentials.components.eventsourced.deciders.*;
import dk.cloudcreate.essentials.components.eventsourced.deciders.decider.DcbDecider;

import java.math.BigDecimal;
import java.util.List;

/**
 * Decides whether an order can be placed. The decision needs both the restaurant's menu and the already created orders,
 * but the decider only ever produces {@link OrderCreated} events
 */
public final class PlaceOrderDecider {
    public static final String INVALID_QUANTITY = "INVALID_QUANTITY";

    private PlaceOrderDecider() {
    }

    public static DcbDecider<PlaceOrder, RestaurantAndOrderState, PlaceOrderInputEvent, OrderCreated> create() {
        return new DcbDecider<>(PlaceOrderDecider::decide,
                                PlaceOrderDecider::evolve,
                                RestaurantAndOrderState.INITIAL);
    }

    static List<OrderCreated> decide(PlaceOrder command, RestaurantAndOrderState state) {
        if (command.quantity <= 0) {
            throw new DomainRuleViolationException(INVALID_QUANTITY, "Quantity must be positive, was " + command.quantity);
        }
        if (state.existingOrderIds.contains(command.orderId)) {
            return List.of();
        }
        return state.availableMenu()
                    .flatMap(menu -> menu.items.stream()
                                               .filter(item -> item.available && item.menuItemId.equals(command.menuItemId))
                                               .findFirst()
                                               .map(item -> new OrderCreated(menu.restaurantId,
                                                                             command.orderId,
                                                                             command.customerId,
                                                                             item.menuItemId,
                                                                             command.quantity,
                                                                             item.price,
                                                                             item.price.multiply(BigDecimal.valueOf(command.quantity)),
                                                                             command.placedAt)))
                    .map(orderCreated -> List.of(orderCreated))
                    .orElse(List.of());
    }

    static RestaurantAndOrderState evolve(RestaurantAndOrderState state, PlaceOrderInputEvent event) {
        if (event instanceof RestaurantMenuPublished) {
            return state.withMenu((RestaurantMenuPublished) event);
        } else if (event instanceof OrderCreated) {
            return state.withOrder(((OrderCreated) event).orderId);
        }
        throw UnreachableVariantException.unreachable(event);
    }
}
