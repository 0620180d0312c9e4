package dk.cloudcreate.essentials.components.eventsourced.deciders;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Base type for the typed domain failures a <code>decide</code> function can raise instead of returning events,
 * e.g. "Restaurant already exist!" or "Order does not exist!".<br>
 * The decider components never raise this exception themselves. They propagate it, unchanged, through every
 * refinement level and every combinator, so a caller can always catch the concrete sub type thrown by its own domain code.
 * <p>
 * Example:
 * <pre>{@code
 * public class RestaurantDoesNotExistException extends DomainRuleViolationException {
 *     public RestaurantDoesNotExistException(RestaurantId restaurantId) {
 *         super("Restaurant does not exist!", msg("Restaurant '{}' does not exist", restaurantId));
 *     }
 * }
 * }</pre>
 */
public class DomainRuleViolationException extends DeciderException {
    private final String reason;

    /**
     * @param reason the short (and stable) reason for the rule violation, e.g. "Order already exist!"
     */
    public DomainRuleViolationException(String reason) {
        super(requireNonNull(reason, "No reason provided"));
        this.reason = reason;
    }

    /**
     * @param reason  the short (and stable) reason for the rule violation, e.g. "Order already exist!"
     * @param message a more detailed message
     */
    public DomainRuleViolationException(String reason, String message) {
        super(message);
        this.reason = requireNonNull(reason, "No reason provided");
    }

    /**
     * The short (and stable) reason for the rule violation, which is suitable for comparisons in tests
     * and for mapping to an API error
     */
    public String reason() {
        return reason;
    }
}
