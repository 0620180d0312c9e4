package dk.cloudcreate.essentials.components.eventsourced.deciders;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when a command, event, action result or action variant reaches a <code>decide</code>, <code>evolve</code>,
 * <code>react</code> or <code>pending</code> function that has no branch for it.<br>
 * Java 17 can't statically check that an <code>if/else instanceof</code> chain covers a whole class hierarchy, so
 * the final <code>else</code> branch must fail loudly instead of returning the state unmodified:
 * <pre>{@code
 * (state, event) -> {
 *     if (event instanceof Incremented) {
 *         return new CounterState(state.value + ((Incremented) event).amount);
 *     } else if (event instanceof Decremented) {
 *         return new CounterState(state.value - ((Decremented) event).amount);
 *     }
 *     throw UnreachableVariantException.unreachable(event);
 * }
 * }</pre>
 * Components combined using <code>combine</code>/<code>combineViaTuples</code> only ever receive their own variants, so
 * hitting this exception always points to a modeling bug.
 */
public class UnreachableVariantException extends DeciderException {
    private final Object variant;

    public UnreachableVariantException(Object variant) {
        super(msg("Unreachable variant '{}' of type '{}'",
                  variant,
                  variant != null ? variant.getClass().getName() : "null"));
        this.variant = variant;
    }

    /**
     * Create an {@link UnreachableVariantException} for the given variant.<br>
     * Intended to be used as <code>throw unreachable(event)</code>
     *
     * @param variant the command/event/action variant that wasn't expected
     * @return the exception
     */
    public static UnreachableVariantException unreachable(Object variant) {
        return new UnreachableVariantException(variant);
    }

    /**
     * The variant that wasn't handled
     */
    public Object variant() {
        return variant;
    }
}
