package dk.cloudcreate.essentials.components.eventsourced.deciders;

import dk.cloudcreate.essentials.components.eventsourced.deciders.decider.counter.CounterEvent.Incremented;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DeciderExceptionTest {
    @Test
    void verify_domain_rule_violations_are_decider_exceptions() {
        var exception = new DomainRuleViolationException("ORDER_EXISTS", "Order 'order-1' already exists");

        assertThat(exception).isInstanceOf(DeciderException.class)
                             .hasMessage("Order 'order-1' already exists");
        assertThat(exception.reason()).isEqualTo("ORDER_EXISTS");
        assertThat(new DomainRuleViolationException("ORDER_EXISTS")).hasMessage("ORDER_EXISTS");
    }

    @Test
    void verify_unreachable_variants_are_decider_exceptions() {
        var exception = UnreachableVariantException.unreachable(new Incremented(1));

        assertThat(exception).isInstanceOf(DeciderException.class)
                             .hasMessageContaining(Incremented.class.getName());
    }
}
