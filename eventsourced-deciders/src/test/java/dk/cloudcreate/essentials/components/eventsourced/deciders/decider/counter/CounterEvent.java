package dk.cloudcreate.essentials.components.eventsourced.deciders.decider.counter;

import java.util.Objects;

public abstract class CounterEvent {
    private CounterEvent() {
    }

    public static final class Incremented extends CounterEvent {
        public final int amount;

        public Incremented(int amount) {
            this.amount = amount;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Incremented)) return false;
            return amount == ((Incremented) o).amount;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Incremented.class, amount);
        }

        @Override
        public String toString() {
            return "Incremented(" + amount + ")";
        }
    }

    public static final class Decremented extends CounterEvent {
        public final int amount;

        public Decremented(int amount) {
            this.amount = amount;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Decremented)) return false;
            return amount == ((Decremented) o).amount;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Decremented.class, amount);
        }

        @Override
        public String toString() {
            return "Decremented(" + amount + ")";
        }
    }

    public static final class ResetDone extends CounterEvent {
        @Override
        public boolean equals(Object o) {
            return o instanceof ResetDone;
        }

        @Override
        public int hashCode() {
            return ResetDone.class.hashCode();
        }

        @Override
        public String toString() {
            return "ResetDone";
        }
    }
}
