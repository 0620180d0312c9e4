package dk.cloudcreate.essentials.components.eventsourced.deciders.decider.counter;

public abstract class CounterCommand {
    private CounterCommand() {
    }

    public static final class Increment extends CounterCommand {
        public final int amount;

        public Increment(int amount) {
            this.amount = amount;
        }

        @Override
        public String toString() {
            return "Increment(" + amount + ")";
        }
    }

    public static final class Decrement extends CounterCommand {
        public final int amount;

        public Decrement(int amount) {
            this.amount = amount;
        }

        @Override
        public String toString() {
            return "Decrement(" + amount + ")";
        }
    }

    public static final class Reset extends CounterCommand {
        @Override
        public String toString() {
            return "Reset";
        }
    }
}
