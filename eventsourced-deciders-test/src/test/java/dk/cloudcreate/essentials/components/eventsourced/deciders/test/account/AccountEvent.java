package dk.cloudcreate.essentials.components.eventsourced.deciders.test.account;

import java.util.Objects;

public abstract class AccountEvent {
    public final AccountId accountId;
    public final long      amount;

    private AccountEvent(AccountId accountId, long amount) {
        this.accountId = accountId;
        this.amount = amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        var that = (AccountEvent) o;
        return amount == that.amount && accountId.equals(that.accountId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), accountId, amount);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + accountId + ", " + amount + ")";
    }

    public static final class Deposited extends AccountEvent {
        public Deposited(AccountId accountId, long amount) {
            super(accountId, amount);
        }
    }

    public static final class Withdrawn extends AccountEvent {
        public Withdrawn(AccountId accountId, long amount) {
            super(accountId, amount);
        }
    }

    /**
     * The account balance dropped below the low balance threshold
     */
    public static final class LowBalanceDetected extends AccountEvent {
        public LowBalanceDetected(AccountId accountId, long balance) {
            super(accountId, balance);
        }
    }
}
