package dk.cloudcreate.essentials.components.eventsourced.deciders.test.account;

public abstract class AccountCommand {
    public final AccountId accountId;
    public final long      amount;

    private AccountCommand(AccountId accountId, long amount) {
        this.accountId = accountId;
        this.amount = amount;
    }

    public static final class Deposit extends AccountCommand {
        public Deposit(AccountId accountId, long amount) {
            super(accountId, amount);
        }
    }

    public static final class Withdraw extends AccountCommand {
        public Withdraw(AccountId accountId, long amount) {
            super(accountId, amount);
        }
    }
}
