package dk.cloudcreate.essentials.components.eventsourced.deciders.test.account;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

public class AccountId extends CharSequenceType<AccountId> {

    protected AccountId(CharSequence value) {
        super(value);
    }

    public static AccountId random() {
        return new AccountId(UUID.randomUUID().toString());
    }

    public static AccountId of(CharSequence id) {
        return new AccountId(id);
    }
}
