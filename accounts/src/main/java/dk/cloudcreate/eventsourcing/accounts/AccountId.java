package dk.cloudcreate.eventsourcing.accounts;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

public class AccountId extends CharSequenceType<AccountId> {

    public AccountId(CharSequence value) {
        super(value);
    }

    public static AccountId random() {
        return new AccountId(UUID.randomUUID().toString());
    }

    public static AccountId of(CharSequence id) {
        return new AccountId(id);
    }
}
