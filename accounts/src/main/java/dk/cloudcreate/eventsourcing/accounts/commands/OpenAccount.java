package dk.cloudcreate.eventsourcing.accounts.commands;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.eventsourcing.accounts.*;
import dk.cloudcreate.eventsourcing.aggregates.flex.EventsToPersist;

public class OpenAccount implements AccountCommand {
    public final String owner;

    @JsonCreator
    public OpenAccount(@JsonProperty("owner") String owner) {
        this.owner = owner;
    }

    @Override
    public EventsToPersist<AccountId> executeOn(AccountId accountId, Account account) {
        return account.open(accountId, owner);
    }

    @Override
    public boolean isCreationCommand() {
        return true;
    }

    @Override
    public String toString() {
        return "OpenAccount{owner='" + owner + "'}";
    }
}
