package dk.cloudcreate.eventsourcing.accounts.commands;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.eventsourcing.accounts.*;
import dk.cloudcreate.eventsourcing.aggregates.flex.EventsToPersist;

import java.math.BigDecimal;

public class DepositMoney implements AccountCommand {
    public final BigDecimal amount;

    @JsonCreator
    public DepositMoney(@JsonProperty("amount") BigDecimal amount) {
        this.amount = amount;
    }

    @Override
    public EventsToPersist<AccountId> executeOn(AccountId accountId, Account account) {
        return account.deposit(amount);
    }

    @Override
    public String toString() {
        return "DepositMoney{amount=" + amount + '}';
    }
}
