package dk.cloudcreate.eventsourcing.accounts;

import dk.cloudcreate.eventsourcing.accounts.AccountEvent.*;
import dk.cloudcreate.eventsourcing.aggregates.*;
import dk.cloudcreate.eventsourcing.aggregates.flex.*;

import java.math.BigDecimal;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Bank account whose owner and balance are derived from its {@link AccountEvent}'s.<br>
 * The balance can never become negative: a withdrawal larger than the balance is rejected.
 */
public class Account extends FlexAggregate<AccountId, Account> {
    private String     owner;
    private BigDecimal balance = BigDecimal.ZERO;

    public EventsToPersist<AccountId> open(AccountId accountId, String owner) {
        requireNonNull(accountId, "You must provide an accountId");
        requireNoIdentity("open the Account");
        if (owner == null || owner.isBlank()) {
            throw new ValidationException("An Account must have an owner");
        }
        return EventsToPersist.initialAggregateEvents(accountId, new AccountOpened(accountId, owner));
    }

    public EventsToPersist<AccountId> deposit(BigDecimal amount) {
        requireIdentity("deposit money");
        requirePositive(amount);
        return events(new MoneyDeposited(aggregateId(), amount));
    }

    public EventsToPersist<AccountId> withdraw(BigDecimal amount) {
        requireIdentity("withdraw money");
        requirePositive(amount);
        if (balance.compareTo(amount) < 0) {
            throw new ValidationException(msg("Insufficient funds: cannot withdraw {} from Account '{}' with balance {}",
                                              amount,
                                              aggregateId(),
                                              balance));
        }
        return events(new MoneyWithdrawn(aggregateId(), amount));
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(msg("The amount must be positive, but was {}", amount));
        }
    }

    public String owner() {
        return owner;
    }

    public BigDecimal balance() {
        return balance;
    }

    @EventHandler
    private void on(AccountOpened e) {
        owner = e.owner;
    }

    @EventHandler
    private void on(MoneyDeposited e) {
        balance = balance.add(e.amount);
    }

    @EventHandler
    private void on(MoneyWithdrawn e) {
        balance = balance.subtract(e.amount);
    }

    @Override
    public String toString() {
        return "Account{" +
                "accountId=" + aggregateId() +
                ", owner='" + owner + '\'' +
                ", balance=" + balance +
                ", version=" + version() +
                '}';
    }
}
