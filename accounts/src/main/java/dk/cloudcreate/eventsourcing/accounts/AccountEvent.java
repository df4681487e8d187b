package dk.cloudcreate.eventsourcing.accounts;

import com.fasterxml.jackson.annotation.*;

import java.math.BigDecimal;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The events of an {@link Account}.<br>
 * The set of events is closed: every subclass is declared here and {@link Account} has an {@link dk.cloudcreate.eventsourcing.aggregates.EventHandler} for each of them.
 */
public abstract class AccountEvent {
    public final AccountId accountId;

    private AccountEvent(AccountId accountId) {
        this.accountId = requireNonNull(accountId, "No accountId provided");
    }

    public static final class AccountOpened extends AccountEvent {
        public final String owner;

        @JsonCreator
        public AccountOpened(@JsonProperty("accountId") AccountId accountId,
                             @JsonProperty("owner") String owner) {
            super(accountId);
            this.owner = requireNonNull(owner, "No owner provided");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof AccountOpened)) return false;
            AccountOpened that = (AccountOpened) o;
            return accountId.equals(that.accountId) && owner.equals(that.owner);
        }

        @Override
        public int hashCode() {
            return Objects.hash(accountId, owner);
        }

        @Override
        public String toString() {
            return "AccountOpened{accountId=" + accountId + ", owner='" + owner + "'}";
        }
    }

    public static final class MoneyDeposited extends AccountEvent {
        public final BigDecimal amount;

        @JsonCreator
        public MoneyDeposited(@JsonProperty("accountId") AccountId accountId,
                              @JsonProperty("amount") BigDecimal amount) {
            super(accountId);
            this.amount = requireNonNull(amount, "No amount provided");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof MoneyDeposited)) return false;
            MoneyDeposited that = (MoneyDeposited) o;
            return accountId.equals(that.accountId) && amount.compareTo(that.amount) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(accountId, amount.stripTrailingZeros());
        }

        @Override
        public String toString() {
            return "MoneyDeposited{accountId=" + accountId + ", amount=" + amount + '}';
        }
    }

    public static final class MoneyWithdrawn extends AccountEvent {
        public final BigDecimal amount;

        @JsonCreator
        public MoneyWithdrawn(@JsonProperty("accountId") AccountId accountId,
                              @JsonProperty("amount") BigDecimal amount) {
            super(accountId);
            this.amount = requireNonNull(amount, "No amount provided");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof MoneyWithdrawn)) return false;
            MoneyWithdrawn that = (MoneyWithdrawn) o;
            return accountId.equals(that.accountId) && amount.compareTo(that.amount) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(accountId, amount.stripTrailingZeros());
        }

        @Override
        public String toString() {
            return "MoneyWithdrawn{accountId=" + accountId + ", amount=" + amount + '}';
        }
    }
}
