package dk.cloudcreate.eventsourcing.accounts.commands;

import dk.cloudcreate.eventsourcing.accounts.*;
import dk.cloudcreate.eventsourcing.aggregates.flex.EventsToPersist;

/**
 * A command submitted for an {@link Account}. The name a command is submitted under is its simple class name.
 */
public interface AccountCommand {
    /**
     * @param accountId the id of the targeted account
     * @param account   the account replayed from its stream (without identity if the account doesn't exist yet)
     * @return the events produced by the command
     */
    EventsToPersist<AccountId> executeOn(AccountId accountId, Account account);

    /**
     * Does this command create the account
     */
    default boolean isCreationCommand() {
        return false;
    }
}
