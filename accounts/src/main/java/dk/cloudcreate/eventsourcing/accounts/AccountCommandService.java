package dk.cloudcreate.eventsourcing.accounts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import dk.cloudcreate.eventsourcing.accounts.commands.*;
import dk.cloudcreate.eventsourcing.aggregates.ValidationException;
import dk.cloudcreate.eventsourcing.aggregates.command.*;
import dk.cloudcreate.eventsourcing.aggregates.flex.FlexAggregateRepository;
import dk.cloudcreate.eventsourcing.eventstore.EventStore;
import dk.cloudcreate.eventsourcing.eventstore.eventstream.*;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.JacksonJSONSerializer;
import org.slf4j.*;

import java.math.BigDecimal;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Entry point for the API or messaging layer: submits {@link AccountCommand}'s and serves the {@link Account} event streams.
 */
public class AccountCommandService {
    private static final Logger log = LoggerFactory.getLogger(AccountCommandService.class);

    public static final AggregateType ACCOUNTS = AggregateType.of("Accounts");
    /**
     * The aggregate id to submit an {@link OpenAccount} command with, to have a new random {@link AccountId} assigned
     */
    public static final String        NEW_ACCOUNT = "new";

    private static final Map<String, Class<? extends AccountCommand>> COMMANDS = Map.of(OpenAccount.class.getSimpleName(), OpenAccount.class,
                                                                                        DepositMoney.class.getSimpleName(), DepositMoney.class,
                                                                                        WithdrawMoney.class.getSimpleName(), WithdrawMoney.class);

    private final FlexAggregateRepository<AccountId, Account> repository;
    private final AggregateCommandHandler<AccountId, Account> commandHandler;
    private final ObjectMapper                                objectMapper;

    public AccountCommandService(EventStore eventStore, ConcurrencyRetryPolicy retryPolicy) {
        this(eventStore, retryPolicy, JacksonJSONSerializer.createDefaultObjectMapper());
    }

    public AccountCommandService(EventStore eventStore, ConcurrencyRetryPolicy retryPolicy, ObjectMapper objectMapper) {
        requireNonNull(eventStore, "No eventStore provided");
        this.repository = FlexAggregateRepository.from(eventStore, ACCOUNTS, AccountId.class, Account.class);
        this.commandHandler = new AggregateCommandHandler<>(repository, requireNonNull(retryPolicy, "No retryPolicy provided"));
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
    }

    /**
     * Submit a command by name
     *
     * @param aggregateId    the id of the account or {@link #NEW_ACCOUNT} to open an account with a random id
     * @param commandName    one of <code>OpenAccount</code>, <code>DepositMoney</code> or <code>WithdrawMoney</code>
     * @param commandPayload the command's properties as JSON
     * @return the new version of the account and the events the command produced
     * @throws ValidationException if the command is unknown, the payload is malformed or the account rejected the command
     * @throws dk.cloudcreate.eventsourcing.eventstore.OptimisticAppendToStreamException if the account was concurrently modified and retrying was exhausted
     */
    public CommandResult<AccountId> submit(String aggregateId, String commandName, JsonNode commandPayload) {
        requireNonNull(aggregateId, "No aggregateId provided");
        var commandType = COMMANDS.get(commandName);
        if (commandType == null) {
            throw new ValidationException(msg("Unknown command '{}'. Supported commands are {}", commandName, new TreeSet<>(COMMANDS.keySet())));
        }
        var command = parse(commandName, commandType, commandPayload);

        AccountId accountId;
        if (NEW_ACCOUNT.equals(aggregateId)) {
            if (!command.isCreationCommand()) {
                throw new ValidationException(msg("Command '{}' requires the id of an existing Account", commandName));
            }
            accountId = AccountId.random();
        } else {
            accountId = AccountId.of(aggregateId);
        }
        return handle(accountId, command);
    }

    public CommandResult<AccountId> open(AccountId accountId, String owner) {
        return handle(accountId, new OpenAccount(owner));
    }

    public CommandResult<AccountId> deposit(AccountId accountId, BigDecimal amount) {
        return handle(accountId, new DepositMoney(amount));
    }

    public CommandResult<AccountId> withdraw(AccountId accountId, BigDecimal amount) {
        return handle(accountId, new WithdrawMoney(amount));
    }

    public CommandResult<AccountId> handle(AccountId accountId, AccountCommand command) {
        requireNonNull(accountId, "No accountId provided");
        requireNonNull(command, "No command provided");
        log.debug("[{}] Handling {} for Account '{}'", ACCOUNTS, command, accountId);
        return commandHandler.handle(accountId, account -> command.executeOn(accountId, account));
    }

    /**
     * The ordered events of the account (empty if the account doesn't exist)
     */
    public AggregateEventStream<AccountId> getStream(AccountId accountId) {
        return repository.getEventStream(accountId);
    }

    /**
     * The account's current state, replayed from its events
     */
    public Optional<Account> getAccount(AccountId accountId) {
        return repository.tryLoad(accountId);
    }

    private AccountCommand parse(String commandName, Class<? extends AccountCommand> commandType, JsonNode commandPayload) {
        if (commandPayload == null || !commandPayload.isObject()) {
            throw new ValidationException(msg("The payload of command '{}' must be a JSON object", commandName));
        }
        try {
            return objectMapper.treeToValue(commandPayload, commandType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ValidationException(msg("Malformed payload for command '{}': {}", commandName, e.getMessage()), e);
        }
    }
}
