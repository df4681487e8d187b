package dk.cloudcreate.eventsourcing.aggregates.command;

import dk.cloudcreate.eventsourcing.aggregates.*;
import dk.cloudcreate.eventsourcing.aggregates.flex.*;
import dk.cloudcreate.eventsourcing.eventstore.OptimisticAppendToStreamException;
import org.slf4j.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Handles commands for one aggregate type: load the aggregate by replaying its stream, execute the command
 * and append the resulting events using the version the aggregate was loaded at as expected version.<br>
 * If the append is rejected with an {@link OptimisticAppendToStreamException} the whole cycle is repeated against the
 * fresh state, as long as the {@link ConcurrencyRetryPolicy} allows it. After that the conflict is thrown to the caller.<br>
 * {@link ValidationException}'s, {@link ReplayException}'s and store failures are always thrown without retrying.
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the concrete aggregate type
 */
public class AggregateCommandHandler<ID, AGGREGATE_TYPE extends FlexAggregate<ID, AGGREGATE_TYPE>> {
    private static final Logger log = LoggerFactory.getLogger(AggregateCommandHandler.class);

    private final FlexAggregateRepository<ID, AGGREGATE_TYPE> repository;
    private final ConcurrencyRetryPolicy                      retryPolicy;

    public AggregateCommandHandler(FlexAggregateRepository<ID, AGGREGATE_TYPE> repository,
                                   ConcurrencyRetryPolicy retryPolicy) {
        this.repository = requireNonNull(repository, "No repository provided");
        this.retryPolicy = requireNonNull(retryPolicy, "No retryPolicy provided");
    }

    public FlexAggregateRepository<ID, AGGREGATE_TYPE> repository() {
        return repository;
    }

    /**
     * @param aggregateId the id of the aggregate the command is targeting (the aggregate doesn't need to exist yet)
     * @param command     the command to execute against the loaded aggregate
     * @return the new version and the appended events
     * @throws ValidationException               if the aggregate rejected the command
     * @throws OptimisticAppendToStreamException if the aggregate was concurrently modified and the {@link ConcurrencyRetryPolicy} is exhausted
     */
    public CommandResult<ID> handle(ID aggregateId, AggregateCommand<ID, AGGREGATE_TYPE> command) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(command, "No command provided");
        var numberOfRetries = 0;
        while (true) {
            try {
                return handleOnce(aggregateId, command);
            } catch (OptimisticAppendToStreamException e) {
                if (!retryPolicy.shouldRetry(numberOfRetries)) {
                    log.debug("[{}] Giving up on command for aggregate '{}' after {} retries: {}",
                              repository.aggregateType(),
                              aggregateId,
                              numberOfRetries,
                              e.getMessage());
                    throw e;
                }
                var retryDelay = retryPolicy.calculateRetryDelay(numberOfRetries);
                numberOfRetries++;
                log.warn("[{}] Concurrent modification of aggregate '{}' (expected version {}, actual version {}). Retry {} of {} in {} ms",
                         repository.aggregateType(),
                         aggregateId,
                         e.expectedVersion(),
                         e.actualVersion(),
                         numberOfRetries,
                         retryPolicy.maximumNumberOfRetries,
                         retryDelay.toMillis());
                sleep(retryDelay.toMillis(), e);
            }
        }
    }

    private CommandResult<ID> handleOnce(ID aggregateId, AggregateCommand<ID, AGGREGATE_TYPE> command) {
        var aggregate = repository.loadOrCreateEmpty(aggregateId);
        log.trace("[{}] Executing command on aggregate '{}' at version {}", repository.aggregateType(), aggregateId, aggregate.version());
        var eventsToPersist = requireNonNull(command.executeOn(aggregate), "The command didn't return an EventsToPersist instance");
        if (!aggregateId.equals(eventsToPersist.aggregateId)) {
            throw new AggregateException(msg("The command targeting aggregate '{}' produced events for aggregate '{}'",
                                             aggregateId,
                                             eventsToPersist.aggregateId));
        }
        var appendedEvents = repository.persist(eventsToPersist);
        log.debug("[{}] Aggregate '{}' is now at version {} after appending {} event(s)",
                  repository.aggregateType(),
                  aggregateId,
                  appendedEvents.version(),
                  appendedEvents.size());
        return new CommandResult<>(aggregateId, appendedEvents);
    }

    private static void sleep(long millis, OptimisticAppendToStreamException conflict) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            conflict.addSuppressed(e);
            throw conflict;
        }
    }
}
