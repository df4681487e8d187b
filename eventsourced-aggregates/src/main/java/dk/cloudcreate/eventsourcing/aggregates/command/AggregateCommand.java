package dk.cloudcreate.eventsourcing.aggregates.command;

import dk.cloudcreate.eventsourcing.aggregates.flex.*;

/**
 * A command executed against a freshly loaded {@link FlexAggregate} instance.<br>
 * The command may be executed more than once if the {@link AggregateCommandHandler} retries after a concurrency conflict,
 * so it must not have any side effects besides the returned events.
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the concrete aggregate type
 */
@FunctionalInterface
public interface AggregateCommand<ID, AGGREGATE_TYPE extends FlexAggregate<ID, AGGREGATE_TYPE>> {
    EventsToPersist<ID> executeOn(AGGREGATE_TYPE aggregate);
}
