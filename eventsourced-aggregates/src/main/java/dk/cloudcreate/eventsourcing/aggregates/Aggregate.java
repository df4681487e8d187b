package dk.cloudcreate.eventsourcing.aggregates;

import dk.cloudcreate.eventsourcing.eventstore.eventstream.AggregateEventStream;
import dk.cloudcreate.eventsourcing.eventstore.types.StreamVersion;

/**
 * Common interface for all event sourced aggregates.<br>
 * An aggregate's state is derived only from the events in its stream, which are applied using {@link #rehydrate(AggregateEventStream)}
 *
 * @param <ID>             the aggregate id (or stream-id) type
 * @param <AGGREGATE_TYPE> the concrete aggregate type
 */
public interface Aggregate<ID, AGGREGATE_TYPE extends Aggregate<ID, AGGREGATE_TYPE>> {
    /**
     * The id of the aggregate (aka. the stream-id)
     *
     * @return the aggregate id or <code>null</code> if no events have been applied yet
     */
    ID aggregateId();

    /**
     * Has the aggregate gained its identity, i.e. has at least one event been applied
     */
    default boolean hasIdentity() {
        return aggregateId() != null;
    }

    /**
     * The number of events applied to the aggregate instance, which is the expected version to use when
     * appending the events produced by this instance's commands
     */
    StreamVersion version();

    /**
     * Has the aggregate been initialized using previously persisted events using the {@link #rehydrate(AggregateEventStream)} method
     */
    boolean hasBeenRehydrated();

    /**
     * Effectively performs a leftFold over all the previously persisted events related to this aggregate instance
     *
     * @param persistedEvents the previous persisted events related to this aggregate instance, aka. the aggregates history
     * @return the same aggregate instance (self)
     */
    AGGREGATE_TYPE rehydrate(AggregateEventStream<ID> persistedEvents);
}
