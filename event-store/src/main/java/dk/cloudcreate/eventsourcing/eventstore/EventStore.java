package dk.cloudcreate.eventsourcing.eventstore;

import dk.cloudcreate.eventsourcing.eventstore.eventstream.*;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.*;
import dk.cloudcreate.eventsourcing.eventstore.types.*;

import java.util.List;

/**
 * Append-only store of aggregate event streams.<br>
 * A stream is identified by its {@link AggregateType} and aggregate id. Events in a stream are never modified, deleted or reordered.<br>
 * <br>
 * The only consistency mechanism is the <b>expected version</b> presented when appending: the version check and the append
 * are performed atomically per stream, so of two writers that read the same version only the first one succeeds
 * and the other gets an {@link OptimisticAppendToStreamException}. Appends to different streams never contend with each other.
 */
public interface EventStore {
    /**
     * Append events to the end of an aggregate's stream, but only if the stream's current version is <code>expectedVersion</code>.<br>
     * Either all <code>events</code> are appended or none of them are.<br>
     * Appending an empty list of events verifies the <code>expectedVersion</code> but appends nothing.
     *
     * @param aggregateType   the aggregate type the stream belongs to
     * @param aggregateId     the id of the aggregate that owns the stream
     * @param expectedVersion the version of the stream the caller based its decision on ({@link StreamVersion#NO_EVENTS} for a new stream)
     * @param events          the events to append (in order)
     * @param <ID>            the aggregate id type
     * @return a stream containing only the newly appended events, with {@link AggregateEventStream#version()} being the new stream version
     * @throws OptimisticAppendToStreamException in case the current version of the stream differs from <code>expectedVersion</code>
     * @throws JSONSerializationException        in case one of the events couldn't be serialized (nothing is appended)
     * @throws AppendToStreamException           in case the storage failed; the outcome is unknown and the stream must be re-read before retrying
     */
    <ID> AggregateEventStream<ID> appendToStream(AggregateType aggregateType,
                                                 ID aggregateId,
                                                 StreamVersion expectedVersion,
                                                 List<?> events);

    /**
     * Fetch all events in an aggregate's stream in the order they were appended
     *
     * @param aggregateType the aggregate type the stream belongs to
     * @param aggregateId   the id of the aggregate that owns the stream
     * @param <ID>          the aggregate id type
     * @return the stream, which is empty (with version {@link StreamVersion#NO_EVENTS}) if no events have been appended for the aggregate
     */
    default <ID> AggregateEventStream<ID> fetchStream(AggregateType aggregateType,
                                                      ID aggregateId) {
        return fetchStream(aggregateType, aggregateId, EventOrder.FIRST_EVENT_ORDER);
    }

    /**
     * Fetch the events in an aggregate's stream starting with the event at position <code>fromEventOrder</code>
     *
     * @param aggregateType  the aggregate type the stream belongs to
     * @param aggregateId    the id of the aggregate that owns the stream
     * @param fromEventOrder the event order of the first event to include
     * @param <ID>           the aggregate id type
     * @return the matching events; {@link AggregateEventStream#version()} is always the current version of the stream
     */
    <ID> AggregateEventStream<ID> fetchStream(AggregateType aggregateType,
                                              ID aggregateId,
                                              EventOrder fromEventOrder);

    /**
     * Get the current version of an aggregate's stream without loading any events
     *
     * @return the number of events in the stream
     */
    StreamVersion currentVersion(AggregateType aggregateType, Object aggregateId);
}
