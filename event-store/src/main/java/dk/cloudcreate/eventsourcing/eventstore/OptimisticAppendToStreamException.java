package dk.cloudcreate.eventsourcing.eventstore;

import dk.cloudcreate.eventsourcing.eventstore.eventstream.AggregateType;
import dk.cloudcreate.eventsourcing.eventstore.types.StreamVersion;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when the expected version presented to {@link EventStore#appendToStream(AggregateType, Object, StreamVersion, java.util.List)}
 * doesn't match the actual version of the stream, i.e. another writer appended events after the caller read the stream.<br>
 * Nothing was appended. The caller can re-read the stream, re-run its command and try again.
 */
public class OptimisticAppendToStreamException extends EventStoreException {
    private final AggregateType aggregateType;
    private final Object        aggregateId;
    private final StreamVersion expectedVersion;
    private final StreamVersion actualVersion;

    public OptimisticAppendToStreamException(AggregateType aggregateType,
                                             Object aggregateId,
                                             StreamVersion expectedVersion,
                                             StreamVersion actualVersion) {
        this(aggregateType, aggregateId, expectedVersion, actualVersion, null);
    }

    public OptimisticAppendToStreamException(AggregateType aggregateType,
                                             Object aggregateId,
                                             StreamVersion expectedVersion,
                                             StreamVersion actualVersion,
                                             Throwable cause) {
        super(msg("[{}] Concurrency conflict appending to the stream of aggregate with id '{}': expected version {} but the actual version is {}",
                  aggregateType,
                  aggregateId,
                  expectedVersion,
                  actualVersion),
              cause);
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.expectedVersion = requireNonNull(expectedVersion, "No expectedVersion provided");
        this.actualVersion = requireNonNull(actualVersion, "No actualVersion provided");
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }

    public Object aggregateId() {
        return aggregateId;
    }

    public StreamVersion expectedVersion() {
        return expectedVersion;
    }

    public StreamVersion actualVersion() {
        return actualVersion;
    }
}
