package dk.cloudcreate.eventsourcing.eventstore.eventstream;

import dk.cloudcreate.eventsourcing.eventstore.types.*;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The (possibly partial) ordered sequence of {@link PersistedEvent}'s belonging to one aggregate instance.<br>
 * {@link #version()} is the version of the stream after the last event included, i.e. after an append it's the new stream version.
 *
 * @param <ID> the aggregate id type
 */
public class AggregateEventStream<ID> {
    private final AggregateType        aggregateType;
    private final ID                   aggregateId;
    private final StreamVersion        version;
    private final List<PersistedEvent> events;

    private AggregateEventStream(AggregateType aggregateType, ID aggregateId, StreamVersion version, List<PersistedEvent> events) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.version = requireNonNull(version, "No version provided");
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
        requireTrue(this.events.size() <= version.longValue(),
                    msg("[{}] Stream for aggregate '{}' contains {} events, which is more than its version {}",
                        aggregateType, aggregateId, this.events.size(), version));
    }

    public static <ID> AggregateEventStream<ID> of(AggregateType aggregateType, ID aggregateId, StreamVersion version, List<PersistedEvent> events) {
        return new AggregateEventStream<>(aggregateType, aggregateId, version, events);
    }

    public static <ID> AggregateEventStream<ID> empty(AggregateType aggregateType, ID aggregateId) {
        return new AggregateEventStream<>(aggregateType, aggregateId, StreamVersion.NO_EVENTS, List.of());
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }

    public ID aggregateId() {
        return aggregateId;
    }

    /**
     * The stream version after the last event included in this {@link AggregateEventStream}
     */
    public StreamVersion version() {
        return version;
    }

    public List<PersistedEvent> eventList() {
        return events;
    }

    public Stream<PersistedEvent> stream() {
        return events.stream();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    /**
     * The {@link EventOrder} of the first event included, or {@link Optional#empty()} if this stream is empty
     */
    public Optional<EventOrder> firstEventOrder() {
        return isEmpty() ? Optional.empty() : Optional.of(events.get(0).eventOrder());
    }

    public <R> Stream<R> map(Function<PersistedEvent, R> mapper) {
        requireNonNull(mapper, "No mapper provided");
        return events.stream().map(mapper);
    }

    @Override
    public String toString() {
        return "AggregateEventStream{" +
                "aggregateType=" + aggregateType +
                ", aggregateId=" + aggregateId +
                ", version=" + version +
                ", numberOfEvents=" + events.size() +
                '}';
    }
}
