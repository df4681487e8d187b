package dk.cloudcreate.eventsourcing.eventstore.inmemory;

import dk.cloudcreate.eventsourcing.common.types.EventId;
import dk.cloudcreate.eventsourcing.eventstore.*;
import dk.cloudcreate.eventsourcing.eventstore.eventstream.*;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.*;
import dk.cloudcreate.eventsourcing.eventstore.types.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventStore} that keeps all streams in memory.<br>
 * Each stream has its own lock, which guards the version check and the append. Readers never take the lock: a stream's
 * events are held in an immutable list that's replaced on every append, so a reader always sees a complete prefix of the stream.<br>
 * Events are serialized using the configured {@link JSONSerializer} when they're appended, so the stored history is detached
 * from the objects the caller passed in and is read back through the same revision/upcasting path as a durable store.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final JSONSerializer                                                            jsonSerializer;
    private final Clock                                                                     clock;
    private final ConcurrentHashMap<AggregateType, ConcurrentHashMap<Object, StoredStream>> streams = new ConcurrentHashMap<>();

    public InMemoryEventStore(JSONSerializer jsonSerializer) {
        this(jsonSerializer, Clock.systemUTC());
    }

    public InMemoryEventStore(JSONSerializer jsonSerializer, Clock clock) {
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    public JSONSerializer getJsonSerializer() {
        return jsonSerializer;
    }

    @Override
    public <ID> AggregateEventStream<ID> appendToStream(AggregateType aggregateType,
                                                        ID aggregateId,
                                                        StreamVersion expectedVersion,
                                                        List<?> events) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(expectedVersion, "No expectedVersion provided");
        requireNonNull(events, "No events provided");

        // Serialize up front so a failing event leaves the stream untouched
        var serializedEvents = new ArrayList<EventJSON>(events.size());
        for (var event : events) {
            requireNonNull(event, msg("[{}] Cannot append a null event to the stream of aggregate '{}'", aggregateType, aggregateId));
            serializedEvents.add(jsonSerializer.serializeEvent(event));
        }

        // A stream is only registered once it receives events
        if (existingStream(aggregateType, aggregateId).isEmpty()) {
            if (!expectedVersion.equals(StreamVersion.NO_EVENTS)) {
                log.debug("[{}] Rejecting append of {} event(s) to unknown aggregate '{}': expected version {}",
                          aggregateType, events.size(), aggregateId, expectedVersion);
                throw new OptimisticAppendToStreamException(aggregateType, aggregateId, expectedVersion, StreamVersion.NO_EVENTS);
            }
            if (serializedEvents.isEmpty()) {
                return AggregateEventStream.of(aggregateType, aggregateId, StreamVersion.NO_EVENTS, List.of());
            }
        }

        var stream = streamFor(aggregateType, aggregateId);
        stream.lock.lock();
        try {
            var actualVersion = StreamVersion.of(stream.events.size());
            if (!actualVersion.equals(expectedVersion)) {
                log.debug("[{}] Rejecting append of {} event(s) to aggregate '{}': expected version {} but actual version is {}",
                          aggregateType, events.size(), aggregateId, expectedVersion, actualVersion);
                throw new OptimisticAppendToStreamException(aggregateType, aggregateId, expectedVersion, actualVersion);
            }
            if (serializedEvents.isEmpty()) {
                return AggregateEventStream.of(aggregateType, aggregateId, actualVersion, List.of());
            }

            var timestamp      = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
            var eventOrder     = actualVersion.nextEventOrder();
            var appendedEvents = new ArrayList<PersistedEvent>(serializedEvents.size());
            for (var serializedEvent : serializedEvents) {
                // Only the payload is kept, never the caller's event instance
                var storedEvent = new EventJSON(jsonSerializer,
                                                serializedEvent.getEventType(),
                                                serializedEvent.getEventRevision(),
                                                serializedEvent.getJson());
                appendedEvents.add(PersistedEvent.from(EventId.random(),
                                                       aggregateType,
                                                       aggregateId,
                                                       storedEvent,
                                                       eventOrder,
                                                       timestamp));
                eventOrder = eventOrder.increaseAndGet();
            }
            var newEvents = new ArrayList<PersistedEvent>(stream.events.size() + appendedEvents.size());
            newEvents.addAll(stream.events);
            newEvents.addAll(appendedEvents);
            stream.events = List.copyOf(newEvents);

            var newVersion = actualVersion.increaseBy(appendedEvents.size());
            log.debug("[{}] Appended {} event(s) to aggregate '{}'. Stream version {} -> {}",
                      aggregateType, appendedEvents.size(), aggregateId, actualVersion, newVersion);
            return AggregateEventStream.of(aggregateType, aggregateId, newVersion, appendedEvents);
        } finally {
            stream.lock.unlock();
        }
    }

    @Override
    public <ID> AggregateEventStream<ID> fetchStream(AggregateType aggregateType,
                                                     ID aggregateId,
                                                     EventOrder fromEventOrder) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(fromEventOrder, "No fromEventOrder provided");
        requireTrue(fromEventOrder.longValue() >= 0, msg("fromEventOrder must be >= 0 but was {}", fromEventOrder));

        var events = existingStream(aggregateType, aggregateId)
                .map(stream -> stream.events)
                .orElse(List.of());
        var version = StreamVersion.of(events.size());
        if (fromEventOrder.longValue() >= events.size()) {
            return AggregateEventStream.of(aggregateType, aggregateId, version, List.of());
        }
        return AggregateEventStream.of(aggregateType,
                                       aggregateId,
                                       version,
                                       events.subList((int) fromEventOrder.longValue(), events.size()));
    }

    @Override
    public StreamVersion currentVersion(AggregateType aggregateType, Object aggregateId) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        return existingStream(aggregateType, aggregateId)
                .map(stream -> StreamVersion.of(stream.events.size()))
                .orElse(StreamVersion.NO_EVENTS);
    }

    /**
     * Remove all streams belonging to the given {@link AggregateType}
     */
    public void resetEventStorageFor(AggregateType aggregateType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        log.info("[{}] Resetting in-memory event storage", aggregateType);
        streams.remove(aggregateType);
    }

    int numberOfStreams(AggregateType aggregateType) {
        return Optional.ofNullable(streams.get(aggregateType))
                       .map(ConcurrentHashMap::size)
                       .orElse(0);
    }

    private StoredStream streamFor(AggregateType aggregateType, Object aggregateId) {
        return streams.computeIfAbsent(aggregateType, type -> new ConcurrentHashMap<>())
                      .computeIfAbsent(aggregateId, id -> new StoredStream());
    }

    private Optional<StoredStream> existingStream(AggregateType aggregateType, Object aggregateId) {
        return Optional.ofNullable(streams.get(aggregateType))
                       .map(streamsForAggregateType -> streamsForAggregateType.get(aggregateId));
    }

    private static class StoredStream {
        private final    ReentrantLock        lock   = new ReentrantLock();
        private volatile List<PersistedEvent> events = List.of();
    }
}
