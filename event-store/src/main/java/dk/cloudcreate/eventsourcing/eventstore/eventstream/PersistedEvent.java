package dk.cloudcreate.eventsourcing.eventstore.eventstream;

import dk.cloudcreate.eventsourcing.common.types.EventId;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.EventJSON;
import dk.cloudcreate.eventsourcing.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The envelope of an Event that has been appended to an {@link AggregateEventStream}.<br>
 * A {@link PersistedEvent} is immutable: its {@link #timestamp()} is assigned when the event is appended and
 * its position in the stream, {@link #eventOrder()}, never changes.<br>
 * Two {@link PersistedEvent}'s are equal if they have the same {@link #eventId()}
 */
public final class PersistedEvent {
    private final EventId        eventId;
    private final AggregateType  aggregateType;
    private final Object         aggregateId;
    private final EventJSON      event;
    private final EventOrder     eventOrder;
    private final OffsetDateTime timestamp;

    private PersistedEvent(EventId eventId,
                           AggregateType aggregateType,
                           Object aggregateId,
                           EventJSON event,
                           EventOrder eventOrder,
                           OffsetDateTime timestamp) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.event = requireNonNull(event, "No event provided");
        this.eventOrder = requireNonNull(eventOrder, "No eventOrder provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    public static PersistedEvent from(EventId eventId,
                                      AggregateType aggregateType,
                                      Object aggregateId,
                                      EventJSON event,
                                      EventOrder eventOrder,
                                      OffsetDateTime timestamp) {
        return new PersistedEvent(eventId, aggregateType, aggregateId, event, eventOrder, timestamp);
    }

    public EventId eventId() {
        return eventId;
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }

    /**
     * The id of the aggregate whose stream this event belongs to
     */
    public Object aggregateId() {
        return aggregateId;
    }

    /**
     * The serialized event payload. Use {@link EventJSON#deserialize()} to get the Event object
     */
    public EventJSON event() {
        return event;
    }

    /**
     * The zero based position of this event within the aggregate's stream
     */
    public EventOrder eventOrder() {
        return eventOrder;
    }

    public EventType eventType() {
        return event.getEventType();
    }

    public EventRevision eventRevision() {
        return event.getEventRevision();
    }

    public OffsetDateTime timestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistedEvent)) return false;
        return eventId.equals(((PersistedEvent) o).eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return "PersistedEvent{" +
                "eventId=" + eventId +
                ", aggregateType=" + aggregateType +
                ", aggregateId=" + aggregateId +
                ", eventOrder=" + eventOrder +
                ", eventType=" + eventType() +
                ", eventRevision=" + eventRevision() +
                ", timestamp=" + timestamp +
                '}';
    }
}
