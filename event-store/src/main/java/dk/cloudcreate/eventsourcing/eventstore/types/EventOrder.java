package dk.cloudcreate.eventsourcing.eventstore.types;

import dk.cloudcreate.eventsourcing.eventstore.eventstream.*;
import dk.cloudcreate.essentials.types.LongType;

/**
 * Each event has its own unique position within the stream, also known as the event-order,
 * which defines the order in which the events were appended to the aggregate's {@link AggregateEventStream}<br>
 * <br>
 * The first event appended to a stream has event-order {@link #FIRST_EVENT_ORDER} and the event-order increases by one
 * for every event appended afterwards, i.e. a stream never contains gaps.<br>
 * The number of events in a stream, the {@link StreamVersion}, is always the event-order of the last event + 1
 */
public class EventOrder extends LongType<EventOrder> {
    /**
     * Special value that signifies that no events have been persisted in relation to a given aggregate
     */
    public static final EventOrder NO_EVENTS_PERSISTED = EventOrder.of(-1);
    /**
     * Special value that contains the {@link EventOrder} of the FIRST Event persisted in context of a given aggregate id
     */
    public static final EventOrder FIRST_EVENT_ORDER   = EventOrder.of(0);

    public EventOrder(Long value) {
        super(value);
    }

    public static EventOrder of(long value) {
        return new EventOrder(value);
    }

    public EventOrder increaseAndGet() {
        return new EventOrder(value() + 1);
    }

    /**
     * The {@link StreamVersion} of a stream where this {@link EventOrder} is the event-order of the last event
     */
    public StreamVersion toStreamVersion() {
        return StreamVersion.of(value() + 1);
    }
}
