package dk.cloudcreate.eventsourcing.common.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.*;

/**
 * Unique id of an Event. Assigned once, when the Event is appended to its stream, and never changed.
 */
public class EventId extends CharSequenceType<EventId> {
    public EventId(CharSequence value) {
        super(value);
    }

    public static EventId random() {
        return new EventId(UUID.randomUUID().toString());
    }

    public static EventId of(CharSequence value) {
        return new EventId(value);
    }

    public static Optional<EventId> optionalFrom(CharSequence value) {
        return Optional.ofNullable(value).map(EventId::new);
    }
}
