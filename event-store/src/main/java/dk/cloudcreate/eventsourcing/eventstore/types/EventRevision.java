package dk.cloudcreate.eventsourcing.eventstore.types;

import dk.cloudcreate.essentials.types.IntegerType;

/**
 * The revision of an Event type's payload - first revision has value 1
 *
 * @see Revision
 */
public class EventRevision extends IntegerType<EventRevision> {
    public static final EventRevision FIRST = EventRevision.of(1);

    public EventRevision(Integer value) {
        super(value);
    }

    public static EventRevision of(int value) {
        return new EventRevision(value);
    }

    /**
     * Resolve the current {@link EventRevision} of an Event type using its {@link Revision} annotation
     *
     * @param eventType the event type
     * @return the value of the {@link Revision} annotation or {@link #FIRST} if the type isn't annotated
     */
    public static EventRevision of(Class<?> eventType) {
        var revision = eventType.getAnnotation(Revision.class);
        return revision != null ? EventRevision.of(revision.value()) : FIRST;
    }

    public EventRevision next() {
        return EventRevision.of(value() + 1);
    }
}
