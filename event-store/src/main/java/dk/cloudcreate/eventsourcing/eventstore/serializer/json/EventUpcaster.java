package dk.cloudcreate.eventsourcing.eventstore.serializer.json;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dk.cloudcreate.eventsourcing.eventstore.types.*;

import java.util.function.UnaryOperator;

/**
 * Transforms the JSON payload of an Event persisted with revision {@link #fromRevision()} into the payload of
 * the next revision.<br>
 * Persisted events are never changed, upcasting only happens when they're deserialized. A chain of upcasters
 * (1 to 2, 2 to 3, ...) brings old payloads up to the revision declared using {@link Revision} on the Event type.
 */
public interface EventUpcaster {
    /**
     * The Event type this upcaster handles
     */
    Class<?> eventType();

    /**
     * The revision of the payloads this upcaster accepts. The result has revision <code>fromRevision().next()</code>
     */
    EventRevision fromRevision();

    /**
     * @param payload the payload with revision {@link #fromRevision()}
     * @return the payload transformed to the next revision (may be the same, modified, instance)
     */
    ObjectNode upcast(ObjectNode payload);

    static EventUpcaster of(Class<?> eventType, int fromRevision, UnaryOperator<ObjectNode> upcaster) {
        return new EventUpcaster() {
            @Override
            public Class<?> eventType() {
                return eventType;
            }

            @Override
            public EventRevision fromRevision() {
                return EventRevision.of(fromRevision);
            }

            @Override
            public ObjectNode upcast(ObjectNode payload) {
                return upcaster.apply(payload);
            }
        };
    }
}
