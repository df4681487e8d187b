package dk.cloudcreate.eventsourcing.eventstore.types;

import dk.cloudcreate.eventsourcing.eventstore.EventStoreException;
import dk.cloudcreate.essentials.types.CharSequenceType;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The type discriminator stored together with every persisted Event.<br>
 * The value is the Fully Qualified Class Name of the Event's Java type prefixed with {@link #FQCN_PREFIX},
 * which makes the persisted payload self describing.
 */
public class EventType extends CharSequenceType<EventType> {
    public static final String FQCN_PREFIX = "FQCN:";

    public EventType(CharSequence value) {
        super(addPrefix(requireNonNull(value, "No value provided")));
    }

    private static CharSequence addPrefix(CharSequence value) {
        return isSerializedEventType(value) ? value : FQCN_PREFIX + value;
    }

    /**
     * Create an {@link EventType} from either a Fully Qualified Class Name or an already serialized {@link EventType} (i.e. a value prefixed with {@link #FQCN_PREFIX})
     */
    public static EventType of(CharSequence value) {
        return new EventType(value);
    }

    public static EventType of(Class<?> eventType) {
        return new EventType(requireNonNull(eventType, "No eventType provided").getName());
    }

    public static boolean isSerializedEventType(CharSequence value) {
        return value != null && value.toString().startsWith(FQCN_PREFIX);
    }

    public String getJavaTypeName() {
        return toString().substring(FQCN_PREFIX.length());
    }

    public Class<?> toJavaClass() {
        try {
            return Class.forName(getJavaTypeName());
        } catch (ClassNotFoundException e) {
            throw new EventStoreException(msg("Failed to resolve the Java class for EventType '{}'", this), e);
        }
    }
}
