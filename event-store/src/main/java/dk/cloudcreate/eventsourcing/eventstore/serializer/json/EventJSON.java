package dk.cloudcreate.eventsourcing.eventstore.serializer.json;

import dk.cloudcreate.eventsourcing.eventstore.types.*;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The serialized payload of an Event together with the {@link EventType} and {@link EventRevision} it was serialized with.<br>
 * The deserialized Event is cached, so repeated calls to {@link #deserialize()} return the same instance.
 */
public class EventJSON {
    private final JSONSerializer jsonSerializer;
    private final EventType      eventType;
    private final EventRevision  eventRevision;
    private final String         json;
    private       Object         deserializedEvent;

    public EventJSON(JSONSerializer jsonSerializer, EventType eventType, EventRevision eventRevision, String json) {
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.eventRevision = requireNonNull(eventRevision, "No eventRevision provided");
        this.json = requireNonNull(json, "No json provided");
    }

    public EventJSON(JSONSerializer jsonSerializer, Object event, EventRevision eventRevision, String json) {
        this(jsonSerializer, EventType.of(requireNonNull(event, "No event provided").getClass()), eventRevision, json);
        this.deserializedEvent = event;
    }

    public EventType getEventType() {
        return eventType;
    }

    public EventRevision getEventRevision() {
        return eventRevision;
    }

    /**
     * The Fully Qualified Class Name of the Event's Java type
     */
    public String getJavaTypeName() {
        return eventType.getJavaTypeName();
    }

    public String getJson() {
        return json;
    }

    public JSONSerializer getJsonSerializer() {
        return jsonSerializer;
    }

    /**
     * Deserialize the {@link #getJson()} into the current revision of the Event type, upcasting the payload if it was persisted
     * with an older {@link EventRevision}
     *
     * @param <T> the Event type
     * @return the deserialized Event
     * @throws JSONDeserializationException in case the payload couldn't be upcasted or deserialized
     */
    @SuppressWarnings("unchecked")
    public synchronized <T> T deserialize() {
        if (deserializedEvent == null) {
            deserializedEvent = jsonSerializer.deserializeEvent(this);
        }
        return (T) deserializedEvent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventJSON)) return false;
        EventJSON eventJSON = (EventJSON) o;
        return eventType.equals(eventJSON.eventType) && eventRevision.equals(eventJSON.eventRevision) && json.equals(eventJSON.json);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, eventRevision, json);
    }

    @Override
    public String toString() {
        return "EventJSON{" +
                "eventType=" + eventType +
                ", eventRevision=" + eventRevision +
                ", json='" + json + '\'' +
                '}';
    }
}
