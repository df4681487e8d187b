package dk.cloudcreate.eventsourcing.eventstore.serializer.json;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.eventsourcing.eventstore.types.*;
import dk.cloudcreate.essentials.types.CharSequenceType;
import dk.cloudcreate.essentials.types.jackson.EssentialTypesJacksonModule;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jackson based {@link JSONSerializer}.<br>
 * Events are serialized with the {@link EventRevision} declared by their {@link Revision} annotation. When an Event persisted
 * with an older revision is deserialized, the registered {@link EventUpcaster}'s are applied one revision at a time until
 * the payload matches the current revision of the Event type.
 */
public class JacksonJSONSerializer implements JSONSerializer {
    private static final Logger log = LoggerFactory.getLogger(JacksonJSONSerializer.class);

    private final ObjectMapper                                     objectMapper;
    private final Map<Class<?>, Map<EventRevision, EventUpcaster>> upcasters = new HashMap<>();

    public JacksonJSONSerializer(ObjectMapper objectMapper) {
        this(objectMapper, List.of());
    }

    public JacksonJSONSerializer(ObjectMapper objectMapper, List<EventUpcaster> upcasters) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
        requireNonNull(upcasters, "No upcasters provided").forEach(this::registerUpcaster);
    }

    /**
     * Create a {@link JacksonJSONSerializer} using {@link #createDefaultObjectMapper()}
     */
    public static JacksonJSONSerializer createDefault(EventUpcaster... upcasters) {
        return new JacksonJSONSerializer(createDefaultObjectMapper(), List.of(upcasters));
    }

    /**
     * The {@link ObjectMapper} setup used for Event payloads:
     * <ul>
     *     <li>Fields are serialized, getters are ignored</li>
     *     <li>Unknown properties are ignored, which allows properties to be removed from an Event type without an upcaster</li>
     *     <li>{@link CharSequenceType} values, such as aggregate id's, are written as plain JSON strings - see {@link EssentialTypesJacksonModule}</li>
     *     <li>java.time types are written as ISO-8601 strings</li>
     * </ul>
     */
    public static ObjectMapper createDefaultObjectMapper() {
        return JsonMapper.builder()
                         .disable(MapperFeature.AUTO_DETECT_GETTERS)
                         .disable(MapperFeature.AUTO_DETECT_IS_GETTERS)
                         .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                         .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                         .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                         .enable(MapperFeature.PROPAGATE_TRANSIENT_MARKER)
                         .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                         .visibility(PropertyAccessor.CREATOR, JsonAutoDetect.Visibility.ANY)
                         .addModule(new JavaTimeModule())
                         .addModule(new EssentialTypesJacksonModule())
                         .build();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public final JacksonJSONSerializer registerUpcaster(EventUpcaster upcaster) {
        requireNonNull(upcaster, "No upcaster provided");
        requireNonNull(upcaster.eventType(), "No upcaster eventType provided");
        requireNonNull(upcaster.fromRevision(), "No upcaster fromRevision provided");
        var upcastersForEventType = upcasters.computeIfAbsent(upcaster.eventType(), eventType -> new HashMap<>());
        requireTrue(!upcastersForEventType.containsKey(upcaster.fromRevision()),
                    msg("An upcaster for Event type '{}' from revision {} has already been registered",
                        upcaster.eventType().getName(),
                        upcaster.fromRevision()));
        upcastersForEventType.put(upcaster.fromRevision(), upcaster);
        log.debug("Registered upcaster for Event type '{}' from revision {}", upcaster.eventType().getName(), upcaster.fromRevision());
        return this;
    }

    @Override
    public EventJSON serializeEvent(Object objectToSerialize) {
        requireNonNull(objectToSerialize, "No objectToSerialize provided");
        try {
            return new EventJSON(this,
                                 objectToSerialize,
                                 EventRevision.of(objectToSerialize.getClass()),
                                 objectMapper.writeValueAsString(objectToSerialize));
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(msg("Failed to serialize {} to JSON", objectToSerialize.getClass().getName()), e);
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> T deserializeEvent(EventJSON eventJSON) {
        requireNonNull(eventJSON, "No eventJSON provided");
        Class<?> eventType;
        try {
            eventType = eventJSON.getEventType().toJavaClass();
        } catch (RuntimeException e) {
            throw new JSONDeserializationException(msg("Unknown Event type '{}'", eventJSON.getEventType()), e);
        }
        var currentRevision = EventRevision.of(eventType);
        var storedRevision  = eventJSON.getEventRevision();
        if (storedRevision.equals(currentRevision)) {
            return (T) deserialize(eventJSON.getJson(), eventType);
        }
        if (storedRevision.intValue() > currentRevision.intValue()) {
            throw new JSONDeserializationException(msg("Event type '{}' was persisted with revision {}, which is newer than the current revision {}",
                                                       eventType.getName(),
                                                       storedRevision,
                                                       currentRevision));
        }
        return (T) deserialize(upcast(eventType, storedRevision, currentRevision, eventJSON.getJson()), eventType);
    }

    private ObjectNode upcast(Class<?> eventType, EventRevision storedRevision, EventRevision currentRevision, String json) {
        ObjectNode payload;
        try {
            payload = (ObjectNode) objectMapper.readTree(json);
        } catch (JsonProcessingException | ClassCastException e) {
            throw new JSONDeserializationException(msg("Failed to read the JSON payload of Event type '{}' with revision {}", eventType.getName(), storedRevision), e);
        }
        var upcastersForEventType = upcasters.getOrDefault(eventType, Map.of());
        var revision              = storedRevision;
        while (!revision.equals(currentRevision)) {
            var upcaster = upcastersForEventType.get(revision);
            if (upcaster == null) {
                throw new JSONDeserializationException(msg("No upcaster registered for Event type '{}' from revision {} (current revision is {})",
                                                           eventType.getName(),
                                                           revision,
                                                           currentRevision));
            }
            log.trace("Upcasting Event type '{}' from revision {}", eventType.getName(), revision);
            payload = upcaster.upcast(payload);
            revision = revision.next();
        }
        return payload;
    }

    private <T> T deserialize(ObjectNode payload, Class<T> javaType) {
        try {
            return objectMapper.treeToValue(payload, javaType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new JSONDeserializationException(msg("Failed to deserialize upcasted JSON payload to {}", javaType.getName()), e);
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> T deserialize(String json, String javaType) {
        requireNonNull(javaType, "No javaType provided");
        Class<T> type;
        try {
            type = (Class<T>) Class.forName(javaType);
        } catch (ClassNotFoundException e) {
            throw new JSONDeserializationException(msg("Failed to resolve Java type '{}'", javaType), e);
        }
        return deserialize(json, type);
    }

    @Override
    public <T> T deserialize(String json, Class<T> javaType) {
        requireNonNull(json, "No json provided");
        requireNonNull(javaType, "No javaType provided");
        try {
            return objectMapper.readValue(json, javaType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("Failed to deserialize JSON to {}", javaType.getName()), e);
        }
    }
}
