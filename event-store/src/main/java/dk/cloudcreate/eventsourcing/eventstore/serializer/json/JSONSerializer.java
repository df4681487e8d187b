package dk.cloudcreate.eventsourcing.eventstore.serializer.json;

/**
 * JSON serializer and deserializer
 */
public interface JSONSerializer {
    /**
     * Deserialize the payload in the <code>json</code> parameter into the Java type specified by the Fully Qualified Class Name contained
     * in the <code>javaType</code> parameter
     *
     * @param json     the json payload
     * @param javaType the Fully Qualified Class Name for the Java type that the json payload should be deserialized into
     * @param <T>      the corresponding Java type
     * @return the deserialized json payload
     * @throws JSONDeserializationException in case the json couldn't be deserialized to the specified java type
     */
    <T> T deserialize(String json, String javaType);

    /**
     * Deserialize the payload in the <code>json</code> parameter into the Java type specified by the <code>javaType</code> parameter
     *
     * @param json     the json payload
     * @param javaType the Java type that the json payload should be deserialized into
     * @param <T>      the corresponding Java type
     * @return the deserialized json payload
     * @throws JSONDeserializationException in case the json couldn't be deserialized to the specified java type
     */
    <T> T deserialize(String json, Class<T> javaType);

    /**
     * Deserialize an {@link EventJSON} into the current revision of its Event type. Payloads persisted with
     * an older revision are upcasted first
     *
     * @param eventJSON the serialized event
     * @param <T>       the Event type
     * @return the deserialized Event
     * @throws JSONDeserializationException in case the payload couldn't be upcasted or deserialized
     */
    <T> T deserializeEvent(EventJSON eventJSON);

    /**
     * Serialize an Event to {@link EventJSON} using the Event type's current revision
     *
     * @param objectToSerialize the java object that will be serialized to JSON
     * @return the corresponding {@link EventJSON} object
     * @throws JSONSerializationException in case the <code>objectToSerialize</code> couldn't be serialized to JSON
     */
    EventJSON serializeEvent(Object objectToSerialize);
}
