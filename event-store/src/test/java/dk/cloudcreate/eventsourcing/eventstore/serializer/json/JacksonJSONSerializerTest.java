package dk.cloudcreate.eventsourcing.eventstore.serializer.json;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.eventsourcing.eventstore.test_data.*;
import dk.cloudcreate.eventsourcing.eventstore.test_data.OrderEvent.*;
import dk.cloudcreate.eventsourcing.eventstore.types.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JacksonJSONSerializerTest {
    private static final EventUpcaster SPLIT_NAME = EventUpcaster.of(CustomerRenamed.class, 1, payload -> {
        var names = payload.remove("name").asText().split(" ", 2);
        payload.put("firstName", names[0]);
        payload.put("lastName", names.length > 1 ? names[1] : "");
        return payload;
    });

    private static final EventUpcaster ADD_RENAMED_BY = EventUpcaster.of(CustomerRenamed.class, 2, payload -> payload.put("renamedBy", "unknown"));

    @Test
    void verify_value_types_are_serialized_as_plain_strings() {
        // Given
        var serializer = JacksonJSONSerializer.createDefault();
        var event      = new ProductAddedToOrder(OrderId.of("order-1"), ProductId.of("product-1"), 5);

        // When
        var eventJSON = serializer.serializeEvent(event);

        // Then
        assertThat((CharSequence) eventJSON.getEventType()).isEqualTo(EventType.of(ProductAddedToOrder.class));
        assertThat(eventJSON.getEventRevision()).isEqualTo(EventRevision.FIRST);
        assertThat(eventJSON.getJson()).isEqualTo("{\"orderId\":\"order-1\",\"productId\":\"product-1\",\"quantity\":5}");
    }

    @Test
    void verify_a_persisted_payload_is_deserialized_to_the_event_type() {
        // Given
        var serializer = JacksonJSONSerializer.createDefault();
        var persisted = new EventJSON(serializer,
                                      EventType.of(ProductAddedToOrder.class),
                                      EventRevision.FIRST,
                                      "{\"orderId\":\"order-1\",\"productId\":\"product-1\",\"quantity\":5}");

        // When
        ProductAddedToOrder event = persisted.deserialize();

        // Then
        assertThat(event).isEqualTo(new ProductAddedToOrder(OrderId.of("order-1"), ProductId.of("product-1"), 5));
        assertThat((Object) persisted.deserialize()).isSameAs(event);
    }

    @Test
    void verify_unknown_properties_are_ignored() {
        var serializer = JacksonJSONSerializer.createDefault();

        var event = serializer.<OrderAdded>deserialize("{\"orderId\":\"order-1\",\"orderNumber\":42,\"removedProperty\":true}", OrderAdded.class);

        assertThat(event).isEqualTo(new OrderAdded(OrderId.of("order-1"), 42));
    }

    @Test
    void verify_serializing_an_event_uses_the_current_revision() {
        var serializer = JacksonJSONSerializer.createDefault(SPLIT_NAME, ADD_RENAMED_BY);

        var eventJSON = serializer.serializeEvent(new CustomerRenamed("c1", "John", "Doe", "admin"));

        assertThat(eventJSON.getEventRevision()).isEqualTo(EventRevision.of(3));
    }

    @Test
    void verify_an_old_revision_is_upcasted_through_the_chain_of_upcasters() {
        // Given
        var serializer = JacksonJSONSerializer.createDefault(SPLIT_NAME, ADD_RENAMED_BY);
        var persistedWithRevision1 = new EventJSON(serializer,
                                                   EventType.of(CustomerRenamed.class),
                                                   EventRevision.of(1),
                                                   "{\"customerId\":\"c1\",\"name\":\"John Doe\"}");
        var persistedWithRevision2 = new EventJSON(serializer,
                                                   EventType.of(CustomerRenamed.class),
                                                   EventRevision.of(2),
                                                   "{\"customerId\":\"c1\",\"firstName\":\"Jane\",\"lastName\":\"Doe\"}");

        // When
        CustomerRenamed upcastedFromRevision1 = persistedWithRevision1.deserialize();
        CustomerRenamed upcastedFromRevision2 = persistedWithRevision2.deserialize();

        // Then
        assertThat(upcastedFromRevision1.customerId).isEqualTo("c1");
        assertThat(upcastedFromRevision1.firstName).isEqualTo("John");
        assertThat(upcastedFromRevision1.lastName).isEqualTo("Doe");
        assertThat(upcastedFromRevision1.renamedBy).isEqualTo("unknown");

        assertThat(upcastedFromRevision2.firstName).isEqualTo("Jane");
        assertThat(upcastedFromRevision2.renamedBy).isEqualTo("unknown");
        // The persisted payload is untouched
        assertThat(persistedWithRevision1.getJson()).isEqualTo("{\"customerId\":\"c1\",\"name\":\"John Doe\"}");
    }

    @Test
    void verify_a_missing_upcaster_fails_deserialization() {
        var serializer = JacksonJSONSerializer.createDefault(ADD_RENAMED_BY);
        var persisted = new EventJSON(serializer,
                                      EventType.of(CustomerRenamed.class),
                                      EventRevision.of(1),
                                      "{\"customerId\":\"c1\",\"name\":\"John Doe\"}");

        assertThatThrownBy(persisted::deserialize)
                .isInstanceOf(JSONDeserializationException.class)
                .hasMessageContaining("No upcaster registered");
    }

    @Test
    void verify_a_revision_newer_than_the_event_type_fails_deserialization() {
        var serializer = JacksonJSONSerializer.createDefault();
        var persisted = new EventJSON(serializer,
                                      EventType.of(OrderAdded.class),
                                      EventRevision.of(2),
                                      "{\"orderId\":\"order-1\",\"orderNumber\":42}");

        assertThatThrownBy(persisted::deserialize)
                .isInstanceOf(JSONDeserializationException.class);
    }

    @Test
    void verify_an_unknown_event_type_fails_deserialization() {
        var serializer = JacksonJSONSerializer.createDefault();
        var persisted = new EventJSON(serializer,
                                      EventType.of("com.example.NoSuchEvent"),
                                      EventRevision.FIRST,
                                      "{}");

        assertThatThrownBy(persisted::deserialize)
                .isInstanceOf(JSONDeserializationException.class)
                .hasMessageContaining("Unknown Event type");
    }

    @Test
    void verify_registering_two_upcasters_for_the_same_revision_fails() {
        assertThatThrownBy(() -> JacksonJSONSerializer.createDefault(SPLIT_NAME, SPLIT_NAME))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_an_event_that_cannot_be_serialized_raises_a_JSONSerializationException() {
        var serializer = JacksonJSONSerializer.createDefault();

        assertThatThrownBy(() -> serializer.serializeEvent(new SelfReferencingEvent()))
                .isInstanceOf(JSONSerializationException.class);
    }

    @Revision(3)
    public static class CustomerRenamed {
        public final String customerId;
        public final String firstName;
        public final String lastName;
        public final String renamedBy;

        @JsonCreator
        public CustomerRenamed(@JsonProperty("customerId") String customerId,
                               @JsonProperty("firstName") String firstName,
                               @JsonProperty("lastName") String lastName,
                               @JsonProperty("renamedBy") String renamedBy) {
            this.customerId = customerId;
            this.firstName = firstName;
            this.lastName = lastName;
            this.renamedBy = renamedBy;
        }
    }
}
