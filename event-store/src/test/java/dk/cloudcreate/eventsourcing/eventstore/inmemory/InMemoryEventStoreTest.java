package dk.cloudcreate.eventsourcing.eventstore.inmemory;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.eventsourcing.eventstore.*;
import dk.cloudcreate.eventsourcing.eventstore.eventstream.*;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.*;
import dk.cloudcreate.eventsourcing.eventstore.test_data.*;
import dk.cloudcreate.eventsourcing.eventstore.test_data.OrderEvent.*;
import dk.cloudcreate.eventsourcing.eventstore.types.*;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class InMemoryEventStoreTest {
    private static final AggregateType ORDERS = AggregateType.of("Orders");

    private InMemoryEventStore eventStore;

    @BeforeEach
    void setup() {
        eventStore = new InMemoryEventStore(JacksonJSONSerializer.createDefault());
    }

    @Test
    void verify_fetching_an_unknown_stream_returns_an_empty_stream() {
        // When
        var stream = eventStore.fetchStream(ORDERS, OrderId.random());

        // Then
        assertThat(stream.isEmpty()).isTrue();
        assertThat(stream.version()).isEqualTo(StreamVersion.NO_EVENTS);
        assertThat(eventStore.currentVersion(ORDERS, OrderId.random())).isEqualTo(StreamVersion.NO_EVENTS);
    }

    @Test
    void verify_appending_to_a_new_stream_assigns_consecutive_event_orders() {
        // Given
        var orderId   = OrderId.random();
        var productId = ProductId.random();

        // When
        var appended = eventStore.appendToStream(ORDERS,
                                                 orderId,
                                                 StreamVersion.NO_EVENTS,
                                                 List.of(new OrderAdded(orderId, 1234),
                                                         new ProductAddedToOrder(orderId, productId, 2)));

        // Then
        assertThat(appended.version()).isEqualTo(StreamVersion.of(2));
        assertThat(appended.eventList()).hasSize(2);
        assertThat(appended.eventList().get(0).eventOrder()).isEqualTo(EventOrder.FIRST_EVENT_ORDER);
        assertThat(appended.eventList().get(1).eventOrder()).isEqualTo(EventOrder.of(1));
        assertThat(appended.eventList().get(0).timestamp().getOffset()).isEqualTo(ZoneOffset.UTC);

        var fetched = eventStore.fetchStream(ORDERS, orderId);
        assertThat(fetched.version()).isEqualTo(StreamVersion.of(2));
        assertThat(fetched.eventList()).containsExactlyElementsOf(appended.eventList());
        assertThat(fetched.map(persistedEvent -> persistedEvent.event().deserialize()))
                .containsExactly(new OrderAdded(orderId, 1234),
                                 new ProductAddedToOrder(orderId, productId, 2));
        assertThat((CharSequence) fetched.eventList().get(0).eventType()).isEqualTo(EventType.of(OrderAdded.class));
    }

    @Test
    void verify_appending_with_a_stale_expected_version_is_rejected_and_nothing_is_appended() {
        // Given
        var orderId = OrderId.random();
        eventStore.appendToStream(ORDERS, orderId, StreamVersion.NO_EVENTS, List.of(new OrderAdded(orderId, 1)));
        eventStore.appendToStream(ORDERS, orderId, StreamVersion.of(1), List.of(new ProductAddedToOrder(orderId, ProductId.random(), 1)));

        // When
        var conflict = catchThrowableOfType(() -> eventStore.appendToStream(ORDERS,
                                                                           orderId,
                                                                           StreamVersion.of(1),
                                                                           List.of(new ProductRemovedFromOrder(orderId, ProductId.random()))),
                                            OptimisticAppendToStreamException.class);

        // Then
        assertThat(conflict).isNotNull();
        assertThat(conflict.expectedVersion()).isEqualTo(StreamVersion.of(1));
        assertThat(conflict.actualVersion()).isEqualTo(StreamVersion.of(2));
        assertThat((CharSequence) conflict.aggregateType()).isEqualTo(ORDERS);
        assertThat(eventStore.currentVersion(ORDERS, orderId)).isEqualTo(StreamVersion.of(2));
    }

    @Test
    void verify_appending_with_an_expected_version_ahead_of_the_stream_is_rejected() {
        var orderId = OrderId.random();

        assertThatThrownBy(() -> eventStore.appendToStream(ORDERS, orderId, StreamVersion.of(5), List.of(new OrderAdded(orderId, 1))))
                .isInstanceOf(OptimisticAppendToStreamException.class);
        assertThat(eventStore.fetchStream(ORDERS, orderId).isEmpty()).isTrue();
    }

    @Test
    void verify_appending_no_events_still_checks_the_expected_version() {
        // Given
        var orderId = OrderId.random();
        eventStore.appendToStream(ORDERS, orderId, StreamVersion.NO_EVENTS, List.of(new OrderAdded(orderId, 1)));

        // When
        var result = eventStore.appendToStream(ORDERS, orderId, StreamVersion.of(1), List.of());

        // Then
        assertThat(result.isEmpty()).isTrue();
        assertThat(result.version()).isEqualTo(StreamVersion.of(1));
        assertThatThrownBy(() -> eventStore.appendToStream(ORDERS, orderId, StreamVersion.NO_EVENTS, List.of()))
                .isInstanceOf(OptimisticAppendToStreamException.class);
    }

    @Test
    void verify_a_batch_with_an_event_that_cannot_be_serialized_is_not_partially_appended() {
        // Given
        var orderId = OrderId.random();

        // When
        assertThatThrownBy(() -> eventStore.appendToStream(ORDERS,
                                                           orderId,
                                                           StreamVersion.NO_EVENTS,
                                                           List.of(new OrderAdded(orderId, 1),
                                                                   new SelfReferencingEvent())))
                .isInstanceOf(JSONSerializationException.class);

        // Then
        assertThat(eventStore.fetchStream(ORDERS, orderId).isEmpty()).isTrue();
        assertThat(eventStore.currentVersion(ORDERS, orderId)).isEqualTo(StreamVersion.NO_EVENTS);
    }

    @Test
    void verify_repeated_reads_return_the_same_events() {
        // Given
        var orderId = OrderId.random();
        eventStore.appendToStream(ORDERS, orderId, StreamVersion.NO_EVENTS, List.of(new OrderAdded(orderId, 1),
                                                                                   new ProductAddedToOrder(orderId, ProductId.random(), 3)));

        // When
        var firstRead  = eventStore.fetchStream(ORDERS, orderId);
        var secondRead = eventStore.fetchStream(ORDERS, orderId);

        // Then
        assertThat(secondRead.eventList()).containsExactlyElementsOf(firstRead.eventList());
        assertThat(secondRead.version()).isEqualTo(firstRead.version());
    }

    @Test
    void verify_streams_for_different_aggregates_and_aggregate_types_are_independent() {
        var orderId      = OrderId.of("shared-id");
        var otherOrderId = OrderId.random();
        eventStore.appendToStream(ORDERS, orderId, StreamVersion.NO_EVENTS, List.of(new OrderAdded(orderId, 1)));
        eventStore.appendToStream(ORDERS, otherOrderId, StreamVersion.NO_EVENTS, List.of(new OrderAdded(otherOrderId, 2)));
        eventStore.appendToStream(AggregateType.of("ArchivedOrders"), orderId, StreamVersion.NO_EVENTS, List.of(new OrderAdded(orderId, 3)));

        assertThat(eventStore.currentVersion(ORDERS, orderId)).isEqualTo(StreamVersion.of(1));
        assertThat(eventStore.currentVersion(ORDERS, otherOrderId)).isEqualTo(StreamVersion.of(1));
        assertThat(eventStore.fetchStream(AggregateType.of("ArchivedOrders"), orderId)
                             .map(persistedEvent -> persistedEvent.event().<OrderAdded>deserialize().orderNumber))
                .containsExactly(3L);
    }

    @Test
    void verify_fetching_the_tail_of_a_stream() {
        // Given
        var orderId = OrderId.random();
        eventStore.appendToStream(ORDERS, orderId, StreamVersion.NO_EVENTS, List.of(new OrderAdded(orderId, 1),
                                                                                   new ProductAddedToOrder(orderId, ProductId.random(), 1),
                                                                                   new ProductAddedToOrder(orderId, ProductId.random(), 2)));

        // When
        var tail  = eventStore.fetchStream(ORDERS, orderId, EventOrder.of(1));
        var empty = eventStore.fetchStream(ORDERS, orderId, EventOrder.of(3));

        // Then
        assertThat(tail.eventList()).hasSize(2);
        assertThat(tail.firstEventOrder()).contains(EventOrder.of(1));
        assertThat(tail.version()).isEqualTo(StreamVersion.of(3));
        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.version()).isEqualTo(StreamVersion.of(3));
    }

    @Test
    void verify_persisted_events_do_not_change_when_the_appended_event_object_is_mutated() {
        // Given
        var orderId = OrderId.random();
        var event   = new MutableEvent(orderId, "original");
        eventStore.appendToStream(ORDERS, orderId, StreamVersion.NO_EVENTS, List.of(event));

        // When
        event.note = "changed";

        // Then
        MutableEvent persisted = eventStore.fetchStream(ORDERS, orderId).eventList().get(0).event().deserialize();
        assertThat(persisted.note).isEqualTo("original");
    }

    @Test
    void verify_fetched_events_are_deserialized_from_the_stored_payload_and_not_the_appended_instance() {
        // Given
        var orderId = OrderId.random();
        var event   = new OrderAdded(orderId, 1);

        // When
        var appended = eventStore.appendToStream(ORDERS, orderId, StreamVersion.NO_EVENTS, List.of(event));

        // Then
        OrderAdded fromAppendResult = appended.eventList().get(0).event().deserialize();
        OrderAdded fetched          = eventStore.fetchStream(ORDERS, orderId).eventList().get(0).event().deserialize();
        assertThat(fromAppendResult).isEqualTo(event).isNotSameAs(event);
        assertThat(fetched).isEqualTo(event).isNotSameAs(event);
    }

    @Test
    void verify_a_rejected_append_to_an_unknown_aggregate_leaves_no_stream_behind() {
        // Given
        var orderId = OrderId.random();

        // When
        var conflict = catchThrowableOfType(() -> eventStore.appendToStream(ORDERS,
                                                                            orderId,
                                                                            StreamVersion.of(3),
                                                                            List.of(new OrderAdded(orderId, 1))),
                                            OptimisticAppendToStreamException.class);
        var emptyAppend = eventStore.appendToStream(ORDERS, orderId, StreamVersion.NO_EVENTS, List.of());

        // Then
        assertThat(conflict.expectedVersion()).isEqualTo(StreamVersion.of(3));
        assertThat(conflict.actualVersion()).isEqualTo(StreamVersion.NO_EVENTS);
        assertThat(emptyAppend.isEmpty()).isTrue();
        assertThat(emptyAppend.version()).isEqualTo(StreamVersion.NO_EVENTS);
        assertThat(eventStore.numberOfStreams(ORDERS)).isZero();
    }

    @Test
    void verify_only_one_of_several_concurrent_writers_with_the_same_expected_version_succeeds() throws InterruptedException {
        // Given
        var orderId = OrderId.random();
        eventStore.appendToStream(ORDERS, orderId, StreamVersion.NO_EVENTS, List.of(new OrderAdded(orderId, 1)));
        var numberOfWriters = 8;
        var executor        = Executors.newFixedThreadPool(numberOfWriters);
        var startSignal     = new CountDownLatch(1);
        var successes       = new AtomicInteger();
        var conflicts       = new AtomicInteger();

        // When
        for (int i = 0; i < numberOfWriters; i++) {
            var quantity = i + 1;
            executor.submit(() -> {
                startSignal.await();
                try {
                    eventStore.appendToStream(ORDERS, orderId, StreamVersion.of(1), List.of(new ProductAddedToOrder(orderId, ProductId.random(), quantity)));
                    successes.incrementAndGet();
                } catch (OptimisticAppendToStreamException e) {
                    conflicts.incrementAndGet();
                }
                return null;
            });
        }
        startSignal.countDown();

        // Then
        await().atMost(Duration.ofSeconds(5))
               .untilAsserted(() -> assertThat(successes.get() + conflicts.get()).isEqualTo(numberOfWriters));
        executor.shutdown();
        assertThat(successes.get()).isEqualTo(1);
        assertThat(conflicts.get()).isEqualTo(numberOfWriters - 1);
        assertThat(eventStore.currentVersion(ORDERS, orderId)).isEqualTo(StreamVersion.of(2));
    }

    public static class MutableEvent {
        public final OrderId orderId;
        public       String  note;

        @JsonCreator
        public MutableEvent(@JsonProperty("orderId") OrderId orderId,
                            @JsonProperty("note") String note) {
            this.orderId = orderId;
            this.note = note;
        }
    }
}
