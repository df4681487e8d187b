package dk.cloudcreate.eventsourcing.aggregates.command;

import dk.cloudcreate.eventsourcing.aggregates.*;
import dk.cloudcreate.eventsourcing.aggregates.flex.*;
import dk.cloudcreate.eventsourcing.aggregates.test_data.*;
import dk.cloudcreate.eventsourcing.aggregates.test_data.OrderEvents.*;
import dk.cloudcreate.eventsourcing.eventstore.*;
import dk.cloudcreate.eventsourcing.eventstore.eventstream.*;
import dk.cloudcreate.eventsourcing.eventstore.inmemory.InMemoryEventStore;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.JacksonJSONSerializer;
import dk.cloudcreate.eventsourcing.eventstore.types.StreamVersion;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class AggregateCommandHandlerTest {
    private static final AggregateType ORDERS = AggregateType.of("Orders");

    private FlexAggregateRepository<OrderId, Order> repository;

    @BeforeEach
    void setup() {
        repository = FlexAggregateRepository.from(new InMemoryEventStore(JacksonJSONSerializer.createDefault()),
                                                  ORDERS,
                                                  OrderId.class,
                                                  Order.class);
    }

    @Test
    void verify_a_command_is_executed_against_the_replayed_aggregate() {
        // Given
        var handler = new AggregateCommandHandler<>(repository, ConcurrencyRetryPolicy.noRetries());
        var orderId = OrderId.random();
        handler.handle(orderId, order -> order.add(orderId, 7));

        // When
        var result = handler.handle(orderId, order -> order.addProduct("p-1", 2));

        // Then
        assertThat((CharSequence) result.aggregateId()).isEqualTo(orderId);
        assertThat(result.newVersion()).isEqualTo(StreamVersion.of(2));
        assertThat(result.events()).hasSize(1);
        assertThat(result.events().get(0)).isInstanceOf(ProductAddedToOrder.class);
        assertThat(result.persistedEvents().get(0).eventOrder().longValue()).isEqualTo(1);
    }

    @Test
    void verify_a_command_without_side_effects_keeps_the_version() {
        // Given
        var handler = new AggregateCommandHandler<>(repository, ConcurrencyRetryPolicy.noRetries());
        var orderId = OrderId.random();
        handler.handle(orderId, order -> order.add(orderId, 7));
        handler.handle(orderId, Order::accept);

        // When
        var result = handler.handle(orderId, Order::accept);

        // Then
        assertThat(result.newVersion()).isEqualTo(StreamVersion.of(2));
        assertThat(result.events()).isEmpty();
    }

    @Test
    void verify_validation_errors_are_not_retried() {
        // Given
        var handler    = new AggregateCommandHandler<>(repository, ConcurrencyRetryPolicy.fixedBackoff(Duration.ZERO, 3));
        var orderId    = OrderId.random();
        var executions = new AtomicInteger();
        handler.handle(orderId, order -> order.add(orderId, 7));

        // When
        assertThatThrownBy(() -> handler.handle(orderId, order -> {
            executions.incrementAndGet();
            return order.addProduct("p-1", 0);
        })).isInstanceOf(ValidationException.class);

        // Then
        assertThat(executions.get()).isEqualTo(1);
        assertThat(repository.load(orderId).version()).isEqualTo(StreamVersion.of(1));
    }

    @Test
    void verify_a_concurrency_conflict_is_retried_against_the_fresh_state() {
        // Given
        var handler    = new AggregateCommandHandler<>(repository, ConcurrencyRetryPolicy.fixedBackoff(Duration.ofMillis(10), 2));
        var orderId    = OrderId.random();
        var executions = new AtomicInteger();
        handler.handle(orderId, order -> order.add(orderId, 7));

        // When
        var result = handler.handle(orderId, order -> {
            if (executions.getAndIncrement() == 0) {
                // Another writer appends after this command loaded the aggregate
                repository.persist(EventsToPersist.events(orderId, order.version(), new ProductAddedToOrder(orderId, "p-2", 1)));
            }
            return order.addProduct("p-1", 1);
        });

        // Then
        assertThat(executions.get()).isEqualTo(2);
        assertThat(result.newVersion()).isEqualTo(StreamVersion.of(3));
        assertThat(repository.load(orderId).productAndQuantity()).containsEntry("p-1", 1)
                                                                 .containsEntry("p-2", 1);
    }

    @Test
    void verify_the_conflict_is_surfaced_when_no_retries_are_allowed() {
        // Given
        var handler = new AggregateCommandHandler<>(repository, ConcurrencyRetryPolicy.noRetries());
        var orderId = OrderId.random();
        handler.handle(orderId, order -> order.add(orderId, 7));
        handler.handle(orderId, order -> order.addProduct("p-1", 1));
        handler.handle(orderId, order -> order.addProduct("p-2", 1));

        // Then
        assertThatThrownBy(() -> handler.handle(orderId, order -> {
            repository.persist(EventsToPersist.events(orderId, order.version(), new ProductAddedToOrder(orderId, "p-3", 1)));
            return order.accept();
        })).isInstanceOfSatisfying(OptimisticAppendToStreamException.class, e -> {
            assertThat(e.expectedVersion()).isEqualTo(StreamVersion.of(3));
            assertThat(e.actualVersion()).isEqualTo(StreamVersion.of(4));
        });
        assertThat(repository.load(orderId).isAccepted()).isFalse();
    }

    @Test
    void verify_a_failing_event_store_append_is_surfaced_unchanged_and_never_retried() {
        // Given
        var appendAttempts = new AtomicInteger();
        var storeFailure   = new AppendToStreamException("Connection lost while appending", new IllegalStateException("Socket closed"));
        var failingEventStore = new InMemoryEventStore(JacksonJSONSerializer.createDefault()) {
            @Override
            public <ID> AggregateEventStream<ID> appendToStream(AggregateType aggregateType,
                                                                ID aggregateId,
                                                                StreamVersion expectedVersion,
                                                                List<?> events) {
                appendAttempts.incrementAndGet();
                throw storeFailure;
            }
        };
        var failingRepository = FlexAggregateRepository.from(failingEventStore, ORDERS, OrderId.class, Order.class);
        var handler           = new AggregateCommandHandler<>(failingRepository, ConcurrencyRetryPolicy.fixedBackoff(Duration.ZERO, 3));
        var orderId           = OrderId.random();

        // When
        var thrown = catchThrowable(() -> handler.handle(orderId, order -> order.add(orderId, 7)));

        // Then
        assertThat(thrown).isSameAs(storeFailure)
                          .isNotInstanceOf(OptimisticAppendToStreamException.class);
        assertThat(appendAttempts).hasValue(1);
        assertThat(failingRepository.tryLoad(orderId)).isEmpty();
    }

    @Test
    void verify_events_for_another_aggregate_are_rejected() {
        // Given
        var handler = new AggregateCommandHandler<>(repository, ConcurrencyRetryPolicy.noRetries());
        var orderId = OrderId.random();

        // Then
        assertThatThrownBy(() -> handler.handle(orderId, order -> order.add(OrderId.random(), 7)))
                .isInstanceOf(AggregateException.class);
        assertThat(repository.tryLoad(orderId)).isEmpty();
    }
}
