package dk.cloudcreate.eventsourcing.aggregates.flex;

import dk.cloudcreate.essentials.shared.reflection.invocation.*;
import dk.cloudcreate.essentials.shared.types.GenericType;
import dk.cloudcreate.eventsourcing.aggregates.*;
import dk.cloudcreate.eventsourcing.eventstore.EventStoreException;
import dk.cloudcreate.eventsourcing.eventstore.eventstream.*;
import dk.cloudcreate.eventsourcing.eventstore.types.StreamVersion;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for aggregates whose state can only change by replaying persisted events.<br>
 * Command methods validate against the current state and return the events they produce wrapped in an {@link EventsToPersist},
 * leaving the aggregate instance untouched. The events only become part of the aggregate's state after they've been appended to
 * the stream and the aggregate is loaded again.<br>
 * <br>
 * Each event type the aggregate supports must be handled by a single argument method annotated with {@link EventHandler}.
 * An event without a matching {@link EventHandler} method causes a {@link ReplayException}, as skipping it would leave the
 * aggregate's state incomplete:
 * <pre>{@code
 * public class Order extends FlexAggregate<OrderId, Order> {
 *     private boolean accepted;
 *
 *     public EventsToPersist<OrderId> accept() {
 *         requireIdentity("accept");
 *         if (accepted) {
 *             return noEvents();
 *         }
 *         return events(new OrderAccepted(aggregateId()));
 *     }
 *
 *     @EventHandler
 *     private void on(OrderAccepted e) {
 *         accepted = true;
 *     }
 * }
 * }</pre>
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the concrete aggregate type
 */
public abstract class FlexAggregate<ID, AGGREGATE_TYPE extends FlexAggregate<ID, AGGREGATE_TYPE>> implements Aggregate<ID, AGGREGATE_TYPE> {
    private final PatternMatchingMethodInvoker<Object> invoker;
    private       ID                                   aggregateId;
    private       StreamVersion                        version = StreamVersion.NO_EVENTS;
    private       boolean                              hasBeenRehydrated;

    protected FlexAggregate() {
        invoker = new PatternMatchingMethodInvoker<>(this,
                                                     new SingleArgumentAnnotatedMethodPatternMatcher<>(EventHandler.class,
                                                                                                       new GenericType<Object>() {
                                                                                                       }),
                                                     InvocationStrategy.InvokeMostSpecificTypeMatched);
    }

    @Override
    public ID aggregateId() {
        return aggregateId;
    }

    @Override
    public StreamVersion version() {
        return version;
    }

    @Override
    public boolean hasBeenRehydrated() {
        return hasBeenRehydrated;
    }

    /**
     * Apply the persisted events, in order, to this aggregate instance.<br>
     * The stream may be the tail of the aggregate's stream, as long as its first event follows directly after the last event already applied.
     *
     * @throws ReplayException if an event belongs to another aggregate, doesn't follow the previous event, can't be deserialized
     *                         or has no matching {@link EventHandler} method
     */
    @SuppressWarnings("unchecked")
    @Override
    public AGGREGATE_TYPE rehydrate(AggregateEventStream<ID> persistedEvents) {
        requireNonNull(persistedEvents, "You must provide an AggregateEventStream");
        if (aggregateId != null && !aggregateId.equals(persistedEvents.aggregateId())) {
            throw new ReplayException(msg("Cannot rehydrate {} with id '{}' using the stream of aggregate '{}'",
                                          getClass().getSimpleName(),
                                          aggregateId,
                                          persistedEvents.aggregateId()));
        }
        persistedEvents.stream().forEach(persistedEvent -> applyHistoricEvent(persistedEvents.aggregateId(), persistedEvent));
        hasBeenRehydrated = true;
        return (AGGREGATE_TYPE) this;
    }

    private void applyHistoricEvent(ID streamAggregateId, PersistedEvent persistedEvent) {
        if (!streamAggregateId.equals(persistedEvent.aggregateId())) {
            throw new ReplayException(msg("Event '{}' with eventOrder {} belongs to aggregate '{}' and not to {} with id '{}'",
                                          persistedEvent.eventId(),
                                          persistedEvent.eventOrder(),
                                          persistedEvent.aggregateId(),
                                          getClass().getSimpleName(),
                                          streamAggregateId));
        }
        if (!version.nextEventOrder().equals(persistedEvent.eventOrder())) {
            throw new ReplayException(msg("{} with id '{}' is at version {} and expected the next event to have eventOrder {}, but it had eventOrder {}",
                                          getClass().getSimpleName(),
                                          streamAggregateId,
                                          version,
                                          version.nextEventOrder(),
                                          persistedEvent.eventOrder()));
        }

        Object event;
        try {
            event = persistedEvent.event().deserialize();
        } catch (EventStoreException e) {
            throw new ReplayException(msg("Failed to deserialize event '{}' of type '{}' with eventOrder {} for {} with id '{}'",
                                          persistedEvent.eventId(),
                                          persistedEvent.eventType(),
                                          persistedEvent.eventOrder(),
                                          getClass().getSimpleName(),
                                          streamAggregateId), e);
        }

        invoker.invoke(event, unmatchedEvent -> {
            throw new ReplayException(msg("{} doesn't have an @EventHandler method for event type '{}' (eventOrder {} of aggregate '{}')",
                                          getClass().getSimpleName(),
                                          unmatchedEvent.getClass().getName(),
                                          persistedEvent.eventOrder(),
                                          streamAggregateId));
        });
        if (aggregateId == null) {
            aggregateId = streamAggregateId;
        }
        version = version.increaseBy(1);
    }

    /**
     * Guard for every command, except the one that creates the aggregate
     *
     * @param command the name of the command (used in the error message)
     * @throws ValidationException if no events have been applied to this aggregate
     */
    protected void requireIdentity(String command) {
        if (!hasIdentity()) {
            throw new ValidationException(msg("Cannot {} as the {} doesn't exist yet", command, getClass().getSimpleName()));
        }
    }

    /**
     * Guard for the command that creates the aggregate
     *
     * @param command the name of the command (used in the error message)
     * @throws ValidationException if events have already been applied to this aggregate
     */
    protected void requireNoIdentity(String command) {
        if (hasIdentity()) {
            throw new ValidationException(msg("Cannot {} as {} with id '{}' already exists", command, getClass().getSimpleName(), aggregateId));
        }
    }

    /**
     * Wrap the events produced by a command on this (existing) aggregate
     */
    protected EventsToPersist<ID> events(Object... eventsToPersist) {
        return EventsToPersist.events(this, eventsToPersist);
    }

    /**
     * The result of a command that didn't produce any events (e.g. due to idempotency checks)
     */
    protected EventsToPersist<ID> noEvents() {
        return EventsToPersist.noEvents(this);
    }
}
