package dk.cloudcreate.eventsourcing.aggregates.flex;

import dk.cloudcreate.eventsourcing.eventstore.types.StreamVersion;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The result of a command method on a {@link FlexAggregate}: the id of the aggregate, the stream version the command
 * was based on and the events the command produced.<br>
 * The {@link #expectedVersion} is what's presented to the event store when the events are appended, which is how a
 * concurrent modification of the same aggregate is detected.
 *
 * @param <ID> the aggregate id type
 */
public final class EventsToPersist<ID> {
    public final ID            aggregateId;
    /**
     * The version of the aggregate's stream the command was based on ({@link StreamVersion#NO_EVENTS} for a new aggregate)
     */
    public final StreamVersion expectedVersion;
    public final List<Object>  eventsToPersist;

    private EventsToPersist(ID aggregateId,
                            StreamVersion expectedVersion,
                            List<Object> eventsToPersist) {
        this.aggregateId = requireNonNull(aggregateId, "You must supply an aggregate id");
        this.expectedVersion = requireNonNull(expectedVersion, "You must supply an expectedVersion");
        this.eventsToPersist = List.copyOf(requireNonNull(eventsToPersist, "You must supply eventsToPersist"));
    }

    /**
     * Wrap the events that should be persisted for a new aggregate
     *
     * @param aggregateId     the aggregate id this relates to
     * @param eventsToPersist the events to persist; a new aggregate must have at least one event
     * @param <ID>            the aggregate id type
     */
    public static <ID> EventsToPersist<ID> initialAggregateEvents(ID aggregateId,
                                                                  Object... eventsToPersist) {
        return new EventsToPersist<>(requireNonNull(aggregateId, "You must supply an aggregateId"),
                                     StreamVersion.NO_EVENTS,
                                     List.of(requireNonEmpty(eventsToPersist, "A new aggregate instance must contain at least one event to persist")));
    }

    /**
     * Wrap the events that should be persisted for an existing aggregate
     *
     * @param aggregateId     the aggregate id this relates to
     * @param expectedVersion the version of the aggregate's stream the command was based on
     * @param eventsToPersist the events to persist, which may be empty
     * @param <ID>            the aggregate id type
     */
    public static <ID> EventsToPersist<ID> events(ID aggregateId,
                                                  StreamVersion expectedVersion,
                                                  Object... eventsToPersist) {
        return new EventsToPersist<>(aggregateId,
                                     expectedVersion,
                                     List.of(eventsToPersist));
    }

    /**
     * Wrap the events produced by a command on the given aggregate, using the aggregate's {@link FlexAggregate#version()} as expected version
     */
    public static <ID, AGGREGATE_TYPE extends FlexAggregate<ID, AGGREGATE_TYPE>> EventsToPersist<ID> events(FlexAggregate<ID, AGGREGATE_TYPE> aggregate,
                                                                                                            Object... eventsToPersist) {
        requireNonNull(aggregate, "You must supply an aggregate");
        return new EventsToPersist<>(requireNonNull(aggregate.aggregateId(), "Aggregate doesn't have an aggregateId, please use initialAggregateEvents(id, events)"),
                                     aggregate.version(),
                                     List.of(eventsToPersist));
    }

    /**
     * The result of a command that didn't have any side effect (e.g. due to idempotent handling)
     */
    public static <ID, AGGREGATE_TYPE extends FlexAggregate<ID, AGGREGATE_TYPE>> EventsToPersist<ID> noEvents(FlexAggregate<ID, AGGREGATE_TYPE> aggregate) {
        return events(aggregate);
    }

    public boolean isEmpty() {
        return eventsToPersist.isEmpty();
    }

    /**
     * Combine the events of this instance with the events of a command executed on the aggregate <b>after</b> this instance's events were applied.
     *
     * @param appendEventsToPersist the events to append; its {@link #expectedVersion} must be this instance's expected version plus the number of events in this instance
     * @return a NEW {@link EventsToPersist} with the combined events and this instance's {@link #expectedVersion}
     */
    public EventsToPersist<ID> append(EventsToPersist<ID> appendEventsToPersist) {
        requireNonNull(appendEventsToPersist, "You must supply an appendEventsToPersist instance");
        if (!aggregateId.equals(appendEventsToPersist.aggregateId)) {
            throw new IllegalArgumentException(msg("Cannot append appendEventsToPersist since aggregate id's are not the same. " +
                                                           "this.aggregateId='{}', appendEventsToPersist.aggregateId='{}'",
                                                   aggregateId,
                                                   appendEventsToPersist.aggregateId));
        }
        var expectedVersionOfAppended = expectedVersion.increaseBy(eventsToPersist.size());
        if (!expectedVersionOfAppended.equals(appendEventsToPersist.expectedVersion)) {
            throw new IllegalArgumentException(msg("Cannot append appendEventsToPersist as its expectedVersion was {} but it was expected to be {}",
                                                   appendEventsToPersist.expectedVersion,
                                                   expectedVersionOfAppended));
        }

        var allEventsToPersist = new ArrayList<>(eventsToPersist);
        allEventsToPersist.addAll(appendEventsToPersist.eventsToPersist);
        return new EventsToPersist<>(aggregateId,
                                     expectedVersion,
                                     allEventsToPersist);
    }

    @Override
    public String toString() {
        return "EventsToPersist{" +
                "aggregateId=" + aggregateId +
                ", expectedVersion=" + expectedVersion +
                ", eventsToPersist=" + eventsToPersist.size() +
                '}';
    }
}
