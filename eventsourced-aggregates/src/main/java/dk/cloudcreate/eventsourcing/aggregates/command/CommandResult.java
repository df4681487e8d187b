package dk.cloudcreate.eventsourcing.aggregates.command;

import dk.cloudcreate.eventsourcing.eventstore.eventstream.*;
import dk.cloudcreate.eventsourcing.eventstore.types.StreamVersion;

import java.util.List;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The outcome of a successfully handled command: the aggregate's new stream version and the events the command appended,
 * which the caller may publish to any downstream consumer
 *
 * @param <ID> the aggregate id type
 */
public final class CommandResult<ID> {
    private final ID                       aggregateId;
    private final AggregateEventStream<ID> appendedEvents;

    public CommandResult(ID aggregateId, AggregateEventStream<ID> appendedEvents) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.appendedEvents = requireNonNull(appendedEvents, "No appendedEvents provided");
    }

    public ID aggregateId() {
        return aggregateId;
    }

    public StreamVersion newVersion() {
        return appendedEvents.version();
    }

    public List<PersistedEvent> persistedEvents() {
        return appendedEvents.eventList();
    }

    /**
     * The appended events in their deserialized form
     */
    public List<Object> events() {
        return appendedEvents.<Object>map(persistedEvent -> persistedEvent.event().deserialize())
                             .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "CommandResult{" +
                "aggregateId=" + aggregateId +
                ", newVersion=" + newVersion() +
                ", numberOfEvents=" + appendedEvents.size() +
                '}';
    }
}
