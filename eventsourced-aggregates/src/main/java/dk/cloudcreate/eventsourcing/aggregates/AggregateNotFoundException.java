package dk.cloudcreate.eventsourcing.aggregates;

import dk.cloudcreate.eventsourcing.eventstore.eventstream.AggregateType;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class AggregateNotFoundException extends AggregateException {
    public final Object        aggregateId;
    public final Class<?>      aggregateImplementationType;
    public final AggregateType aggregateType;

    public AggregateNotFoundException(Object aggregateId, Class<?> aggregateImplementationType, AggregateType aggregateType) {
        super(msg("Couldn't find a '{}' aggregate with Id '{}' belonging to the aggregateType '{}'",
                  aggregateImplementationType.getName(),
                  aggregateId,
                  aggregateType));
        this.aggregateId = aggregateId;
        this.aggregateImplementationType = aggregateImplementationType;
        this.aggregateType = aggregateType;
    }
}
