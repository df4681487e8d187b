package dk.cloudcreate.eventsourcing.aggregates.flex;

import dk.cloudcreate.eventsourcing.aggregates.*;
import dk.cloudcreate.eventsourcing.eventstore.*;
import dk.cloudcreate.eventsourcing.eventstore.eventstream.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Repository that loads {@link FlexAggregate}'s by replaying their event stream and persists the
 * {@link EventsToPersist} returned by their command methods.
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the concrete aggregate type
 */
public interface FlexAggregateRepository<ID, AGGREGATE_TYPE extends FlexAggregate<ID, AGGREGATE_TYPE>> {
    static <ID, AGGREGATE_TYPE extends FlexAggregate<ID, AGGREGATE_TYPE>> FlexAggregateRepository<ID, AGGREGATE_TYPE> from(EventStore eventStore,
                                                                                                                           AggregateType aggregateType,
                                                                                                                           Class<ID> aggregateIdType,
                                                                                                                           Class<AGGREGATE_TYPE> aggregateImplementationType) {
        return new DefaultFlexAggregateRepository<>(eventStore,
                                                    aggregateType,
                                                    aggregateIdType,
                                                    aggregateImplementationType,
                                                    AggregateInstanceFactory.defaultConstructorFactory());
    }

    static <ID, AGGREGATE_TYPE extends FlexAggregate<ID, AGGREGATE_TYPE>> FlexAggregateRepository<ID, AGGREGATE_TYPE> from(EventStore eventStore,
                                                                                                                           AggregateType aggregateType,
                                                                                                                           Class<ID> aggregateIdType,
                                                                                                                           Class<AGGREGATE_TYPE> aggregateImplementationType,
                                                                                                                           AggregateInstanceFactory aggregateInstanceFactory) {
        return new DefaultFlexAggregateRepository<>(eventStore,
                                                    aggregateType,
                                                    aggregateIdType,
                                                    aggregateImplementationType,
                                                    aggregateInstanceFactory);
    }

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Load the aggregate by replaying all the events in its stream
     *
     * @return the aggregate or {@link Optional#empty()} if the aggregate's stream is empty
     */
    Optional<AGGREGATE_TYPE> tryLoad(ID aggregateId);

    default AGGREGATE_TYPE load(ID aggregateId) {
        return tryLoad(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregateImplementationType(), aggregateType()));
    }

    /**
     * Load the aggregate or, if its stream is empty, return an empty aggregate instance (no identity, version 0),
     * which is what creation commands are invoked on
     */
    AGGREGATE_TYPE loadOrCreateEmpty(ID aggregateId);

    /**
     * Append the events to the aggregate's stream using {@link EventsToPersist#expectedVersion} as expected version
     *
     * @return the newly appended events
     * @throws OptimisticAppendToStreamException if the aggregate was modified after the events were produced
     */
    AggregateEventStream<ID> persist(EventsToPersist<ID> eventsToPersist);

    /**
     * The events of the aggregate's stream (empty for an unknown aggregate)
     */
    AggregateEventStream<ID> getEventStream(ID aggregateId);

    AggregateType aggregateType();

    Class<ID> aggregateIdType();

    Class<AGGREGATE_TYPE> aggregateImplementationType();

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    class DefaultFlexAggregateRepository<ID, AGGREGATE_TYPE extends FlexAggregate<ID, AGGREGATE_TYPE>> implements FlexAggregateRepository<ID, AGGREGATE_TYPE> {
        private static final Logger log = LoggerFactory.getLogger(FlexAggregateRepository.class);

        private final EventStore               eventStore;
        private final AggregateType            aggregateType;
        private final Class<ID>                aggregateIdType;
        private final Class<AGGREGATE_TYPE>    aggregateImplementationType;
        private final AggregateInstanceFactory aggregateInstanceFactory;

        private DefaultFlexAggregateRepository(EventStore eventStore,
                                               AggregateType aggregateType,
                                               Class<ID> aggregateIdType,
                                               Class<AGGREGATE_TYPE> aggregateImplementationType,
                                               AggregateInstanceFactory aggregateInstanceFactory) {
            this.eventStore = requireNonNull(eventStore, "You must supply an EventStore instance");
            this.aggregateType = requireNonNull(aggregateType, "You must supply an aggregateType");
            this.aggregateIdType = requireNonNull(aggregateIdType, "You must supply an aggregateIdType");
            this.aggregateImplementationType = requireNonNull(aggregateImplementationType, "You must supply an aggregateImplementationType");
            this.aggregateInstanceFactory = requireNonNull(aggregateInstanceFactory, "You must supply an aggregateInstanceFactory");
        }

        @Override
        public Optional<AGGREGATE_TYPE> tryLoad(ID aggregateId) {
            requireNonNull(aggregateId, "You must supply an aggregateId");
            log.trace("Trying to load {} with id '{}'", aggregateImplementationType.getName(), aggregateId);
            var persistedEventStream = getEventStream(aggregateId);
            if (persistedEventStream.isEmpty()) {
                log.trace("Didn't find a {} with id '{}'", aggregateImplementationType.getName(), aggregateId);
                return Optional.empty();
            }
            log.debug("Found {} with id '{}' at version {}", aggregateImplementationType.getName(), aggregateId, persistedEventStream.version());
            return Optional.of(aggregateInstanceFactory.create(aggregateImplementationType)
                                                       .rehydrate(persistedEventStream));
        }

        @Override
        public AGGREGATE_TYPE loadOrCreateEmpty(ID aggregateId) {
            return tryLoad(aggregateId).orElseGet(() -> aggregateInstanceFactory.create(aggregateImplementationType));
        }

        @Override
        public AggregateEventStream<ID> persist(EventsToPersist<ID> eventsToPersist) {
            requireNonNull(eventsToPersist, "You must supply an eventsToPersist instance");
            if (eventsToPersist.isEmpty()) {
                log.trace("No changes detected for '{}' with id '{}'", aggregateImplementationType.getName(), eventsToPersist.aggregateId);
            } else if (log.isTraceEnabled()) {
                log.trace("Persisting {} event(s) related to '{}' with id '{}' and expectedVersion {}: {}",
                          eventsToPersist.eventsToPersist.size(),
                          aggregateImplementationType.getName(),
                          eventsToPersist.aggregateId,
                          eventsToPersist.expectedVersion,
                          eventsToPersist.eventsToPersist.stream().map(event -> event.getClass().getSimpleName()).reduce((s, s2) -> s + ", " + s2).orElse(""));
            } else {
                log.debug("Persisting {} event(s) related to '{}' with id '{}' and expectedVersion {}",
                          eventsToPersist.eventsToPersist.size(),
                          aggregateImplementationType.getName(),
                          eventsToPersist.aggregateId,
                          eventsToPersist.expectedVersion);
            }
            return eventStore.appendToStream(aggregateType,
                                             eventsToPersist.aggregateId,
                                             eventsToPersist.expectedVersion,
                                             eventsToPersist.eventsToPersist);
        }

        @Override
        public AggregateEventStream<ID> getEventStream(ID aggregateId) {
            return eventStore.fetchStream(aggregateType, requireNonNull(aggregateId, "You must supply an aggregateId"));
        }

        @Override
        public AggregateType aggregateType() {
            return aggregateType;
        }

        @Override
        public Class<ID> aggregateIdType() {
            return aggregateIdType;
        }

        @Override
        public Class<AGGREGATE_TYPE> aggregateImplementationType() {
            return aggregateImplementationType;
        }

        @Override
        public String toString() {
            return "FlexAggregateRepository{" +
                    "aggregateType=" + aggregateType +
                    ", aggregateIdType=" + aggregateIdType.getName() +
                    ", aggregateImplementationType=" + aggregateImplementationType.getName() +
                    '}';
        }
    }
}
