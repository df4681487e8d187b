package dk.cloudcreate.eventsourcing.aggregates;

import dk.cloudcreate.essentials.shared.reflection.Reflector;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Creates the empty (no identity, version 0) {@link Aggregate} instance that persisted events are replayed onto
 *
 * @see #defaultConstructorFactory()
 */
public interface AggregateInstanceFactory {
    AggregateInstanceFactory DEFAULT_CONSTRUCTOR_FACTORY = new DefaultConstructorAggregateInstanceFactory();

    <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateImplementationType);

    /**
     * Returns an {@link AggregateInstanceFactory} that calls the default no-arguments constructor of the concrete {@link Aggregate} type
     */
    static AggregateInstanceFactory defaultConstructorFactory() {
        return DEFAULT_CONSTRUCTOR_FACTORY;
    }

    class DefaultConstructorAggregateInstanceFactory implements AggregateInstanceFactory {
        @Override
        public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateImplementationType) {
            requireNonNull(aggregateImplementationType, "You must provide an aggregateImplementationType");
            return Reflector.reflectOn(aggregateImplementationType).newInstance();
        }
    }
}
