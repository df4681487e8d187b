package dk.cloudcreate.eventsourcing.eventstore.serializer;

import dk.cloudcreate.eventsourcing.eventstore.EventStoreException;
import dk.cloudcreate.essentials.shared.reflection.Reflector;
import dk.cloudcreate.essentials.types.CharSequenceType;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Converts aggregate id's to and from the String value used when persisting and querying event streams
 */
public interface AggregateIdSerializer {
    String serialize(Object aggregateId);

    Object deserialize(String serializedAggregateId);

    Class<?> aggregateIdType();

    /**
     * Create an {@link AggregateIdSerializer} for a {@link String} or {@link CharSequenceType} based aggregate id type.<br>
     * {@link CharSequenceType} sub types must have a constructor that accepts the String value
     *
     * @param aggregateIdType the aggregate id type
     * @return the {@link AggregateIdSerializer}
     */
    static AggregateIdSerializer serializerFor(Class<?> aggregateIdType) {
        requireNonNull(aggregateIdType, "No aggregateIdType provided");
        if (aggregateIdType == String.class) {
            return new StringAggregateIdSerializer();
        }
        if (CharSequenceType.class.isAssignableFrom(aggregateIdType)) {
            return new CharSequenceTypeAggregateIdSerializer(aggregateIdType);
        }
        throw new IllegalArgumentException(msg("Unsupported aggregateIdType '{}'. Please provide a custom AggregateIdSerializer", aggregateIdType.getName()));
    }

    class StringAggregateIdSerializer implements AggregateIdSerializer {
        @Override
        public String serialize(Object aggregateId) {
            return requireNonNull(aggregateId, "No aggregateId provided").toString();
        }

        @Override
        public Object deserialize(String serializedAggregateId) {
            return requireNonNull(serializedAggregateId, "No serializedAggregateId provided");
        }

        @Override
        public Class<?> aggregateIdType() {
            return String.class;
        }
    }

    class CharSequenceTypeAggregateIdSerializer implements AggregateIdSerializer {
        private final Class<?>  aggregateIdType;
        private final Reflector reflector;

        public CharSequenceTypeAggregateIdSerializer(Class<?> aggregateIdType) {
            this.aggregateIdType = requireNonNull(aggregateIdType, "No aggregateIdType provided");
            this.reflector = Reflector.reflectOn(aggregateIdType);
        }

        @Override
        public String serialize(Object aggregateId) {
            requireNonNull(aggregateId, "No aggregateId provided");
            if (!aggregateIdType.isInstance(aggregateId)) {
                throw new EventStoreException(msg("Expected an aggregateId of type '{}' but got '{}'", aggregateIdType.getName(), aggregateId.getClass().getName()));
            }
            return aggregateId.toString();
        }

        @Override
        public Object deserialize(String serializedAggregateId) {
            requireNonNull(serializedAggregateId, "No serializedAggregateId provided");
            return reflector.newInstance(serializedAggregateId);
        }

        @Override
        public Class<?> aggregateIdType() {
            return aggregateIdType;
        }
    }
}
