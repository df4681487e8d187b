package dk.cloudcreate.eventsourcing.eventstore.postgresql;

import dk.cloudcreate.eventsourcing.eventstore.eventstream.AggregateType;
import dk.cloudcreate.eventsourcing.eventstore.serializer.AggregateIdSerializer;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Configuration of how the streams belonging to one {@link AggregateType} are persisted by the {@link PostgresqlEventStore}.<br>
 * All streams of the same {@link AggregateType} share one table, each stream is separated by its aggregate id.
 */
public class SeparateTablePerAggregateTypeConfiguration {
    public static final int DEFAULT_QUERY_FETCH_SIZE = 100;

    /**
     * The type of Aggregate this event stream configuration relates to
     */
    public final AggregateType         aggregateType;
    /**
     * The unique name of the Postgresql table name where ALL events related to the given Aggregate Type are stored.<br>
     * <b>Note: The table name will be converted to lower case</b>
     */
    public final String                eventStreamTableName;
    /**
     * The SQL fetch size for Queries
     */
    public final int                   queryFetchSize;
    /**
     * The {@link JSONSerializer} used to serialize and deserialize Events
     */
    public final JSONSerializer        jsonSerializer;
    /**
     * The serializer for the Aggregate Id
     */
    public final AggregateIdSerializer aggregateIdSerializer;

    public SeparateTablePerAggregateTypeConfiguration(AggregateType aggregateType,
                                                      String eventStreamTableName,
                                                      int queryFetchSize,
                                                      JSONSerializer jsonSerializer,
                                                      AggregateIdSerializer aggregateIdSerializer) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.eventStreamTableName = requireNonNull(eventStreamTableName, "No eventStreamTableName provided").toLowerCase(Locale.ROOT);
        requireTrue(queryFetchSize > 0, "queryFetchSize must be > 0");
        this.queryFetchSize = queryFetchSize;
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.aggregateIdSerializer = requireNonNull(aggregateIdSerializer, "No aggregateIdSerializer provided");
        PostgresqlUtil.checkIsValidTableOrColumnName(this.eventStreamTableName);
    }

    /**
     * Standard configuration where the table is named <code>&lt;aggregateType&gt;_events</code>
     *
     * @param aggregateType   the aggregate type
     * @param jsonSerializer  the Jackson based serializer (with any upcasters registered)
     * @param aggregateIdType the aggregate id type - see {@link AggregateIdSerializer#serializerFor(Class)}
     */
    public static SeparateTablePerAggregateTypeConfiguration standardConfigurationUsingJackson(AggregateType aggregateType,
                                                                                               JacksonJSONSerializer jsonSerializer,
                                                                                               Class<?> aggregateIdType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        return new SeparateTablePerAggregateTypeConfiguration(aggregateType,
                                                              aggregateType + "_events",
                                                              DEFAULT_QUERY_FETCH_SIZE,
                                                              jsonSerializer,
                                                              AggregateIdSerializer.serializerFor(aggregateIdType));
    }

    /**
     * Same as {@link #standardConfigurationUsingJackson(AggregateType, JacksonJSONSerializer, Class)} using {@link JacksonJSONSerializer#createDefault(EventUpcaster...)}
     */
    public static SeparateTablePerAggregateTypeConfiguration standardConfigurationUsingJackson(AggregateType aggregateType,
                                                                                               Class<?> aggregateIdType) {
        return standardConfigurationUsingJackson(aggregateType, JacksonJSONSerializer.createDefault(), aggregateIdType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeparateTablePerAggregateTypeConfiguration)) return false;
        SeparateTablePerAggregateTypeConfiguration that = (SeparateTablePerAggregateTypeConfiguration) o;
        return aggregateType.equals(that.aggregateType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType);
    }

    @Override
    public String toString() {
        return "SeparateTablePerAggregateTypeConfiguration{" +
                "aggregateType=" + aggregateType +
                ", eventStreamTableName='" + eventStreamTableName + '\'' +
                '}';
    }
}
