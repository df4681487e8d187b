package dk.cloudcreate.eventsourcing.eventstore.postgresql;

import dk.cloudcreate.eventsourcing.common.transaction.*;
import dk.cloudcreate.eventsourcing.common.types.EventId;
import dk.cloudcreate.eventsourcing.eventstore.*;
import dk.cloudcreate.eventsourcing.eventstore.eventstream.*;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.*;
import dk.cloudcreate.eventsourcing.eventstore.types.*;
import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * Durable {@link EventStore} that stores the streams of each {@link AggregateType} in a separate Postgresql table
 * (see {@link SeparateTablePerAggregateTypeConfiguration}).<br>
 * <br>
 * Appending to a stream is performed in a single {@link HandleAwareUnitOfWork} (database transaction):
 * <ol>
 *     <li>A transaction scoped advisory lock for the stream is acquired, so concurrent appends to the same stream are serialized
 *     while appends to other streams proceed in parallel</li>
 *     <li>The current version of the stream is compared with the expected version</li>
 *     <li>All events are inserted in one batch</li>
 * </ol>
 * The <code>UNIQUE(aggregate_id, event_order)</code> constraint is the last line of protection: should a writer bypass the advisory lock,
 * the constraint violation is reported as an {@link OptimisticAppendToStreamException}.<br>
 * If a {@link UnitOfWork} is already active, the append joins it and the events are only durable once the outer {@link UnitOfWork} commits.
 */
public class PostgresqlEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlEventStore.class);

    static final String GLOBAL_ORDER_COLUMN   = "global_order";
    static final String AGGREGATE_ID_COLUMN   = "aggregate_id";
    static final String EVENT_ORDER_COLUMN    = "event_order";
    static final String EVENT_ID_COLUMN       = "event_id";
    static final String EVENT_TYPE_COLUMN     = "event_type";
    static final String EVENT_REVISION_COLUMN = "event_revision";
    static final String TIMESTAMP_COLUMN      = "timestamp";
    static final String EVENT_PAYLOAD_COLUMN  = "event_payload";

    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";
    private static final String APPEND_SAVEPOINT           = "append_to_stream";

    private final HandleAwareUnitOfWorkFactory<HandleAwareUnitOfWork>                          unitOfWorkFactory;
    private final Clock                                                                        clock;
    private final ConcurrentHashMap<AggregateType, SeparateTablePerAggregateTypeConfiguration> configurations = new ConcurrentHashMap<>();

    public PostgresqlEventStore(HandleAwareUnitOfWorkFactory<HandleAwareUnitOfWork> unitOfWorkFactory) {
        this(unitOfWorkFactory, Clock.systemUTC());
    }

    public PostgresqlEventStore(HandleAwareUnitOfWorkFactory<HandleAwareUnitOfWork> unitOfWorkFactory, Clock clock) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    public HandleAwareUnitOfWorkFactory<HandleAwareUnitOfWork> getUnitOfWorkFactory() {
        return unitOfWorkFactory;
    }

    /**
     * Register the configuration for an {@link AggregateType} and create its event stream table if it doesn't exist
     *
     * @param configuration the configuration
     * @return this {@link PostgresqlEventStore} instance
     */
    public PostgresqlEventStore addAggregateEventStreamConfiguration(SeparateTablePerAggregateTypeConfiguration configuration) {
        requireNonNull(configuration, "No configuration provided");
        var existing = configurations.putIfAbsent(configuration.aggregateType, configuration);
        requireTrue(existing == null || existing.eventStreamTableName.equals(configuration.eventStreamTableName),
                    msg("[{}] Another configuration using table '{}' is already registered", configuration.aggregateType, existing != null ? existing.eventStreamTableName : null));
        initializeEventStorageFor(configuration);
        return this;
    }

    public Optional<SeparateTablePerAggregateTypeConfiguration> findAggregateEventStreamConfiguration(AggregateType aggregateType) {
        return Optional.ofNullable(configurations.get(requireNonNull(aggregateType, "No aggregateType provided")));
    }

    private SeparateTablePerAggregateTypeConfiguration getAggregateEventStreamConfiguration(AggregateType aggregateType) {
        return findAggregateEventStreamConfiguration(aggregateType)
                .orElseThrow(() -> new EventStoreException(msg("No configuration registered for AggregateType '{}'", aggregateType)));
    }

    /**
     * Drop and recreate the event stream table for the given configuration. <b>All events are lost</b>
     */
    public void resetEventStorageFor(SeparateTablePerAggregateTypeConfiguration configuration) {
        requireNonNull(configuration, "No configuration provided");
        log.info("[{}] Resetting EventStream storage in table '{}'", configuration.aggregateType, configuration.eventStreamTableName);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> unitOfWork.handle().execute("DROP TABLE IF EXISTS " + configuration.eventStreamTableName));
        initializeEventStorageFor(configuration);
    }

    private void initializeEventStorageFor(SeparateTablePerAggregateTypeConfiguration configuration) {
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            handle.execute(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                        "    {:globalOrderColumn} bigint GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n" +
                                        "    {:aggregateIdColumn} text NOT NULL,\n" +
                                        "    {:eventOrderColumn} bigint NOT NULL,\n" +
                                        "    {:eventIdColumn} text NOT NULL,\n" +
                                        "    {:eventTypeColumn} text NOT NULL,\n" +
                                        "    {:eventRevisionColumn} integer NOT NULL,\n" +
                                        "    {:timestampColumn} TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                        "    {:eventPayloadColumn} jsonb NOT NULL,\n" +
                                        "    UNIQUE ({:aggregateIdColumn}, {:eventOrderColumn}),\n" +
                                        "    UNIQUE ({:eventIdColumn})\n" +
                                        ")",
                                arg("tableName", configuration.eventStreamTableName),
                                arg("globalOrderColumn", GLOBAL_ORDER_COLUMN),
                                arg("aggregateIdColumn", AGGREGATE_ID_COLUMN),
                                arg("eventOrderColumn", EVENT_ORDER_COLUMN),
                                arg("eventIdColumn", EVENT_ID_COLUMN),
                                arg("eventTypeColumn", EVENT_TYPE_COLUMN),
                                arg("eventRevisionColumn", EVENT_REVISION_COLUMN),
                                arg("timestampColumn", TIMESTAMP_COLUMN),
                                arg("eventPayloadColumn", EVENT_PAYLOAD_COLUMN)));
            log.info("[{}] Ensured event-stream table '{}' exists", configuration.aggregateType, configuration.eventStreamTableName);
        });
    }

    @Override
    public <ID> AggregateEventStream<ID> appendToStream(AggregateType aggregateType,
                                                        ID aggregateId,
                                                        StreamVersion expectedVersion,
                                                        List<?> events) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(expectedVersion, "No expectedVersion provided");
        requireNonNull(events, "No events provided");
        var configuration = getAggregateEventStreamConfiguration(aggregateType);

        // Serialize up front so a failing event never reaches the database
        var serializedEvents = new ArrayList<EventJSON>(events.size());
        for (var event : events) {
            requireNonNull(event, msg("[{}] Cannot append a null event to the stream of aggregate '{}'", aggregateType, aggregateId));
            serializedEvents.add(configuration.jsonSerializer.serializeEvent(event));
        }
        var serializedAggregateId = configuration.aggregateIdSerializer.serialize(aggregateId);

        try {
            return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
                var handle = unitOfWork.handle();
                lockStream(handle, configuration, serializedAggregateId);
                var actualVersion = loadCurrentVersion(handle, configuration, serializedAggregateId);
                if (!actualVersion.equals(expectedVersion)) {
                    log.debug("[{}] Rejecting append of {} event(s) to aggregate '{}': expected version {} but actual version is {}",
                              aggregateType, events.size(), aggregateId, expectedVersion, actualVersion);
                    throw new OptimisticAppendToStreamException(aggregateType, aggregateId, expectedVersion, actualVersion);
                }
                if (serializedEvents.isEmpty()) {
                    return AggregateEventStream.of(aggregateType, aggregateId, actualVersion, List.<PersistedEvent>of());
                }
                var persistedEvents = insertEvents(handle, configuration, aggregateId, serializedAggregateId, expectedVersion, serializedEvents);
                var newVersion      = expectedVersion.increaseBy(persistedEvents.size());
                log.debug("[{}] Appended {} event(s) to aggregate '{}'. Stream version {} -> {}",
                          aggregateType, persistedEvents.size(), aggregateId, expectedVersion, newVersion);
                return AggregateEventStream.of(aggregateType, aggregateId, newVersion, persistedEvents);
            });
        } catch (OptimisticAppendToStreamException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AppendToStreamException(msg("[{}] Failed to append {} event(s) to the stream of aggregate '{}'. The outcome is unknown",
                                                  aggregateType,
                                                  events.size(),
                                                  aggregateId), e);
        }
    }

    private void lockStream(Handle handle, SeparateTablePerAggregateTypeConfiguration configuration, String serializedAggregateId) {
        handle.createQuery("SELECT 1 FROM pg_advisory_xact_lock(hashtext(:lockName))")
              .bind("lockName", configuration.eventStreamTableName + ":" + serializedAggregateId)
              .mapTo(Integer.class)
              .one();
    }

    private StreamVersion loadCurrentVersion(Handle handle, SeparateTablePerAggregateTypeConfiguration configuration, String serializedAggregateId) {
        var lastEventOrder = handle.createQuery(bind("SELECT COALESCE(MAX({:eventOrderColumn}), -1) FROM {:tableName} WHERE {:aggregateIdColumn} = :aggregateId",
                                                     arg("tableName", configuration.eventStreamTableName),
                                                     arg("eventOrderColumn", EVENT_ORDER_COLUMN),
                                                     arg("aggregateIdColumn", AGGREGATE_ID_COLUMN)))
                                   .bind("aggregateId", serializedAggregateId)
                                   .mapTo(Long.class)
                                   .one();
        return EventOrder.of(lastEventOrder).toStreamVersion();
    }

    private List<PersistedEvent> insertEvents(Handle handle,
                                              SeparateTablePerAggregateTypeConfiguration configuration,
                                              Object aggregateId,
                                              String serializedAggregateId,
                                              StreamVersion expectedVersion,
                                              List<EventJSON> serializedEvents) {
        var timestamp       = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
        var eventOrder      = expectedVersion.nextEventOrder();
        var persistedEvents = new ArrayList<PersistedEvent>(serializedEvents.size());
        var batch           = handle.prepareBatch(getInsertSql(configuration));
        for (var serializedEvent : serializedEvents) {
            var eventId = EventId.random();
            batch.bind("aggregateId", serializedAggregateId)
                 .bind("eventOrder", eventOrder.longValue())
                 .bind("eventId", eventId.toString())
                 .bind("eventType", serializedEvent.getEventType().toString())
                 .bind("eventRevision", serializedEvent.getEventRevision().intValue())
                 .bind("timestamp", timestamp)
                 .bind("eventPayload", serializedEvent.getJson())
                 .add();
            persistedEvents.add(PersistedEvent.from(eventId, configuration.aggregateType, aggregateId, serializedEvent, eventOrder, timestamp));
            eventOrder = eventOrder.increaseAndGet();
        }

        handle.savepoint(APPEND_SAVEPOINT);
        try {
            batch.execute();
            handle.releaseSavepoint(APPEND_SAVEPOINT);
            return persistedEvents;
        } catch (RuntimeException e) {
            if (isUniqueKeyViolation(e)) {
                handle.rollbackToSavepoint(APPEND_SAVEPOINT);
                var actualVersion = loadCurrentVersion(handle, configuration, serializedAggregateId);
                throw new OptimisticAppendToStreamException(configuration.aggregateType, aggregateId, expectedVersion, actualVersion, e);
            }
            throw e;
        }
    }

    private static boolean isUniqueKeyViolation(Throwable e) {
        var cause = e;
        while (cause != null) {
            if (cause instanceof SQLException && UNIQUE_VIOLATION_SQL_STATE.equals(((SQLException) cause).getSQLState())) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private String getInsertSql(SeparateTablePerAggregateTypeConfiguration configuration) {
        return bind("INSERT INTO {:tableName} (\n" +
                            "    {:aggregateIdColumn}, {:eventOrderColumn}, {:eventIdColumn}, {:eventTypeColumn},\n" +
                            "    {:eventRevisionColumn}, {:timestampColumn}, {:eventPayloadColumn}\n" +
                            ") VALUES (\n" +
                            "    :aggregateId, :eventOrder, :eventId, :eventType,\n" +
                            "    :eventRevision, :timestamp, :eventPayload::jsonb\n" +
                            ")",
                    arg("tableName", configuration.eventStreamTableName),
                    arg("aggregateIdColumn", AGGREGATE_ID_COLUMN),
                    arg("eventOrderColumn", EVENT_ORDER_COLUMN),
                    arg("eventIdColumn", EVENT_ID_COLUMN),
                    arg("eventTypeColumn", EVENT_TYPE_COLUMN),
                    arg("eventRevisionColumn", EVENT_REVISION_COLUMN),
                    arg("timestampColumn", TIMESTAMP_COLUMN),
                    arg("eventPayloadColumn", EVENT_PAYLOAD_COLUMN));
    }

    @Override
    public <ID> AggregateEventStream<ID> fetchStream(AggregateType aggregateType,
                                                     ID aggregateId,
                                                     EventOrder fromEventOrder) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(fromEventOrder, "No fromEventOrder provided");
        requireTrue(fromEventOrder.longValue() >= 0, msg("fromEventOrder must be >= 0 but was {}", fromEventOrder));
        var configuration         = getAggregateEventStreamConfiguration(aggregateType);
        var serializedAggregateId = configuration.aggregateIdSerializer.serialize(aggregateId);

        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            var events = handle.createQuery(bind("SELECT * FROM {:tableName} WHERE {:aggregateIdColumn} = :aggregateId AND {:eventOrderColumn} >= :fromEventOrder ORDER BY {:eventOrderColumn} ASC",
                                                 arg("tableName", configuration.eventStreamTableName),
                                                 arg("aggregateIdColumn", AGGREGATE_ID_COLUMN),
                                                 arg("eventOrderColumn", EVENT_ORDER_COLUMN)))
                               .bind("aggregateId", serializedAggregateId)
                               .bind("fromEventOrder", fromEventOrder.longValue())
                               .setFetchSize(configuration.queryFetchSize)
                               .map(new PersistedEventRowMapper(configuration))
                               .list();
            var version = events.isEmpty() ?
                          loadCurrentVersion(handle, configuration, serializedAggregateId) :
                          events.get(events.size() - 1).eventOrder().toStreamVersion();
            log.trace("[{}] Fetched {} event(s) for aggregate '{}' from event order {}. Stream version {}",
                      aggregateType, events.size(), aggregateId, fromEventOrder, version);
            return AggregateEventStream.of(aggregateType, aggregateId, version, events);
        });
    }

    @Override
    public StreamVersion currentVersion(AggregateType aggregateType, Object aggregateId) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        var configuration         = getAggregateEventStreamConfiguration(aggregateType);
        var serializedAggregateId = configuration.aggregateIdSerializer.serialize(aggregateId);
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> loadCurrentVersion(unitOfWork.handle(), configuration, serializedAggregateId));
    }
}
