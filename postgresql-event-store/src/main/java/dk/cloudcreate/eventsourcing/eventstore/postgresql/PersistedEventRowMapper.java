package dk.cloudcreate.eventsourcing.eventstore.postgresql;

import dk.cloudcreate.eventsourcing.common.types.EventId;
import dk.cloudcreate.eventsourcing.eventstore.eventstream.PersistedEvent;
import dk.cloudcreate.eventsourcing.eventstore.serializer.json.EventJSON;
import dk.cloudcreate.eventsourcing.eventstore.types.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;
import static dk.cloudcreate.eventsourcing.eventstore.postgresql.PostgresqlEventStore.*;

class PersistedEventRowMapper implements RowMapper<PersistedEvent> {
    private final SeparateTablePerAggregateTypeConfiguration config;

    PersistedEventRowMapper(SeparateTablePerAggregateTypeConfiguration configuration) {
        this.config = requireNonNull(configuration, "No EventStream configuration provided");
    }

    @Override
    public PersistedEvent map(ResultSet rs, StatementContext ctx) throws SQLException {
        return PersistedEvent.from(EventId.of(rs.getString(EVENT_ID_COLUMN)),
                                   config.aggregateType,
                                   config.aggregateIdSerializer.deserialize(rs.getString(AGGREGATE_ID_COLUMN)),
                                   resolveEventJSON(rs),
                                   EventOrder.of(rs.getLong(EVENT_ORDER_COLUMN)),
                                   rs.getObject(TIMESTAMP_COLUMN, OffsetDateTime.class));
    }

    private EventJSON resolveEventJSON(ResultSet resultSet) throws SQLException {
        var eventType = resultSet.getString(EVENT_TYPE_COLUMN);
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalStateException(msg("[{}] Row: {} - Column '{}' was empty or blank",
                                                config.aggregateType,
                                                resultSet.getRow(),
                                                EVENT_TYPE_COLUMN));
        }
        return new EventJSON(config.jsonSerializer,
                             EventType.of(eventType),
                             EventRevision.of(resultSet.getInt(EVENT_REVISION_COLUMN)),
                             resultSet.getString(EVENT_PAYLOAD_COLUMN));
    }
}
