package dk.cloudcreate.eventsourcing.eventstore.types;

import dk.cloudcreate.essentials.types.LongType;

import static dk.cloudcreate.essentials.shared.FailFast.requireTrue;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The version of an aggregate event stream, which is the number of events appended to the stream.<br>
 * A stream without any events has version {@link #NO_EVENTS}.<br>
 * The version is what a writer presents as its <b>expected version</b> when appending new events, which is
 * how concurrent writers to the same stream are detected.
 */
public class StreamVersion extends LongType<StreamVersion> {
    public static final StreamVersion NO_EVENTS = StreamVersion.of(0);

    public StreamVersion(Long value) {
        super(value);
        requireTrue(value >= 0, msg("A StreamVersion can't be negative: {}", value));
    }

    public static StreamVersion of(long value) {
        return new StreamVersion(value);
    }

    /**
     * The {@link EventOrder} of the last event in a stream with this version ({@link EventOrder#NO_EVENTS_PERSISTED} for an empty stream)
     */
    public EventOrder lastEventOrder() {
        return EventOrder.of(value() - 1);
    }

    /**
     * The {@link EventOrder} the next event appended to a stream with this version will get
     */
    public EventOrder nextEventOrder() {
        return EventOrder.of(value());
    }

    public StreamVersion increaseBy(long numberOfEvents) {
        return StreamVersion.of(value() + numberOfEvents);
    }
}
