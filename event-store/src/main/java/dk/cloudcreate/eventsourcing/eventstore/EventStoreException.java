package dk.cloudcreate.eventsourcing.eventstore;

/**
 * Base exception for all {@link EventStore} related failures
 */
public class EventStoreException extends RuntimeException {
    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public EventStoreException(Throwable cause) {
        super(cause);
    }
}
