package dk.cloudcreate.eventsourcing.aggregates;

/**
 * Thrown when a persisted event can't be applied to an aggregate, e.g. because the aggregate has no
 * {@link EventHandler} for the event type or because the event belongs to another aggregate.<br>
 * This signals a data or schema versioning problem in the stream and is never retried.
 */
public class ReplayException extends AggregateException {
    public ReplayException(String message) {
        super(message);
    }

    public ReplayException(String message, Throwable cause) {
        super(message, cause);
    }
}
