package dk.cloudcreate.eventsourcing.aggregates;

/**
 * A command was rejected by the aggregate before any event was produced
 * (e.g. a non positive amount or a command issued before the aggregate has its identity).<br>
 * The caller has to correct the command; it's never retried automatically.
 */
public class ValidationException extends AggregateException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
