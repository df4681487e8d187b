package dk.cloudcreate.eventsourcing.eventstore;

/**
 * Thrown when appending events to a stream failed for a reason other than a version conflict, e.g. a lost database connection.<br>
 * The outcome of the append is unknown: the caller must re-read the stream before deciding to retry.
 *
 * @see OptimisticAppendToStreamException
 */
public class AppendToStreamException extends EventStoreException {
    public AppendToStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
