package dk.cloudcreate.eventsourcing.eventstore.types;

import java.lang.annotation.*;

/**
 * Declares the current payload revision of an Event type. Events persisted with an older revision
 * are upcasted to the current revision when they're deserialized.<br>
 * Events that aren't annotated have revision 1
 *
 * @see EventRevision#of(Class)
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Revision {
    int value() default 1;
}
