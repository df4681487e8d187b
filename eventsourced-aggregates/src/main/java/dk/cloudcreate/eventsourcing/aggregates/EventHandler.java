package dk.cloudcreate.eventsourcing.aggregates;

import java.lang.annotation.*;

/**
 * Marks the single argument method that applies an event of the argument's type to an {@link Aggregate} instance.<br>
 * Event handler methods may be private and must only change the aggregate's state; they must never validate or throw.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface EventHandler {
}
