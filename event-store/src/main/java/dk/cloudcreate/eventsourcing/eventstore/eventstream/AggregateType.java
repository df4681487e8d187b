package dk.cloudcreate.eventsourcing.eventstore.eventstream;

import dk.cloudcreate.essentials.types.CharSequenceType;

/**
 * The category of the {@link AggregateEventStream}'s belonging to the same kind of aggregate.<br>
 * A stream is identified by its {@link AggregateType} together with the aggregate id.<br>
 * The {@link AggregateType} is typically the plural name of the aggregate, e.g. if we store deposit and withdrawal events
 * related to an Account, then the {@link AggregateType} would be "Accounts"<br>
 * <b>Note: The aggregate type is only a name and shouldn't be confused with the Fully Qualified Class Name of an Aggregate implementation class</b>
 */
public class AggregateType extends CharSequenceType<AggregateType> {
    public AggregateType(CharSequence value) {
        super(value);
    }

    public static AggregateType of(CharSequence value) {
        return new AggregateType(value);
    }
}
