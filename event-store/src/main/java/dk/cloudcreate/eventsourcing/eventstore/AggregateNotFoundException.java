package dk.cloudcreate.eventsourcing.eventstore;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when no events have been appended for a given aggregate id.<br>
 * An aggregate id without any events is indistinguishable from an unknown aggregate id.
 */
public class AggregateNotFoundException extends EventStoreException {
    public final Object aggregateId;

    public AggregateNotFoundException(Object aggregateId) {
        super(msg("Couldn't find any events related to aggregate with id '{}'",
                  requireNonNull(aggregateId, "You must supply an aggregateId")));
        this.aggregateId = aggregateId;
    }
}
