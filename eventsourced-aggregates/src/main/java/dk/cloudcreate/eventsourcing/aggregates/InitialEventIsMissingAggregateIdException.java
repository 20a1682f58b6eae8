package dk.cloudcreate.eventsourcing.aggregates;

/**
 * Thrown when the first event applied to an {@link AggregateRoot}, that doesn't yet know its aggregate id, doesn't contain an aggregate id
 */
public class InitialEventIsMissingAggregateIdException extends AggregateException {
    public InitialEventIsMissingAggregateIdException(String message) {
        super(message);
    }
}
