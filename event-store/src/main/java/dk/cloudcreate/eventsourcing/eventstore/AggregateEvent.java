package dk.cloudcreate.eventsourcing.eventstore;

/**
 * Common interface for all events that can be appended to an {@link EventStore}.<br>
 * Every event belongs to exactly one aggregate instance, identified by {@link #aggregateId()}.
 *
 * @param <ID> the aggregate id (or stream-id) type
 */
public interface AggregateEvent<ID> {
    /**
     * The id of the aggregate this event belongs to (aka. the stream-id)
     */
    ID aggregateId();
}
