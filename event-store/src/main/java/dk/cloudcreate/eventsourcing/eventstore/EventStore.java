package dk.cloudcreate.eventsourcing.eventstore;

import dk.cloudcreate.eventsourcing.eventstore.eventstream.*;
import dk.cloudcreate.eventsourcing.eventstore.inmemory.InMemoryEventStore;

import java.util.*;

/**
 * Append-only log of events, keyed by aggregate id.<br>
 * This is the seam at which a durable backend can be substituted. Any implementation MUST honor the following:
 * <ul>
 *     <li>Events appended for an aggregate id are returned by {@link #fetchStream(Object)} in the exact order they were appended</li>
 *     <li>Events are never rewritten, reordered or deleted</li>
 *     <li>An aggregate id without any appended events is reported as not found</li>
 *     <li>Appends and loads related to the same aggregate id are atomic relative to each other</li>
 * </ul>
 *
 * @param <ID>    the aggregate id type
 * @param <EVENT> the common event type
 * @see InMemoryEventStore
 */
public interface EventStore<ID, EVENT extends AggregateEvent<ID>> {
    /**
     * Append the <code>events</code> to the tail of the stream belonging to <code>aggregateId</code> in the order provided.<br>
     * Appending an empty list is a no-op.
     *
     * @param aggregateId the id of the aggregate the events belong to
     * @param events      the events to append. Every event MUST report <code>aggregateId</code> as its {@link AggregateEvent#aggregateId()}
     * @return the events that were appended, wrapped as {@link PersistedEvent}'s with their assigned event order
     * @throws EventStoreException in case an event belongs to a different aggregate id
     */
    AggregateEventStream<ID, EVENT> appendToStream(ID aggregateId, List<? extends EVENT> events);

    /**
     * Fetch the full ordered stream of events appended for the given <code>aggregateId</code>
     *
     * @param aggregateId the id of the aggregate
     * @return the {@link AggregateEventStream} or {@link Optional#empty()} if no events have been appended for the given <code>aggregateId</code>
     */
    Optional<AggregateEventStream<ID, EVENT>> fetchStream(ID aggregateId);

    /**
     * Load the full ordered stream of events appended for the given <code>aggregateId</code>
     *
     * @param aggregateId the id of the aggregate
     * @return the {@link AggregateEventStream}
     * @throws AggregateNotFoundException if no events have been appended for the given <code>aggregateId</code>
     */
    default AggregateEventStream<ID, EVENT> loadStream(ID aggregateId) {
        return fetchStream(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId));
    }

    /**
     * Load the last event appended for the given <code>aggregateId</code>
     *
     * @param aggregateId the id of the aggregate
     * @return the last {@link PersistedEvent} or {@link Optional#empty()} if no events have been appended for the given <code>aggregateId</code>
     */
    default Optional<PersistedEvent<ID, EVENT>> loadLastPersistedEvent(ID aggregateId) {
        return fetchStream(aggregateId).map(stream -> stream.eventList().get(stream.size() - 1));
    }
}
