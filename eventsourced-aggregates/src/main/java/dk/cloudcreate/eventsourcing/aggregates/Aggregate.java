package dk.cloudcreate.eventsourcing.aggregates;

import dk.cloudcreate.eventsourcing.eventstore.*;
import dk.cloudcreate.eventsourcing.eventstore.eventstream.AggregateEventStream;
import dk.cloudcreate.eventsourcing.eventstore.types.EventOrder;

import java.util.*;

/**
 * Common interface that all concrete {@link Aggregate}'s must implement. Most concrete implementations choose to extend the {@link AggregateRoot} class.<br>
 * The state of an {@link Aggregate} is derived exclusively from the events applied to it, either historic events (using {@link #rehydrate(AggregateEventStream)})
 * or new events generated by the aggregate's command methods, which are tracked as {@link #uncommittedChanges()} until they have been persisted.
 *
 * @param <ID>             the aggregate id (or stream-id) type
 * @param <EVENT>          the common event type
 * @param <AGGREGATE_TYPE> the aggregate self type
 * @see AggregateRoot
 */
public interface Aggregate<ID, EVENT extends AggregateEvent<ID>, AGGREGATE_TYPE extends Aggregate<ID, EVENT, AGGREGATE_TYPE>> {
    /**
     * The id of the aggregate (aka. the stream-id)
     *
     * @throws IllegalArgumentException if the aggregate doesn't know its id yet
     */
    ID aggregateId();

    /**
     * The id of the aggregate or {@link Optional#empty()} if the aggregate doesn't know its id yet
     */
    Optional<ID> tryGetAggregateId();

    /**
     * Has the aggregate been initialized using previously recorded/persisted events (aka. historic events) using the {@link #rehydrate(AggregateEventStream)} method
     */
    boolean hasBeenRehydrated();

    /**
     * Effectively performs a leftFold over all the previously persisted events related to this aggregate instance
     *
     * @param persistedEvents the previous persisted events related to this aggregate instance, aka. the aggregates history
     * @return the same aggregate instance (self)
     */
    AGGREGATE_TYPE rehydrate(AggregateEventStream<ID, EVENT> persistedEvents);

    /**
     * Get the eventOrder of the last event applied to the aggregate
     *
     * @return the event order of the last applied event or {@link EventOrder#NO_EVENTS_PERSISTED} in case no
     * events has ever been applied to the aggregate
     */
    EventOrder eventOrderOfLastAppliedEvent();

    /**
     * The events that have been applied to this aggregate instance but not yet persisted to
     * the underlying {@link EventStore}
     */
    List<EVENT> uncommittedChanges();

    /**
     * Resets the {@link #uncommittedChanges()} - effectively marking them as having been persisted
     * to the underlying {@link EventStore}
     */
    void markChangesAsCommitted();
}
