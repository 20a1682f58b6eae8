package dk.cloudcreate.eventsourcing.eventstore.eventstream;

import dk.cloudcreate.eventsourcing.eventstore.AggregateEvent;
import dk.cloudcreate.eventsourcing.eventstore.types.EventOrder;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The ordered and immutable sequence of {@link PersistedEvent}'s related to a single aggregate instance.<br>
 * The order of {@link #eventList()} is the order in which the events were appended, which is also the order
 * in which they must be applied when rehydrating the aggregate.
 *
 * @param <ID>    the aggregate id type
 * @param <EVENT> the event type
 */
public final class AggregateEventStream<ID, EVENT extends AggregateEvent<ID>> {
    private final ID                              aggregateId;
    private final List<PersistedEvent<ID, EVENT>> events;

    private AggregateEventStream(ID aggregateId, List<PersistedEvent<ID, EVENT>> events) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.events = Collections.unmodifiableList(new ArrayList<>(requireNonNull(events, "No events provided")));
    }

    public static <ID, EVENT extends AggregateEvent<ID>> AggregateEventStream<ID, EVENT> of(ID aggregateId, List<PersistedEvent<ID, EVENT>> events) {
        return new AggregateEventStream<>(aggregateId, events);
    }

    public static <ID, EVENT extends AggregateEvent<ID>> AggregateEventStream<ID, EVENT> empty(ID aggregateId) {
        return new AggregateEventStream<>(aggregateId, List.of());
    }

    public ID aggregateId() {
        return aggregateId;
    }

    public List<PersistedEvent<ID, EVENT>> eventList() {
        return events;
    }

    /**
     * The domain events, without their persistence metadata, in stream order
     */
    public List<EVENT> events() {
        var result = new ArrayList<EVENT>(events.size());
        events.forEach(persistedEvent -> result.add(persistedEvent.event()));
        return result;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    /**
     * @return the {@link EventOrder} of the last event in the stream or {@link EventOrder#NO_EVENTS_PERSISTED} if the stream is empty
     */
    public EventOrder eventOrderOfLastEvent() {
        return events.isEmpty() ? EventOrder.NO_EVENTS_PERSISTED : events.get(events.size() - 1).eventOrder();
    }

    /**
     * Create a new stream consisting of this stream's events followed by the <code>additionalEvents</code>
     */
    public AggregateEventStream<ID, EVENT> append(List<PersistedEvent<ID, EVENT>> additionalEvents) {
        requireNonNull(additionalEvents, "No additionalEvents provided");
        var combined = new ArrayList<PersistedEvent<ID, EVENT>>(events.size() + additionalEvents.size());
        combined.addAll(events);
        combined.addAll(additionalEvents);
        return new AggregateEventStream<>(aggregateId, combined);
    }

    @Override
    public String toString() {
        return "AggregateEventStream{" +
                "aggregateId=" + aggregateId +
                ", events=" + events.size() +
                ", eventOrderOfLastEvent=" + eventOrderOfLastEvent() +
                '}';
    }
}
