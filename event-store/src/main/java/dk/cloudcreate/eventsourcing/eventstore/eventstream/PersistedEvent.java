package dk.cloudcreate.eventsourcing.eventstore.eventstream;

import dk.cloudcreate.eventsourcing.eventstore.AggregateEvent;
import dk.cloudcreate.eventsourcing.eventstore.types.EventOrder;

import java.time.OffsetDateTime;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event that has been appended to the {@link dk.cloudcreate.eventsourcing.eventstore.EventStore}
 * together with its position in the aggregate's stream and the time it was appended
 *
 * @param <ID>    the aggregate id type
 * @param <EVENT> the event type
 */
public final class PersistedEvent<ID, EVENT extends AggregateEvent<ID>> {
    private final ID             aggregateId;
    private final EventOrder     eventOrder;
    private final EVENT          event;
    private final OffsetDateTime timestamp;

    public PersistedEvent(ID aggregateId, EventOrder eventOrder, EVENT event, OffsetDateTime timestamp) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.eventOrder = requireNonNull(eventOrder, "No eventOrder provided");
        this.event = requireNonNull(event, "No event provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    public ID aggregateId() {
        return aggregateId;
    }

    /**
     * The zero based position of the event within the aggregate's stream
     */
    public EventOrder eventOrder() {
        return eventOrder;
    }

    public EVENT event() {
        return event;
    }

    /**
     * When the event was appended to the stream
     */
    public OffsetDateTime timestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistedEvent)) return false;
        PersistedEvent<?, ?> that = (PersistedEvent<?, ?>) o;
        return aggregateId.equals(that.aggregateId) && eventOrder.equals(that.eventOrder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, eventOrder);
    }

    @Override
    public String toString() {
        return "PersistedEvent{" +
                "aggregateId=" + aggregateId +
                ", eventOrder=" + eventOrder +
                ", eventType=" + event.getClass().getName() +
                ", timestamp=" + timestamp +
                '}';
    }
}
