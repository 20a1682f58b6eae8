package dk.cloudcreate.eventsourcing.aggregates.test_data;

import dk.cloudcreate.eventsourcing.eventstore.*;
import dk.cloudcreate.eventsourcing.eventstore.eventstream.AggregateEventStream;
import dk.cloudcreate.eventsourcing.eventstore.inmemory.InMemoryEventStore;

import java.util.*;

/**
 * {@link EventStore} that records the calls to {@link #appendToStream(Object, List)} before delegating to an {@link InMemoryEventStore}
 */
public class RecordingEventStore implements EventStore<ShipmentId, ShipmentEvent> {
    public final List<List<? extends ShipmentEvent>>           appendCalls = new ArrayList<>();
    private final InMemoryEventStore<ShipmentId, ShipmentEvent> delegate    = new InMemoryEventStore<>();

    @Override
    public AggregateEventStream<ShipmentId, ShipmentEvent> appendToStream(ShipmentId aggregateId, List<? extends ShipmentEvent> events) {
        appendCalls.add(events);
        return delegate.appendToStream(aggregateId, events);
    }

    @Override
    public Optional<AggregateEventStream<ShipmentId, ShipmentEvent>> fetchStream(ShipmentId aggregateId) {
        return delegate.fetchStream(aggregateId);
    }
}
