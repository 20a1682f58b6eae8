package dk.cloudcreate.eventsourcing.eventstore.inmemory;

import dk.cloudcreate.eventsourcing.eventstore.*;
import dk.cloudcreate.eventsourcing.eventstore.eventstream.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventStore} that keeps every aggregate's {@link AggregateEventStream} in memory.<br>
 * Each stream is immutable and is replaced atomically (per aggregate id) when events are appended, so a concurrent
 * {@link #fetchStream(Object)} either sees the stream before or after an append, never part of it.
 * Streams belonging to different aggregate ids don't share any state.
 *
 * @param <ID>    the aggregate id type
 * @param <EVENT> the common event type
 */
public final class InMemoryEventStore<ID, EVENT extends AggregateEvent<ID>> implements EventStore<ID, EVENT> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<ID, AggregateEventStream<ID, EVENT>> streams = new ConcurrentHashMap<>();
    private final Clock                                              clock;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = requireNonNull(clock, "No clock provided");
    }

    @Override
    public AggregateEventStream<ID, EVENT> appendToStream(ID aggregateId, List<? extends EVENT> events) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(events, "No events provided");
        if (events.isEmpty()) {
            log.trace("No events to append to stream '{}'", aggregateId);
            return AggregateEventStream.empty(aggregateId);
        }
        events.forEach(event -> {
            requireNonNull(event, msg("Cannot append a null event to stream '{}'", aggregateId));
            if (!aggregateId.equals(event.aggregateId())) {
                throw new EventStoreException(msg("Cannot append Event '{}' with aggregateId '{}' to the stream belonging to aggregateId '{}'",
                                                  event.getClass().getName(),
                                                  event.aggregateId(),
                                                  aggregateId));
            }
        });

        var appended = new ArrayList<PersistedEvent<ID, EVENT>>(events.size());
        streams.compute(aggregateId, (id, existingStream) -> {
            var stream    = existingStream != null ? existingStream : AggregateEventStream.<ID, EVENT>empty(id);
            var nextOrder = stream.eventOrderOfLastEvent();
            var timestamp = OffsetDateTime.now(clock);
            for (EVENT event : events) {
                nextOrder = nextOrder.increaseAndGet();
                appended.add(new PersistedEvent<>(id, nextOrder, event, timestamp));
            }
            return stream.append(appended);
        });
        log.debug("Appended {} event(s) to stream '{}' with event orders {}-{}",
                  appended.size(),
                  aggregateId,
                  appended.get(0).eventOrder(),
                  appended.get(appended.size() - 1).eventOrder());
        return AggregateEventStream.of(aggregateId, appended);
    }

    @Override
    public Optional<AggregateEventStream<ID, EVENT>> fetchStream(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        var stream = Optional.ofNullable(streams.get(aggregateId));
        if (stream.isEmpty()) {
            log.trace("Didn't find any events for stream '{}'", aggregateId);
        } else {
            log.trace("Fetched {} event(s) for stream '{}'", stream.get().size(), aggregateId);
        }
        return stream;
    }

    @Override
    public String toString() {
        return "InMemoryEventStore{" +
                "streams=" + streams.size() +
                '}';
    }
}
