package dk.cloudcreate.eventsourcing.aggregates;

import dk.cloudcreate.essentials.shared.reflection.invocation.*;
import dk.cloudcreate.essentials.shared.types.GenericType;
import dk.cloudcreate.eventsourcing.eventstore.AggregateEvent;
import dk.cloudcreate.eventsourcing.eventstore.eventstream.AggregateEventStream;
import dk.cloudcreate.eventsourcing.eventstore.types.EventOrder;

import java.util.*;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A specialized and opinionated mutable {@link Aggregate} design<br>
 * Every change to the aggregate's state MUST be the result of an event being applied: new events are applied using {@link #apply(AggregateEvent)}
 * and historic events are applied using {@link #rehydrate(AggregateEventStream)}/{@link #rehydrate(Stream)}.<br>
 * Both paths go through the same application routine, which:
 * <ol>
 *     <li>assigns the aggregate id from the event if the aggregate doesn't already know its id
 *     (and otherwise verifies that the event belongs to this aggregate)</li>
 *     <li>calls the (private) method annotated with {@link EventHandler}, whose argument type most specifically matches the event type.
 *     Events without a matching {@link EventHandler} method are ignored</li>
 *     <li>keeps track of the {@link EventOrder} of the last event applied</li>
 *     <li>only for new events: adds the event to the {@link #uncommittedChanges()}</li>
 * </ol>
 * Concrete aggregates must therefore only modify their state from within {@link EventHandler} annotated methods.
 * <p>
 * Note: <strong>The {@link AggregateRoot} works best in combination with the {@link AggregateRepository}</strong>
 *
 * @param <ID>             the aggregate id type
 * @param <EVENT>          the common event type
 * @param <AGGREGATE_TYPE> the aggregate self type (i.e. your concrete aggregate type)
 */
public abstract class AggregateRoot<ID, EVENT extends AggregateEvent<ID>, AGGREGATE_TYPE extends AggregateRoot<ID, EVENT, AGGREGATE_TYPE>> implements Aggregate<ID, EVENT, AGGREGATE_TYPE> {
    private final PatternMatchingMethodInvoker<AggregateEvent<ID>> invoker;
    private final List<EVENT>                                      uncommittedChanges;
    private       ID                                               aggregateId;
    private       EventOrder                                       eventOrderOfLastAppliedEvent;
    private       boolean                                          hasBeenRehydrated;

    /**
     * Create an empty aggregate instance, which will learn its aggregate id from the first event applied.<br>
     * Used for rehydration
     */
    protected AggregateRoot() {
        invoker = new PatternMatchingMethodInvoker<>(this,
                                                     new SingleArgumentAnnotatedMethodPatternMatcher<>(EventHandler.class,
                                                                                                       new GenericType<>() {
                                                                                                       }),
                                                     InvocationStrategy.InvokeMostSpecificTypeMatched);
        uncommittedChanges = new ArrayList<>();
        eventOrderOfLastAppliedEvent = EventOrder.NO_EVENTS_PERSISTED;
    }

    /**
     * Create an aggregate instance that already knows its aggregate id, but which hasn't had any events applied.<br>
     * Every event applied to the aggregate MUST belong to the <code>aggregateId</code>
     *
     * @param aggregateId the id of the aggregate
     */
    protected AggregateRoot(ID aggregateId) {
        this();
        this.aggregateId = requireNonNull(aggregateId, "You must provide an aggregateId");
    }

    @Override
    public AGGREGATE_TYPE rehydrate(AggregateEventStream<ID, EVENT> persistedEvents) {
        requireNonNull(persistedEvents, "You must provide a persistedEvents stream");
        persistedEvents.eventList().forEach(persistedEvent -> applyEvent(persistedEvent.event(),
                                                                         persistedEvent.eventOrder(),
                                                                         false));
        hasBeenRehydrated = true;
        return self();
    }

    /**
     * Effectively performs a leftFold over all the previous events related to this aggregate instance
     *
     * @param previousEvents the previous events related to this aggregate instance, aka. the aggregates history
     * @return the same aggregate instance (self)
     */
    public AGGREGATE_TYPE rehydrate(Stream<? extends EVENT> previousEvents) {
        requireNonNull(previousEvents, "You must provide a previousEvents stream");
        previousEvents.forEach(event -> applyEvent(event,
                                                   eventOrderOfLastAppliedEvent.increaseAndGet(),
                                                   false));
        hasBeenRehydrated = true;
        return self();
    }

    /**
     * Apply a new non persisted/uncommitted Event to this aggregate instance.<br>
     * If the aggregate doesn't know its aggregate id yet, then {@link AggregateEvent#aggregateId()} of the event MUST return the
     * id of the aggregate.
     *
     * @param event the event to apply
     */
    protected void apply(EVENT event) {
        applyEvent(event,
                   eventOrderOfLastAppliedEvent.increaseAndGet(),
                   true);
    }

    private void applyEvent(EVENT event, EventOrder eventOrder, boolean isNewEvent) {
        requireNonNull(event, "You must supply an event");
        var eventAggregateId = event.aggregateId();
        if (aggregateId == null) {
            if (eventAggregateId == null) {
                throw new InitialEventIsMissingAggregateIdException(msg("The first Event '{}' applied to Aggregate '{}' didn't contain an aggregateId",
                                                                        event.getClass().getName(),
                                                                        this.getClass().getName()));
            }
            aggregateId = eventAggregateId;
        } else if (!Objects.equals(eventAggregateId, aggregateId)) {
            throw new AggregateException(msg("Aggregate Id's do not match! Cannot apply Event '{}' with aggregateId '{}' to Aggregate '{}' with aggregateId '{}'",
                                             event.getClass().getName(),
                                             eventAggregateId,
                                             this.getClass().getName(),
                                             aggregateId));
        }
        invoker.invoke(event, unmatchedEvent -> {
            // Ignore unmatched events as Aggregates don't necessarily need handle every event
        });
        eventOrderOfLastAppliedEvent = eventOrder;
        if (isNewEvent) {
            uncommittedChanges.add(event);
        }
    }

    @Override
    public ID aggregateId() {
        requireNonNull(aggregateId, "The aggregate id has not been set on the AggregateRoot and not supplied using one of the Event applied to it. At least the first event MUST supply it");
        return aggregateId;
    }

    @Override
    public Optional<ID> tryGetAggregateId() {
        return Optional.ofNullable(aggregateId);
    }

    @Override
    public boolean hasBeenRehydrated() {
        return hasBeenRehydrated;
    }

    /**
     * Has any event, historic or new, been applied to this aggregate instance
     */
    public boolean hasAppliedEvents() {
        return !EventOrder.NO_EVENTS_PERSISTED.equals(eventOrderOfLastAppliedEvent);
    }

    @Override
    public EventOrder eventOrderOfLastAppliedEvent() {
        return eventOrderOfLastAppliedEvent;
    }

    @Override
    public List<EVENT> uncommittedChanges() {
        return Collections.unmodifiableList(new ArrayList<>(uncommittedChanges));
    }

    @Override
    public void markChangesAsCommitted() {
        uncommittedChanges.clear();
    }

    @SuppressWarnings("unchecked")
    private AGGREGATE_TYPE self() {
        return (AGGREGATE_TYPE) this;
    }
}
