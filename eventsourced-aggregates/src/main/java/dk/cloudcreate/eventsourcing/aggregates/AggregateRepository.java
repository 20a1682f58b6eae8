package dk.cloudcreate.eventsourcing.aggregates;

import dk.cloudcreate.eventsourcing.eventstore.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Opinionated {@link Aggregate} Repository that's built to persist and load a specific {@link Aggregate} type in combination
 * with an {@link EventStore} and an {@link AggregateInstanceFactory}.<br>
 * You can use the {@link #from(EventStore, AggregateInstanceFactory, Class)} to create a new {@link AggregateRepository}
 * instance that supports the most common repository methods.<br>
 * Alternatively you can extend from the {@link DefaultAggregateRepository} and add your own special methods
 *
 * @param <ID>             the aggregate id type (aka stream-id)
 * @param <EVENT>          the common event type
 * @param <AGGREGATE_TYPE> the aggregate implementation type
 * @see DefaultAggregateRepository
 */
public interface AggregateRepository<ID, EVENT extends AggregateEvent<ID>, AGGREGATE_TYPE extends Aggregate<ID, EVENT, AGGREGATE_TYPE>> {
    /**
     * Create an {@link AggregateRepository} instance that supports loading and persisting the given Aggregate type.
     *
     * @param <ID>                        the aggregate ID type
     * @param <EVENT>                     the common event type
     * @param <AGGREGATE_TYPE>            the concrete aggregate type (MUST be a subtype of {@link Aggregate})
     * @param eventStore                  the {@link EventStore} instance to use
     * @param aggregateInstanceFactory    the factory responsible for instantiating your {@link Aggregate}'s when loading them from the {@link EventStore}
     * @param aggregateImplementationType the concrete aggregate type
     * @return a repository instance that can be used to load and save aggregates of type <code>aggregateImplementationType</code>
     */
    static <ID, EVENT extends AggregateEvent<ID>, AGGREGATE_TYPE extends Aggregate<ID, EVENT, AGGREGATE_TYPE>> AggregateRepository<ID, EVENT, AGGREGATE_TYPE> from(EventStore<ID, EVENT> eventStore,
                                                                                                                                                                 AggregateInstanceFactory aggregateInstanceFactory,
                                                                                                                                                                 Class<AGGREGATE_TYPE> aggregateImplementationType) {
        return new DefaultAggregateRepository<>(eventStore,
                                                aggregateInstanceFactory,
                                                aggregateImplementationType);
    }

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Try to load an {@link Aggregate} instance with the specified <code>aggregateId</code> from the underlying {@link EventStore}
     *
     * @param aggregateId the id of the aggregate we want to load
     * @return an {@link Optional} with the matching {@link Aggregate} instance if any events exist for it, otherwise {@link Optional#empty()}
     */
    Optional<AGGREGATE_TYPE> tryLoad(ID aggregateId);

    /**
     * Load an {@link Aggregate} instance with the specified <code>aggregateId</code> from the underlying {@link EventStore}.<br>
     * If no events exist for the <code>aggregateId</code> then an empty aggregate instance (without aggregate id and in its initial state) is returned.
     * Use {@link #tryLoad(Object)} if you need to distinguish between these cases.
     *
     * @param aggregateId the id of the aggregate we want to load
     * @return the rehydrated {@link Aggregate} or an empty {@link Aggregate} instance
     */
    AGGREGATE_TYPE load(ID aggregateId);

    /**
     * Append the {@link Aggregate#uncommittedChanges()} to the underlying {@link EventStore} and mark them as committed.<br>
     * If the aggregate doesn't have any uncommitted changes, then the {@link EventStore} isn't called.
     *
     * @param aggregate the aggregate instance to persist
     */
    void save(AGGREGATE_TYPE aggregate);

    /**
     * The type of {@link Aggregate} implementation this repository handles
     */
    Class<AGGREGATE_TYPE> aggregateImplementationType();

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Default {@link AggregateRepository} implementation. You can extend this class directly if you need to expand the supported method or
     * use {@link AggregateRepository#from(EventStore, AggregateInstanceFactory, Class)} to create a default instance
     *
     * @param <ID>             the aggregate ID type
     * @param <EVENT>          the common event type
     * @param <AGGREGATE_TYPE> the concrete aggregate type  (MUST be a subtype of {@link Aggregate})
     */
    class DefaultAggregateRepository<ID, EVENT extends AggregateEvent<ID>, AGGREGATE_TYPE extends Aggregate<ID, EVENT, AGGREGATE_TYPE>> implements AggregateRepository<ID, EVENT, AGGREGATE_TYPE> {
        private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

        private final EventStore<ID, EVENT>    eventStore;
        private final AggregateInstanceFactory aggregateInstanceFactory;
        private final Class<AGGREGATE_TYPE>    aggregateImplementationType;

        protected DefaultAggregateRepository(EventStore<ID, EVENT> eventStore,
                                             AggregateInstanceFactory aggregateInstanceFactory,
                                             Class<AGGREGATE_TYPE> aggregateImplementationType) {
            this.eventStore = requireNonNull(eventStore, "You must supply an EventStore instance");
            this.aggregateInstanceFactory = requireNonNull(aggregateInstanceFactory, "You must supply an AggregateInstanceFactory instance");
            this.aggregateImplementationType = requireNonNull(aggregateImplementationType, "You must supply an aggregateImplementationType");
        }

        @Override
        public Optional<AGGREGATE_TYPE> tryLoad(ID aggregateId) {
            requireNonNull(aggregateId, "You must supply an aggregateId");
            log.trace("Trying to load {} with id '{}'", aggregateImplementationType.getName(), aggregateId);
            var potentialPersistedEventStream = eventStore.fetchStream(aggregateId);
            if (potentialPersistedEventStream.isEmpty()) {
                log.trace("Didn't find a {} with id '{}'", aggregateImplementationType.getName(), aggregateId);
                return Optional.empty();
            }
            var persistedEventStream = potentialPersistedEventStream.get();
            log.debug("Found {} with id '{}' and {} event(s) - last eventOrder {}",
                      aggregateImplementationType.getName(),
                      aggregateId,
                      persistedEventStream.size(),
                      persistedEventStream.eventOrderOfLastEvent());
            return Optional.of(newAggregateInstance().rehydrate(persistedEventStream));
        }

        @Override
        public AGGREGATE_TYPE load(ID aggregateId) {
            return tryLoad(aggregateId).orElseGet(() -> {
                log.debug("No events found for {} with id '{}' - returning an empty aggregate instance", aggregateImplementationType.getName(), aggregateId);
                return newAggregateInstance();
            });
        }

        @Override
        public void save(AGGREGATE_TYPE aggregate) {
            requireNonNull(aggregate, "You must supply an aggregate");
            var eventsToPersist = aggregate.uncommittedChanges();
            if (eventsToPersist.isEmpty()) {
                log.trace("No changes detected for '{}' with id '{}'", aggregateImplementationType.getName(), aggregate.tryGetAggregateId().orElse(null));
                return;
            }
            if (log.isTraceEnabled()) {
                log.trace("Persisting {} event(s) related to '{}' with id '{}': {}",
                          eventsToPersist.size(),
                          aggregateImplementationType.getName(),
                          aggregate.aggregateId(),
                          eventsToPersist.stream()
                                         .map(event -> event.getClass().getName())
                                         .reduce((s, s2) -> s + ", " + s2)
                                         .orElse(""));
            } else {
                log.debug("Persisting {} event(s) related to '{}' with id '{}'",
                          eventsToPersist.size(),
                          aggregateImplementationType.getName(),
                          aggregate.aggregateId());
            }
            eventStore.appendToStream(aggregate.aggregateId(), eventsToPersist);
            aggregate.markChangesAsCommitted();
        }

        @Override
        public Class<AGGREGATE_TYPE> aggregateImplementationType() {
            return aggregateImplementationType;
        }

        protected AGGREGATE_TYPE newAggregateInstance() {
            return aggregateInstanceFactory.create(aggregateImplementationType);
        }

        @Override
        public String toString() {
            return "AggregateRepository{" +
                    "aggregateImplementationType=" + aggregateImplementationType.getName() +
                    ", eventStore=" + eventStore +
                    '}';
        }
    }
}
