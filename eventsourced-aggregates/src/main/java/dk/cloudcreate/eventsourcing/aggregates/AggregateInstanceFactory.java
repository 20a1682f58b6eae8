package dk.cloudcreate.eventsourcing.aggregates;

import dk.cloudcreate.essentials.shared.reflection.Reflector;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Factory that helps the {@link AggregateRepository} to create an empty instance of a given {@link Aggregate}, which can then be rehydrated.
 *
 * @see #defaultConstructorFactory()
 * @see DefaultConstructorAggregateInstanceFactory
 */
public interface AggregateInstanceFactory {
    /**
     * An {@link AggregateInstanceFactory} that calls the default no-arguments constructor on the concrete {@link Aggregate} type to
     * create a new instance of the {@link Aggregate}
     */
    DefaultConstructorAggregateInstanceFactory DEFAULT_CONSTRUCTOR_AGGREGATE_FACTORY = new DefaultConstructorAggregateInstanceFactory();

    <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType);

    /**
     * Returns an {@link AggregateInstanceFactory} that calls the default no-arguments constructor on the concrete {@link Aggregate} type to
     * create a new instance of the {@link Aggregate}
     *
     * @return #DEFAULT_CONSTRUCTOR_AGGREGATE_FACTORY
     */
    static DefaultConstructorAggregateInstanceFactory defaultConstructorFactory() {
        return DEFAULT_CONSTRUCTOR_AGGREGATE_FACTORY;
    }

    /**
     * {@link AggregateInstanceFactory} that calls the default no-arguments constructor on the concrete {@link Aggregate} type to
     * create a new instance of the {@link Aggregate}
     */
    class DefaultConstructorAggregateInstanceFactory implements AggregateInstanceFactory {
        @Override
        public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType) {
            requireNonNull(aggregateType, "You must provide an aggregateType");
            return Reflector.reflectOn(aggregateType).newInstance();
        }
    }
}
