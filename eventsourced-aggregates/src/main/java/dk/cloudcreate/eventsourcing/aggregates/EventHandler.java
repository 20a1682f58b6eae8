package dk.cloudcreate.eventsourcing.aggregates;

import java.lang.annotation.*;

/**
 * Methods annotated with this Annotation will automatically be called when an event is being applied or rehydrated on to an {@link AggregateRoot} instance.<br>
 * The method must accept a single argument, which is the concrete event type it handles
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface EventHandler {
}
