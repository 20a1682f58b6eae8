package dk.cloudcreate.eventsourcing.orders.domain;

import dk.cloudcreate.eventsourcing.aggregates.AggregateException;

/**
 * Base class for the business rule violations an {@link Order} can report.<br>
 * An {@link Order} never applies an event when it throws an {@link OrderException}.
 */
public abstract class OrderException extends AggregateException {
    /**
     * The id of the order that rejected the operation. May be null if the order didn't know its id
     */
    public final OrderId orderId;

    protected OrderException(OrderId orderId, String message) {
        super(message);
        this.orderId = orderId;
    }
}
