package dk.cloudcreate.eventsourcing.orders.domain;

/**
 * Thrown when an {@link Order} that doesn't know its {@link OrderId} is asked to record an event,
 * e.g. an empty order returned by a repository load of an unknown id
 */
public class OrderIdMissingException extends OrderException {
    public OrderIdMissingException(OrderStatus status) {
        super(null, "Cannot place an Order without an OrderId (status " + status + ")");
    }
}
