package dk.cloudcreate.eventsourcing.orders.domain;

public enum OrderStatus {
    /**
     * No event has been applied to the {@link Order}
     */
    NEW,
    PLACED,
    ACTIVATED
}
