package dk.cloudcreate.eventsourcing.orders.domain;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class OrderAlreadyPlacedException extends OrderException {
    public OrderAlreadyPlacedException(OrderId orderId, OrderStatus currentStatus) {
        super(orderId, msg("Order '{}' has already been placed (current status {})", orderId, currentStatus));
    }
}
