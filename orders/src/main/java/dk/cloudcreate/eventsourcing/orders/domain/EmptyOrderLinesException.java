package dk.cloudcreate.eventsourcing.orders.domain;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class EmptyOrderLinesException extends OrderException {
    public EmptyOrderLinesException(OrderId orderId) {
        super(orderId, msg("Order '{}' cannot be placed without any order lines", orderId));
    }
}
