package dk.cloudcreate.eventsourcing.orders.domain;

import dk.cloudcreate.eventsourcing.eventstore.AggregateEvent;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * All events that can be applied to an {@link Order}
 */
public sealed interface OrderEvent extends AggregateEvent<OrderId> {
    OrderId orderId();

    @Override
    default OrderId aggregateId() {
        return orderId();
    }

    record OrderPlaced(OrderId orderId, List<OrderLine> orderLines) implements OrderEvent {
        public OrderPlaced {
            orderLines = List.copyOf(requireNonNull(orderLines, "You must provide orderLines"));
        }
    }

    record OrderActivated(OrderId orderId) implements OrderEvent {
    }
}
