package dk.cloudcreate.eventsourcing.orders.commands;

import dk.cloudcreate.eventsourcing.orders.domain.*;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The intents an {@link OrderCommandHandler} can handle
 */
public sealed interface OrderCommand {
    /**
     * The id of the {@link Order} the command targets
     */
    OrderId orderId();

    /**
     * Place a new {@link Order}
     */
    record PlaceOrder(OrderId orderId, List<OrderLine> orderLines) implements OrderCommand {
        public PlaceOrder {
            requireNonNull(orderId, "You must provide an orderId");
            orderLines = List.copyOf(requireNonNull(orderLines, "You must provide orderLines"));
        }
    }

    /**
     * Activate an existing {@link Order}
     */
    record ActivateOrder(OrderId orderId) implements OrderCommand {
        public ActivateOrder {
            requireNonNull(orderId, "You must provide an orderId");
        }
    }
}
