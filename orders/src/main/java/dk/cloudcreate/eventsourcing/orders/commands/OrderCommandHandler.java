package dk.cloudcreate.eventsourcing.orders.commands;

import dk.cloudcreate.eventsourcing.aggregates.AggregateRepository;
import dk.cloudcreate.eventsourcing.orders.commands.OrderCommand.*;
import dk.cloudcreate.eventsourcing.orders.domain.*;
import org.slf4j.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Translates {@link OrderCommand}'s into operations on the {@link Order} aggregate and persists the outcome using the {@link AggregateRepository}.<br>
 * The handler performs no validation of its own; any business rule violation reported by the {@link Order} is logged and returned as a
 * {@link CommandResult.Rejected} instead of being thrown to the caller.
 */
public final class OrderCommandHandler {
    private static final Logger log = LoggerFactory.getLogger(OrderCommandHandler.class);

    private final AggregateRepository<OrderId, OrderEvent, Order> repository;

    public OrderCommandHandler(AggregateRepository<OrderId, OrderEvent, Order> repository) {
        this.repository = requireNonNull(repository, "No repository provided");
    }

    /**
     * Handle the command
     *
     * @param command the command to handle
     * @return the outcome of handling the command
     */
    public CommandResult handle(OrderCommand command) {
        requireNonNull(command, "No command provided");
        log.debug("Handling {} for order '{}'", command.getClass().getSimpleName(), command.orderId());
        if (command instanceof PlaceOrder placeOrder) {
            return handlePlaceOrder(placeOrder);
        } else if (command instanceof ActivateOrder activateOrder) {
            return handleActivateOrder(activateOrder);
        }
        throw new IllegalArgumentException(msg("Unsupported command '{}'", command.getClass().getName()));
    }

    private CommandResult handlePlaceOrder(PlaceOrder command) {
        Order          order     = new Order(command.orderId());
        OrderException rejection = null;
        try {
            order.place(command.orderLines());
        } catch (OrderException e) {
            rejection = e;
        }
        var eventsPersisted = save(order);
        if (rejection != null) {
            log.warn("Rejected {}: {}", command, rejection.getMessage());
            return CommandResult.rejected(command, rejection);
        }
        return CommandResult.accepted(command, eventsPersisted);
    }

    private CommandResult handleActivateOrder(ActivateOrder command) {
        var order = repository.load(command.orderId());
        order.activate();
        var eventsPersisted = save(order);
        if (eventsPersisted == 0) {
            log.debug("Order '{}' wasn't activated since its status is {}", command.orderId(), order.status());
        }
        return CommandResult.accepted(command, eventsPersisted);
    }

    private int save(Order order) {
        var eventsToPersist = order.uncommittedChanges().size();
        repository.save(order);
        return eventsToPersist;
    }
}
