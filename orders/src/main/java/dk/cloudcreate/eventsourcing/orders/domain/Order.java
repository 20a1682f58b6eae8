package dk.cloudcreate.eventsourcing.orders.domain;

import dk.cloudcreate.eventsourcing.aggregates.*;
import dk.cloudcreate.eventsourcing.orders.domain.OrderEvent.*;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The Order aggregate.<br>
 * An order is created empty, placed with at least one {@link OrderLine} and can then be activated:
 * <pre>
 * NEW --place--> PLACED --activate--> ACTIVATED
 * </pre>
 * {@link #status()} and {@link #orderLines()} are only ever changed by the {@link EventHandler} methods.
 */
public class Order extends AggregateRoot<OrderId, OrderEvent, Order> {
    private OrderStatus     status     = OrderStatus.NEW;
    private List<OrderLine> orderLines = List.of();

    /**
     * Used for rehydration
     */
    public Order() {
    }

    /**
     * Create a new order that hasn't been placed yet
     *
     * @param orderId the id of the new order
     */
    public Order(OrderId orderId) {
        super(orderId);
    }

    /**
     * Place the order
     *
     * @param orderLines the lines of the order
     * @throws OrderIdMissingException    if the order doesn't know its {@link OrderId}
     * @throws OrderAlreadyPlacedException if an event has already been applied to the order
     * @throws EmptyOrderLinesException    if <code>orderLines</code> is empty
     */
    public void place(List<OrderLine> orderLines) {
        requireNonNull(orderLines, "You must provide orderLines");
        var orderId = tryGetAggregateId().orElseThrow(() -> new OrderIdMissingException(status));
        if (status != OrderStatus.NEW) {
            throw new OrderAlreadyPlacedException(orderId, status);
        }
        if (orderLines.isEmpty()) {
            throw new EmptyOrderLinesException(orderId);
        }
        apply(new OrderPlaced(orderId, orderLines));
    }

    /**
     * Activate a placed order.<br>
     * Activating an order that isn't {@link OrderStatus#PLACED} (e.g. an order that was never placed or is already activated) has no effect
     */
    public void activate() {
        if (status != OrderStatus.PLACED) {
            return;
        }
        apply(new OrderActivated(aggregateId()));
    }

    public OrderStatus status() {
        return status;
    }

    public List<OrderLine> orderLines() {
        return orderLines;
    }

    @EventHandler
    private void on(OrderPlaced e) {
        status = OrderStatus.PLACED;
        orderLines = e.orderLines();
    }

    @EventHandler
    private void on(OrderActivated e) {
        status = OrderStatus.ACTIVATED;
    }

    @Override
    public String toString() {
        return "Order{" +
                "orderId=" + tryGetAggregateId().orElse(null) +
                ", status=" + status +
                ", orderLines=" + orderLines.size() +
                '}';
    }
}
