package dk.cloudcreate.eventsourcing.orders.domain;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A single line of an {@link Order}
 *
 * @param productId the product ordered
 * @param quantity  the quantity ordered
 */
public record OrderLine(ProductId productId, int quantity) {
    public OrderLine {
        requireNonNull(productId, "You must provide a productId");
    }

    public static OrderLine of(ProductId productId, int quantity) {
        return new OrderLine(productId, quantity);
    }
}
