package dk.cloudcreate.eventsourcing.aggregates.test_data;

import dk.cloudcreate.eventsourcing.aggregates.*;
import dk.cloudcreate.eventsourcing.aggregates.test_data.ShipmentEvent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Example aggregate for testing {@link AggregateRoot} and {@link AggregateRepository}
 */
public class Shipment extends AggregateRoot<ShipmentId, ShipmentEvent, Shipment> {
    String  destination;
    boolean dispatched;
    int     numberOfTimesDispatched;

    /**
     * Used for rehydration
     */
    public Shipment() {
    }

    public Shipment(ShipmentId shipmentId, String destination) {
        // shipmentId may be null to allow testing the missing aggregate id check
        requireNonNull(destination, "You must provide a destination");
        apply(new ShipmentRegistered(shipmentId, destination));
    }

    public void dispatch() {
        if (dispatched) {
            return;
        }
        apply(new ShipmentDispatched(aggregateId()));
    }

    public void printLabel() {
        apply(new ShipmentLabelPrinted(aggregateId()));
    }

    /**
     * Allows testing that events belonging to other aggregates are rejected
     */
    public void applyForeignEvent(ShipmentEvent event) {
        apply(event);
    }

    @EventHandler
    private void on(ShipmentRegistered e) {
        destination = e.destination();
    }

    @EventHandler
    private void on(ShipmentDispatched e) {
        dispatched = true;
        numberOfTimesDispatched++;
    }
}
