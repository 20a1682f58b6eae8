package dk.cloudcreate.eventsourcing.orders.commands;

import dk.cloudcreate.eventsourcing.orders.domain.OrderException;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The outcome of {@link OrderCommandHandler#handle(OrderCommand)}
 */
public sealed interface CommandResult {
    OrderCommand command();

    boolean isAccepted();

    /**
     * The reason the command was rejected or {@link Optional#empty()} if it was accepted
     */
    Optional<OrderException> rejectionReason();

    static CommandResult accepted(OrderCommand command, int eventsPersisted) {
        return new Accepted(command, eventsPersisted);
    }

    static CommandResult rejected(OrderCommand command, OrderException reason) {
        return new Rejected(command, reason);
    }

    /**
     * The command was carried out. Handling a command may legitimately result in no events,
     * e.g. when activating an order that isn't placed
     *
     * @param command         the command handled
     * @param eventsPersisted the number of events the command caused to be persisted
     */
    record Accepted(OrderCommand command, int eventsPersisted) implements CommandResult {
        public Accepted {
            requireNonNull(command, "No command provided");
        }

        @Override
        public boolean isAccepted() {
            return true;
        }

        @Override
        public Optional<OrderException> rejectionReason() {
            return Optional.empty();
        }
    }

    /**
     * The order rejected the command and no events were persisted
     *
     * @param command the command handled
     * @param reason  the business rule violation reported by the order
     */
    record Rejected(OrderCommand command, OrderException reason) implements CommandResult {
        public Rejected {
            requireNonNull(command, "No command provided");
            requireNonNull(reason, "No reason provided");
        }

        @Override
        public boolean isAccepted() {
            return false;
        }

        @Override
        public Optional<OrderException> rejectionReason() {
            return Optional.of(reason);
        }
    }
}
