package dk.cloudcreate.eventsourcing.orders.domain;

import dk.cloudcreate.eventsourcing.aggregates.*;
import dk.cloudcreate.eventsourcing.eventstore.inmemory.InMemoryEventStore;
import dk.cloudcreate.eventsourcing.eventstore.types.EventOrder;
import dk.cloudcreate.eventsourcing.orders.domain.OrderEvent.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OrderTest {
    private static final List<OrderLine> ORDER_LINES = List.of(OrderLine.of(ProductId.of("coffee"), 2),
                                                               OrderLine.of(ProductId.of("milk"), 1));

    @Test
    void a_new_order_has_the_initial_status_and_no_changes() {
        var order = new Order(OrderId.of("ABC123"));

        assertThat(order.status()).isEqualTo(OrderStatus.NEW);
        assertThat(order.orderLines()).isEmpty();
        assertThat(order.uncommittedChanges()).isEmpty();
        assertThat((CharSequence) order.aggregateId()).isEqualTo(OrderId.of("ABC123"));
    }

    @Test
    void placing_an_order_applies_an_OrderPlaced_event() {
        // Given
        var orderId = OrderId.of("ABC123");
        var order   = new Order(orderId);

        // When
        order.place(ORDER_LINES);

        // Then
        assertThat(order.status()).isEqualTo(OrderStatus.PLACED);
        assertThat(order.orderLines()).isEqualTo(ORDER_LINES);
        assertThat(order.uncommittedChanges()).containsExactly(new OrderPlaced(orderId, ORDER_LINES));
        assertThat(order.eventOrderOfLastAppliedEvent()).isEqualTo(EventOrder.FIRST_EVENT_ORDER);
    }

    @Test
    void placing_an_order_twice_fails_with_OrderAlreadyPlacedException_and_applies_no_event() {
        // Given
        var order = new Order(OrderId.random());
        order.place(ORDER_LINES);

        // When
        assertThatThrownBy(() -> order.place(ORDER_LINES))
                .isExactlyInstanceOf(OrderAlreadyPlacedException.class)
                .hasMessageContaining(order.aggregateId().toString());

        // Then
        assertThat(order.uncommittedChanges()).hasSize(1);
        assertThat(order.status()).isEqualTo(OrderStatus.PLACED);
    }

    @Test
    void placing_a_rehydrated_order_fails_with_OrderAlreadyPlacedException() {
        var orderId = OrderId.random();
        var order   = new Order().rehydrate(List.<OrderEvent>of(new OrderPlaced(orderId, ORDER_LINES)).stream());

        assertThatThrownBy(() -> order.place(ORDER_LINES))
                .isExactlyInstanceOf(OrderAlreadyPlacedException.class);
        assertThat(order.uncommittedChanges()).isEmpty();
    }

    @Test
    void placing_an_order_without_order_lines_fails_with_EmptyOrderLinesException_and_applies_no_event() {
        // Given
        var orderId = OrderId.of("X");
        var order   = new Order(orderId);

        // When
        var exception = catchThrowableOfType(() -> order.place(List.of()), EmptyOrderLinesException.class);

        // Then
        assertThat((CharSequence) exception.orderId).isEqualTo(orderId);
        assertThat(order.uncommittedChanges()).isEmpty();
        assertThat(order.status()).isEqualTo(OrderStatus.NEW);
    }

    @Test
    void activating_a_placed_order_applies_an_OrderActivated_event() {
        // Given
        var orderId = OrderId.random();
        var order   = new Order(orderId);
        order.place(ORDER_LINES);

        // When
        order.activate();

        // Then
        assertThat(order.status()).isEqualTo(OrderStatus.ACTIVATED);
        assertThat(order.uncommittedChanges()).containsExactly(new OrderPlaced(orderId, ORDER_LINES),
                                                               new OrderActivated(orderId));
    }

    @Test
    void activating_an_already_activated_order_has_no_effect() {
        // Given
        var order = new Order(OrderId.random());
        order.place(ORDER_LINES);
        order.activate();
        order.markChangesAsCommitted();

        // When
        order.activate();

        // Then
        assertThat(order.uncommittedChanges()).isEmpty();
        assertThat(order.status()).isEqualTo(OrderStatus.ACTIVATED);
    }

    @Test
    void activating_an_order_that_was_never_placed_has_no_effect() {
        var seededOrder = new Order(OrderId.random());
        var emptyOrder  = new Order();

        seededOrder.activate();
        emptyOrder.activate();

        assertThat(seededOrder.status()).isEqualTo(OrderStatus.NEW);
        assertThat(seededOrder.uncommittedChanges()).isEmpty();
        assertThat(emptyOrder.status()).isEqualTo(OrderStatus.NEW);
        assertThat(emptyOrder.uncommittedChanges()).isEmpty();
        assertThat(emptyOrder.tryGetAggregateId()).isEmpty();
    }

    @Test
    void the_order_lines_of_a_placed_order_cannot_be_modified() {
        var order = new Order(OrderId.random());
        order.place(ORDER_LINES);

        assertThatThrownBy(() -> order.orderLines().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void replaying_the_same_history_twice_yields_identical_state() {
        // Given
        var orderId = OrderId.random();
        var history = List.<OrderEvent>of(new OrderPlaced(orderId, ORDER_LINES),
                                          new OrderActivated(orderId));

        // When
        var first  = new Order().rehydrate(history.stream());
        var second = new Order().rehydrate(history.stream());

        // Then
        assertThat((CharSequence) first.aggregateId()).isEqualTo(orderId).isEqualTo(second.aggregateId());
        assertThat(first.status()).isEqualTo(OrderStatus.ACTIVATED).isEqualTo(second.status());
        assertThat(first.orderLines()).isEqualTo(second.orderLines());
        assertThat(first.uncommittedChanges()).isEmpty();
        assertThat(second.uncommittedChanges()).isEmpty();
    }

    @Test
    void replaying_the_uncommitted_changes_reproduces_the_in_memory_state() {
        // Given
        var order = new Order(OrderId.random());
        order.place(ORDER_LINES);
        order.activate();

        // When
        var replayedOrder = new Order().rehydrate(order.uncommittedChanges().stream());

        // Then
        assertThat((CharSequence) replayedOrder.aggregateId()).isEqualTo(order.aggregateId());
        assertThat(replayedOrder.status()).isEqualTo(order.status());
        assertThat(replayedOrder.orderLines()).isEqualTo(order.orderLines());
        assertThat(replayedOrder.eventOrderOfLastAppliedEvent()).isEqualTo(order.eventOrderOfLastAppliedEvent());
    }

    @Test
    void placing_an_order_returned_by_a_load_of_an_unknown_id_fails_with_an_OrderException_and_applies_no_event() {
        // Given
        var repository = AggregateRepository.from(new InMemoryEventStore<OrderId, OrderEvent>(),
                                                  AggregateInstanceFactory.defaultConstructorFactory(),
                                                  Order.class);
        var order = repository.load(OrderId.of("NEVER-PLACED"));

        // When
        var exception = catchThrowableOfType(() -> order.place(ORDER_LINES), OrderException.class);

        // Then
        assertThat(exception).isExactlyInstanceOf(OrderIdMissingException.class);
        assertThat(exception.orderId).isNull();
        assertThat(order.uncommittedChanges()).isEmpty();
        assertThat(order.status()).isEqualTo(OrderStatus.NEW);
        assertThat(order.tryGetAggregateId()).isEmpty();
    }

    @Test
    void placing_an_order_without_an_id_fails_with_OrderIdMissingException_even_without_order_lines() {
        var order = new Order();

        assertThatThrownBy(() -> order.place(List.of()))
                .isExactlyInstanceOf(OrderIdMissingException.class);
        assertThat(order.uncommittedChanges()).isEmpty();
    }
}
