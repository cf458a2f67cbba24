package com.librarylending.eventsourced.aggregates;

import com.librarylending.eventsourced.aggregates.test_data.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AggregateRootTest {
    private final OrderId orderId = OrderId.of("order-1");

    @Test
    void verify_a_new_aggregate_tracks_its_uncommitted_changes() {
        // When
        var order = Order.create(orderId, "customer-1", 100);
        var decision = order.addProduct("product-1", 2);

        // Then
        assertThat(decision.isAccepted()).isTrue();
        assertThat(order.uncommittedChanges()).hasSize(2);
        assertThat(order.uncommittedChanges().get(1)).isEqualTo(decision.event());
        assertThat(order.eventOrderOfLastAppliedEvent()).isEqualTo(1);
        assertThat(order.eventOrderOfLastRehydratedEvent()).isEqualTo(AggregateRoot.NO_EVENTS_HAVE_BEEN_APPLIED);
        assertThat(order.hasBeenRehydrated()).isFalse();
        assertThat(order.productQuantities()).containsEntry("product-1", 2);
    }

    @Test
    void verify_a_rejected_decision_applies_no_event() {
        // Given
        var order = Order.create(orderId, "customer-1", 100);
        order.acceptOrder();

        // When
        var decision = order.addProduct("product-1", 2);

        // Then
        assertThat(decision.isRejected()).isTrue();
        assertThat(decision.rejectionKind()).contains(Decision.RejectionKind.INVALID_STATE);
        assertThat(decision.rejectionReason()).contains("Order is already accepted");
        assertThat(order.uncommittedChanges()).hasSize(2);
        assertThat(order.productQuantities()).isEmpty();
    }

    @Test
    void verify_replaying_the_same_events_twice_yields_the_same_state() {
        // Given
        List<OrderEvent> history = List.of(new OrderEvent.OrderAdded(orderId, "customer-1", 100),
                                           new OrderEvent.ProductAddedToOrder(orderId, "product-1", 2),
                                           new OrderEvent.ProductAddedToOrder(orderId, "product-1", 3),
                                           new OrderEvent.OrderAccepted(orderId));

        // When
        var first  = new Order(orderId).rehydrate(history.stream());
        var second = new Order(orderId).rehydrate(history.stream());

        // Then
        assertThat(first.customerId()).isEqualTo(second.customerId()).isEqualTo("customer-1");
        assertThat(first.productQuantities()).isEqualTo(second.productQuantities()).containsEntry("product-1", 5);
        assertThat(first.isAccepted()).isEqualTo(second.isAccepted()).isTrue();
        assertThat(first.eventOrderOfLastRehydratedEvent()).isEqualTo(second.eventOrderOfLastRehydratedEvent()).isEqualTo(3);
        assertThat(first.hasBeenRehydrated()).isTrue();
        assertThat(first.uncommittedChanges()).isEmpty();
    }

    @Test
    void verify_unknown_events_are_ignored_but_still_count_towards_the_event_order() {
        // Given
        List<OrderEvent> history = List.of(new OrderEvent.OrderAdded(orderId, "customer-1", 100),
                                           new OrderEvent.UnknownOrderEvent(orderId, "OrderShippedV9"));

        // When
        var order = new Order(orderId).rehydrate(history.stream());

        // Then
        assertThat(order.ignoredEvents()).isEqualTo(1);
        assertThat(order.eventOrderOfLastRehydratedEvent()).isEqualTo(1);
    }

    @Test
    void verify_markChangesAsCommitted_moves_the_applied_events_into_the_persisted_history() {
        // Given
        var order = Order.create(orderId, "customer-1", 100);
        order.addProduct("product-1", 1);

        // When
        order.markChangesAsCommitted();

        // Then
        assertThat(order.uncommittedChanges()).isEmpty();
        assertThat(order.hasUncommittedChanges()).isFalse();
        assertThat(order.eventOrderOfLastRehydratedEvent()).isEqualTo(1);
    }
}
