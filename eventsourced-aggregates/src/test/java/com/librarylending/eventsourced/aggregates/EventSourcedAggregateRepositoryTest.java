package com.librarylending.eventsourced.aggregates;

import com.librarylending.common.types.CorrelationId;
import com.librarylending.eventsourced.aggregates.test_data.*;
import com.librarylending.eventstore.InMemoryEventStore;
import com.librarylending.eventstore.eventstream.EventMetaData;
import com.librarylending.eventstore.persistence.OptimisticAppendToStreamException;
import com.librarylending.eventstore.serializer.json.JacksonJSONSerializer;
import com.librarylending.eventstore.types.*;
import org.junit.jupiter.api.*;

import java.time.*;

import static org.assertj.core.api.Assertions.*;

class EventSourcedAggregateRepositoryTest {
    private InMemoryEventStore                                         eventStore;
    private EventSourcedAggregateRepository<OrderId, OrderEvent, Order> repository;

    @BeforeEach
    void setup() {
        eventStore = new InMemoryEventStore(new JacksonJSONSerializer(), Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC));
        repository = new EventSourcedAggregateRepository<>(eventStore,
                                                           OrderEvent.registry(),
                                                           Order.class,
                                                           orderId -> StreamName.of("order", orderId),
                                                           Order::new);
    }

    @Test
    void verify_persisting_a_new_aggregate_creates_its_stream() {
        // Given
        var orderId = OrderId.random();
        var order   = Order.create(orderId, "customer-1", 1);
        order.addProduct("product-1", 2);

        // When
        var result = repository.persist(order, EventMetaData.empty());

        // Then
        assertThat((Object) result.streamName).isEqualTo(StreamName.of("order", orderId));
        assertThat(result.nextExpectedRevision).isEqualTo(StreamRevision.of(1));
        assertThat(order.uncommittedChanges()).isEmpty();
        assertThat(repository.exists(orderId)).isTrue();
    }

    @Test
    void verify_loaded_aggregate_reflects_the_persisted_events() {
        // Given
        var orderId = OrderId.random();
        var order   = Order.create(orderId, "customer-1", 1);
        order.addProduct("product-1", 2);
        order.addProduct("product-2", 1);
        repository.persist(order, EventMetaData.empty());

        // When
        var loaded = repository.load(orderId);

        // Then
        assertThat(loaded.hasBeenRehydrated()).isTrue();
        assertThat(loaded.customerId()).isEqualTo("customer-1");
        assertThat(loaded.productQuantities()).containsEntry("product-1", 2).containsEntry("product-2", 1);
        assertThat(loaded.eventOrderOfLastRehydratedEvent()).isEqualTo(2);
    }

    @Test
    void verify_missing_aggregate() {
        var orderId = OrderId.random();

        assertThat(repository.tryLoad(orderId)).isEmpty();
        assertThat(repository.exists(orderId)).isFalse();
        assertThatThrownBy(() -> repository.load(orderId))
                .isInstanceOf(AggregateNotFoundException.class)
                .hasMessageContaining(orderId.value());
    }

    @Test
    void verify_creating_an_aggregate_twice_is_a_concurrency_conflict() {
        // Given
        var orderId = OrderId.random();
        repository.persist(Order.create(orderId, "customer-1", 1), EventMetaData.empty());

        // When / Then
        assertThatThrownBy(() -> repository.persist(Order.create(orderId, "customer-2", 2), EventMetaData.empty()))
                .isInstanceOf(OptimisticAppendToStreamException.class);
    }

    @Test
    void verify_persisting_a_stale_aggregate_is_a_concurrency_conflict() {
        // Given
        var orderId = OrderId.random();
        repository.persist(Order.create(orderId, "customer-1", 1), EventMetaData.empty());
        var firstWriter  = repository.load(orderId);
        var secondWriter = repository.load(orderId);
        firstWriter.addProduct("product-1", 1);
        secondWriter.addProduct("product-2", 1);

        // When
        repository.persist(firstWriter, EventMetaData.empty());

        // Then
        assertThatThrownBy(() -> repository.persist(secondWriter, EventMetaData.empty()))
                .isInstanceOf(OptimisticAppendToStreamException.class)
                .hasMessageStartingWith("Concurrency conflict: stream was modified");
        assertThat(repository.load(orderId).productQuantities()).containsOnlyKeys("product-1");
    }

    @Test
    void verify_an_aggregate_can_be_persisted_several_times() {
        // Given
        var orderId = OrderId.random();
        var order   = Order.create(orderId, "customer-1", 1);
        repository.persist(order, EventMetaData.empty());

        // When
        order.addProduct("product-1", 1);
        repository.persist(order, EventMetaData.empty());
        order.acceptOrder();
        var result = repository.persist(order, EventMetaData.empty());

        // Then
        assertThat(result.nextExpectedRevision).isEqualTo(StreamRevision.of(2));
        assertThat(repository.load(orderId).isAccepted()).isTrue();
    }

    @Test
    void verify_metadata_is_stored_with_every_event() {
        // Given
        var orderId       = OrderId.random();
        var correlationId = CorrelationId.random();
        var order         = Order.create(orderId, "customer-1", 1);
        order.addProduct("product-1", 1);

        // When
        repository.persist(order, EventMetaData.correlatedBy(correlationId));

        // Then
        assertThat(eventStore.readStream(repository.streamNameFor(orderId)).orElseThrow().eventList())
                .allSatisfy(recordedEvent -> assertThat(recordedEvent.metaData().correlationId()).contains(correlationId));
    }

    @Test
    void verify_an_aggregate_without_changes_cannot_be_persisted() {
        var orderId = OrderId.random();
        repository.persist(Order.create(orderId, "customer-1", 1), EventMetaData.empty());

        assertThatThrownBy(() -> repository.persist(repository.load(orderId), EventMetaData.empty()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
