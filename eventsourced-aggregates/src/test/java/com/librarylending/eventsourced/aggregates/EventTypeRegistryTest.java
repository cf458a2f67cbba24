package com.librarylending.eventsourced.aggregates;

import com.librarylending.common.types.EventId;
import com.librarylending.eventsourced.aggregates.test_data.*;
import com.librarylending.eventstore.eventstream.*;
import com.librarylending.eventstore.serializer.json.*;
import com.librarylending.eventstore.types.*;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.*;

class EventTypeRegistryTest {
    private final JSONSerializer                jsonSerializer = new JacksonJSONSerializer();
    private final EventTypeRegistry<OrderEvent> registry       = OrderEvent.registry();
    private final OrderId                       orderId        = OrderId.of("o1");

    @Test
    void verify_registered_event_is_wrapped_with_its_type_and_revision() {
        var metaData = EventMetaData.empty();
        metaData.put("key", "value");

        var persistable = registry.toPersistableEvent(new OrderEvent.OrderAccepted(orderId), metaData);

        assertThat((Object) persistable.eventType).isEqualTo(OrderEvent.ORDER_ACCEPTED);
        assertThat(persistable.eventRevision).isEqualTo(EventRevision.FIRST);
        assertThat(persistable.metaData).containsEntry("key", "value").isNotSameAs(metaData);
    }

    @Test
    void verify_the_unknown_variant_cannot_be_persisted() {
        assertThatThrownBy(() -> registry.toPersistableEvent(new OrderEvent.UnknownOrderEvent(orderId, "Something"), EventMetaData.empty()))
                .isInstanceOf(AggregateException.class)
                .hasMessageContaining("UnknownOrderEvent");
    }

    @Test
    void verify_registering_the_same_type_twice_fails() {
        assertThatThrownBy(() -> registry.register(OrderEvent.ORDER_ADDED, EventRevision.FIRST, OrderEvent.OrderAccepted.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_recorded_event_is_deserialized_into_the_registered_class() {
        var recorded = recorded(OrderEvent.PRODUCT_ADDED_TO_ORDER, EventRevision.FIRST, "{\"orderId\":\"o1\",\"productId\":\"p1\",\"quantity\":3}");

        var event = registry.fromRecordedEvent(recorded);

        assertThat(event).isEqualTo(new OrderEvent.ProductAddedToOrder(orderId, "p1", 3));
    }

    @Test
    void verify_unregistered_event_type_becomes_the_unknown_variant() {
        var recorded = recorded(EventType.of("OrderShipped"), EventRevision.FIRST, "{\"orderId\":\"o1\"}");

        var event = registry.fromRecordedEvent(recorded);

        assertThat(event).isInstanceOf(OrderEvent.UnknownOrderEvent.class);
        assertThat(((OrderEvent.UnknownOrderEvent) event).eventType).isEqualTo("OrderShipped");
        assertThat((Object) event.orderId).isEqualTo(orderId);
    }

    @Test
    void verify_newer_schema_revision_becomes_the_unknown_variant() {
        var recorded = recorded(OrderEvent.ORDER_ACCEPTED, EventRevision.of(2), "{\"orderId\":\"o1\",\"acceptedBy\":\"someone\"}");

        var event = registry.fromRecordedEvent(recorded);

        assertThat(event).isInstanceOf(OrderEvent.UnknownOrderEvent.class);
    }

    private RecordedEvent recorded(EventType eventType, EventRevision eventRevision, String json) {
        return new RecordedEvent(EventId.random(),
                                 StreamName.of("order", orderId),
                                 StreamRevision.FIRST,
                                 GlobalPosition.FIRST,
                                 new EventJSON(jsonSerializer, eventType, eventRevision, json),
                                 EventMetaData.empty(),
                                 OffsetDateTime.now());
    }
}
