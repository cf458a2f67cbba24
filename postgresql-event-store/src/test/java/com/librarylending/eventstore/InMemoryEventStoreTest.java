package com.librarylending.eventstore;

import com.librarylending.eventstore.persistence.OptimisticAppendToStreamException;
import com.librarylending.eventstore.serializer.json.JacksonJSONSerializer;
import com.librarylending.eventstore.types.*;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static com.librarylending.eventstore.test_data.TestEvents.productsAdded;
import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEventStoreTest extends EventStoreContract {
    private InMemoryEventStore eventStore;

    @BeforeEach
    void setup() {
        eventStore = new InMemoryEventStore(new JacksonJSONSerializer(), Clock.systemUTC());
    }

    @Override
    protected EventStore eventStore() {
        return eventStore;
    }

    @Test
    void verify_recorded_timestamp_comes_from_the_clock() {
        var fixedClock = Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC);
        var store      = new InMemoryEventStore(new JacksonJSONSerializer(), fixedClock);

        store.appendToStream(StreamName.of("product", "p1"), ExpectedRevision.noStream(), productsAdded("p1", 1));

        assertThat(store.readStream(StreamName.of("product", "p1")).orElseThrow().eventList().get(0).timestamp())
                .isEqualTo(OffsetDateTime.parse("2024-03-01T10:15:30Z"));
    }

    @Test
    void verify_only_one_of_several_concurrent_appends_with_the_same_expected_revision_wins() throws Exception {
        // Given
        var streamName = StreamName.of("product", "p1");
        eventStore.appendToStream(streamName, ExpectedRevision.noStream(), productsAdded("p1", 1));
        var executor  = Executors.newFixedThreadPool(8);
        var startGate = new CountDownLatch(1);
        var succeeded = new AtomicInteger();

        // When
        try {
            var futures = new ArrayList<Future<?>>();
            for (var i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> {
                    startGate.await();
                    try {
                        eventStore.appendToStream(streamName, ExpectedRevision.exactly(0), productsAdded("p1", 1));
                        succeeded.incrementAndGet();
                    } catch (OptimisticAppendToStreamException e) {
                        // expected for all but one writer
                    }
                    return null;
                }));
            }
            startGate.countDown();
            for (var future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(succeeded.get()).isEqualTo(1);
        assertThat(eventStore.readStream(streamName).orElseThrow().lastRevision()).isEqualTo(StreamRevision.of(1));
    }
}
