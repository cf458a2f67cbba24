package com.librarylending.eventstore;

import com.librarylending.common.transaction.JdbiUnitOfWorkFactory;
import com.librarylending.eventstore.persistence.*;
import com.librarylending.eventstore.serializer.json.JacksonJSONSerializer;
import com.librarylending.eventstore.types.*;
import com.librarylending.eventstore.eventstream.EventStreamFilter;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.*;

import static com.librarylending.eventstore.test_data.TestEvents.*;
import static org.assertj.core.api.Assertions.*;

@Testcontainers
class PostgresqlEventStoreIT extends EventStoreContract {
    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("event-store")
            .withUsername("test-user")
            .withPassword("secret-password");

    private JdbiUnitOfWorkFactory unitOfWorkFactory;
    private PostgresqlEventStore  eventStore;

    @BeforeEach
    void setup() {
        unitOfWorkFactory = new JdbiUnitOfWorkFactory(Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                                                                  postgreSQLContainer.getUsername(),
                                                                  postgreSQLContainer.getPassword()));
        eventStore = new PostgresqlEventStore(unitOfWorkFactory,
                                              PostgresqlEventStoreConfiguration.defaultConfiguration(),
                                              new JacksonJSONSerializer(),
                                              Clock.systemUTC());
    }

    @Override
    protected EventStore eventStore() {
        return eventStore;
    }

    @Test
    void verify_events_table_is_created_on_start_up() {
        var table = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                             .select("SELECT to_regclass(?)", PostgresqlEventStoreConfiguration.DEFAULT_EVENTS_TABLE_NAME)
                                                                             .mapTo(String.class)
                                                                             .findOne());
        assertThat(table).hasValue(PostgresqlEventStoreConfiguration.DEFAULT_EVENTS_TABLE_NAME);
    }

    @Test
    void verify_append_joins_the_active_unit_of_work_and_is_rolled_back_with_it() {
        // Given
        var streamName = StreamName.of("product", "p1");

        // When
        var thrown = catchThrowable(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            eventStore.appendToStream(streamName, ExpectedRevision.noStream(), productsAdded("p1", 2));
            throw new IllegalStateException("Simulated failure after append");
        }));

        // Then
        assertThat(thrown).isInstanceOf(IllegalStateException.class);
        assertThat(eventStore.streamExists(streamName)).isFalse();
    }

    @Test
    void verify_resetEventStorage_removes_all_events() {
        eventStore.appendToStream(StreamName.of("product", "p1"), ExpectedRevision.noStream(), productsAdded("p1", 2));

        eventStore.resetEventStorage();

        assertThat(eventStore.readAll(GlobalPosition.FIRST, 10, EventStreamFilter.allStreams())).isEmpty();
    }

    @Test
    void verify_concurrent_appends_to_the_same_stream_only_let_one_writer_win() throws Exception {
        // Given
        var streamName = StreamName.of("product", "p1");
        eventStore.appendToStream(streamName, ExpectedRevision.noStream(), productsAdded("p1", 1));
        var executor  = Executors.newFixedThreadPool(4);
        var startGate = new CountDownLatch(1);

        // When
        List<Future<Boolean>> futures = new ArrayList<>();
        try {
            for (var i = 0; i < 4; i++) {
                futures.add(executor.submit(() -> {
                    startGate.await();
                    try {
                        eventStore.appendToStream(streamName, ExpectedRevision.exactly(0), productsAdded("p1", 1));
                        return true;
                    } catch (OptimisticAppendToStreamException e) {
                        return false;
                    }
                }));
            }
            startGate.countDown();
            var successes = 0;
            for (var future : futures) {
                if (future.get(30, TimeUnit.SECONDS)) {
                    successes++;
                }
            }

            // Then
            assertThat(successes).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
        assertThat(eventStore.readStream(streamName).orElseThrow().lastRevision()).isEqualTo(StreamRevision.of(1));
    }

    @Test
    void verify_global_positions_are_gap_free_across_concurrent_writers() throws Exception {
        // Given
        var executor = Executors.newFixedThreadPool(4);

        // When
        try {
            var futures = IntStream.range(0, 4)
                                   .mapToObj(writer -> executor.submit(() -> {
                                       var streamName = StreamName.of("product", "writer" + writer);
                                       eventStore.appendToStream(streamName, ExpectedRevision.noStream(), productsAdded("p" + writer, 1));
                                       for (var revision = 0; revision < 4; revision++) {
                                           eventStore.appendToStream(streamName, ExpectedRevision.exactly(revision), productsAdded("p" + writer, 1));
                                       }
                                       return null;
                                   }))
                                   .collect(Collectors.toList());
            for (var future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        var positions = eventStore.readAll(GlobalPosition.FIRST, 100, EventStreamFilter.allStreams())
                                  .stream()
                                  .map(event -> event.globalPosition().longValue())
                                  .collect(Collectors.toList());
        assertThat(positions).containsExactlyElementsOf(LongStream.rangeClosed(1, 20).boxed().collect(Collectors.toList()));
    }
}
