package com.librarylending.lending.application;

import com.librarylending.common.transaction.JdbiUnitOfWorkFactory;
import com.librarylending.eventstore.*;
import com.librarylending.eventstore.persistence.PostgresqlEventStoreConfiguration;
import com.librarylending.eventstore.serializer.json.JacksonJSONSerializer;
import com.librarylending.eventstore.subscription.PostgresqlSubscriptionResumePointStore;
import com.librarylending.lending.application.LibraryResult.FailureKind;
import com.librarylending.lending.domain.*;
import com.librarylending.lending.domain.book.Book;
import com.librarylending.lending.projections.*;
import com.librarylending.lending.test_data.TestClock;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.*;

import static org.assertj.core.api.Assertions.*;

@Testcontainers
class LibraryServicePostgresqlIT {
    private static final Instant         NOW    = Instant.parse("2024-05-01T08:00:00Z");
    private static final LibraryBranchId BRANCH = LibraryBranchId.of("downtown");

    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("library-lending")
            .withUsername("test-user")
            .withPassword("secret-password");

    private TestClock             clock;
    private JdbiUnitOfWorkFactory unitOfWorkFactory;
    private PostgresqlEventStore  eventStore;
    private LibraryConfiguration  configuration;
    private LibraryService        libraryService;

    @BeforeEach
    void setup() {
        clock = new TestClock(NOW);
        unitOfWorkFactory = new JdbiUnitOfWorkFactory(Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                                                                  postgreSQLContainer.getUsername(),
                                                                  postgreSQLContainer.getPassword()));
        eventStore = new PostgresqlEventStore(unitOfWorkFactory,
                                              PostgresqlEventStoreConfiguration.defaultConfiguration(),
                                              new JacksonJSONSerializer(),
                                              clock);
        configuration = LibraryConfiguration.defaultConfiguration().withPollingInterval(Duration.ofMillis(50));
        libraryService = new LibraryService(eventStore, configuration, clock);
    }

    @Test
    void verify_complete_lending_scenario() {
        // Given
        var recorder  = new PatronLendingRecorder(eventStore, new PostgresqlSubscriptionResumePointStore(unitOfWorkFactory), configuration, clock);
        var catalog   = new CatalogProjection(eventStore, configuration, clock);
        var sheet     = new DailySheetProjection(eventStore, configuration, clock);
        var sweeper   = new DailySheetSweeper(libraryService, sheet, configuration, clock);
        var alice     = libraryService.createPatron(PatronId.random(), PatronType.REGULAR, "Alice", "alice@example.com").value();
        var bob       = libraryService.createPatron(PatronId.random(), PatronType.RESEARCHER, "Bob", "bob@example.com").value();
        var effective = libraryService.addBook(BookId.random(), "978-0134685991", "Effective Java", BookType.CIRCULATING, BRANCH).value();
        var patterns  = libraryService.addBook(BookId.random(), "978-0201633610", "Design Patterns", BookType.RESTRICTED, BRANCH).value();

        // When
        assertThat(libraryService.placeHold(effective, alice).isSuccess()).isTrue();
        assertThat(libraryService.placeHold(patterns, alice).error()).hasValue("Only researchers can hold restricted books");
        assertThat(libraryService.placeHold(patterns, bob, HoldType.OPEN_ENDED).isSuccess()).isTrue();
        assertThat(libraryService.checkout(effective, alice).value()).isEqualTo(NOW.plus(Book.MAX_CHECKOUT_DURATION));
        recorder.catchUp();
        clock.advance(Book.MAX_CHECKOUT_DURATION.plus(Duration.ofDays(1)));
        var sweepResult = sweeper.sweep();
        assertThat(libraryService.returnBook(effective, alice).isSuccess()).isTrue();
        recorder.catchUp();
        catalog.catchUp();
        sheet.catchUp();

        // Then
        assertThat(sweepResult).isEqualTo(new SweepResult(0, 1, 0));
        var alicesRecord = libraryService.getPatron(alice).value();
        assertThat(alicesRecord.holdsCount).isZero();
        assertThat(alicesRecord.checkoutsCount).isZero();
        assertThat(alicesRecord.overduesByBranch).containsEntry(BRANCH, 1);
        assertThat(libraryService.getPatron(bob).value().holdsCount).isEqualTo(1);
        assertThat(catalog.getStatistics()).isEqualTo(new CatalogStatistics(2, 1, 1, 0));
        assertThat(sheet.getActiveHolds()).extracting(hold -> hold.bookId).containsExactly(patterns);
        assertThat(sheet.getOverdueCheckouts()).isEmpty();
    }

    @Test
    void verify_recorder_resumes_from_the_durable_resume_point() {
        // Given
        var alice  = libraryService.createPatron(PatronId.random(), PatronType.REGULAR, "Alice", "alice@example.com").value();
        var bookId = libraryService.addBook(BookId.random(), "978-0134685991", "Effective Java", BookType.CIRCULATING, BRANCH).value();
        libraryService.placeHold(bookId, alice);
        var firstRecorder = new PatronLendingRecorder(eventStore, new PostgresqlSubscriptionResumePointStore(unitOfWorkFactory), configuration, clock);
        assertThat(firstRecorder.catchUp()).isEqualTo(2);

        // When
        libraryService.checkout(bookId, alice);
        var restartedRecorder = new PatronLendingRecorder(eventStore, new PostgresqlSubscriptionResumePointStore(unitOfWorkFactory), configuration, clock);
        var handled           = restartedRecorder.catchUp();

        // Then
        assertThat(handled).isEqualTo(1);
        assertThat(libraryService.getPatron(alice).value().checkoutsCount).isEqualTo(1);
    }

    @Test
    void verify_only_one_of_many_concurrent_holds_on_the_same_book_succeeds() throws Exception {
        // Given
        var bookId   = libraryService.addBook(BookId.random(), "978-0134685991", "Effective Java", BookType.CIRCULATING, BRANCH).value();
        var patrons = IntStream.range(0, 8)
                               .mapToObj(i -> libraryService.createPatron(PatronId.random(), PatronType.REGULAR, "Patron " + i, "patron" + i + "@example.com").value())
                               .collect(Collectors.toList());
        var executor = Executors.newFixedThreadPool(patrons.size());
        var start    = new CountDownLatch(1);

        // When
        List<Future<LibraryResult<HoldPlacement>>> futures = new ArrayList<>();
        try {
            for (var patronId : patrons) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return libraryService.placeHold(bookId, patronId);
                }));
            }
            start.countDown();
            var results = new ArrayList<LibraryResult<HoldPlacement>>();
            for (var future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }

            // Then
            assertThat(results).filteredOn(LibraryResult::isSuccess).hasSize(1);
            assertThat(results).filteredOn(LibraryResult::isFailure)
                               .allSatisfy(result -> assertThat(result.failureKind()).containsAnyOf(FailureKind.CONCURRENCY_CONFLICT,
                                                                                                      FailureKind.POLICY_VIOLATION));
            assertThat(eventStore.readStream(Book.streamName(bookId)).orElseThrow().eventList()).hasSize(2);
        } finally {
            executor.shutdownNow();
        }
    }
}
