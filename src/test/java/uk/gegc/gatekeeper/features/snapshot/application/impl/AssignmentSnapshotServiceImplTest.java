package uk.gegc.gatekeeper.features.snapshot.application.impl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.gatekeeper.BaseUnitTest;
import uk.gegc.gatekeeper.features.snapshot.application.AssignmentStore;
import uk.gegc.gatekeeper.features.snapshot.domain.AccessSnapshot;
import uk.gegc.gatekeeper.features.snapshot.domain.SubjectAssignments;
import uk.gegc.gatekeeper.shared.exception.SnapshotUnavailableException;
import uk.gegc.gatekeeper.support.MutableClock;
import uk.gegc.gatekeeper.support.TestCatalogs;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AssignmentSnapshotServiceImpl")
class AssignmentSnapshotServiceImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private AssignmentStore assignmentStore;

    private ExecutorService executor;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        clock = new MutableClock(NOW);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private AssignmentSnapshotServiceImpl service(Duration timeout, Duration cacheTtl) {
        return new AssignmentSnapshotServiceImpl(assignmentStore, TestCatalogs.provider(), executor, clock,
                timeout, new SnapshotCache(cacheTtl, 100, clock));
    }

    @Nested
    @DisplayName("getSnapshot")
    class GetSnapshotTests {

        @Test
        @DisplayName("getSnapshot: builds the snapshot from the store read")
        void getSnapshot_buildsFromStore() {
            // Given
            when(assignmentStore.load("alice", null)).thenReturn(new SubjectAssignments(
                    Set.of("user"), Set.of("campaigns.create", "campaigns.read.own"), Set.of("team-1")));

            // When
            AccessSnapshot snapshot = service(Duration.ofSeconds(1), Duration.ZERO).getSnapshot("alice");

            // Then
            assertThat(snapshot.subjectId()).isEqualTo("alice");
            assertThat(snapshot.organizationId()).isNull();
            assertThat(snapshot.roles()).containsExactly("user");
            assertThat(snapshot.permissions()).containsExactlyInAnyOrder("campaigns.create", "campaigns.read.own");
            assertThat(snapshot.teamIds()).containsExactly("team-1");
            assertThat(snapshot.builtAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("getSnapshot: role and permission names missing from the catalog are dropped")
        void getSnapshot_unknownNamesDropped() {
            // Given
            when(assignmentStore.load("alice", null)).thenReturn(new SubjectAssignments(
                    Set.of("user", "legacy_owner"), Set.of("campaigns.create", "campaigns.launch_rockets"), Set.of()));

            // When
            AccessSnapshot snapshot = service(Duration.ofSeconds(1), Duration.ZERO).getSnapshot("alice");

            // Then
            assertThat(snapshot.roles()).containsExactly("user");
            assertThat(snapshot.permissions()).containsExactly("campaigns.create");
        }

        @Test
        @DisplayName("getSnapshot: organization id is passed to the store and kept on the snapshot")
        void getSnapshot_organization() {
            // Given
            when(assignmentStore.load("alice", "org-7")).thenReturn(new SubjectAssignments(
                    Set.of("manager"), Set.of(), Set.of()));

            // When
            AccessSnapshot snapshot = service(Duration.ofSeconds(1), Duration.ZERO).getSnapshot("alice", "org-7");

            // Then
            assertThat(snapshot.organizationId()).isEqualTo("org-7");
            assertThat(snapshot.roles()).containsExactly("manager");
        }

        @Test
        @DisplayName("getSnapshot: blank subject id is rejected")
        void getSnapshot_blankSubject_rejected() {
            assertThatThrownBy(() -> service(Duration.ofSeconds(1), Duration.ZERO).getSnapshot(" "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("getSnapshot: a store read exceeding the timeout is SnapshotUnavailable")
        void getSnapshot_timeout() throws InterruptedException {
            // Given
            CountDownLatch release = new CountDownLatch(1);
            when(assignmentStore.load("alice", null)).thenAnswer(invocation -> {
                release.await(5, TimeUnit.SECONDS);
                return new SubjectAssignments(Set.of("super_admin"), Set.of(), Set.of());
            });

            // When / Then
            try {
                assertThatThrownBy(() -> service(Duration.ofMillis(50), Duration.ZERO).getSnapshot("alice"))
                        .isInstanceOf(SnapshotUnavailableException.class)
                        .hasMessageContaining("timed out")
                        .extracting("subjectId").isEqualTo("alice");
            } finally {
                release.countDown();
            }
        }

        @Test
        @DisplayName("getSnapshot: a timed-out read is interrupted so its worker thread is freed")
        void getSnapshot_timeout_interruptsRead() throws InterruptedException {
            // Given
            CountDownLatch interrupted = new CountDownLatch(1);
            when(assignmentStore.load("alice", null)).thenAnswer(invocation -> {
                try {
                    new CountDownLatch(1).await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return new SubjectAssignments(Set.of("user"), Set.of(), Set.of());
            });
            AssignmentSnapshotServiceImpl service = service(Duration.ofMillis(50), Duration.ZERO);

            // When
            assertThatThrownBy(() -> service.getSnapshot("alice"))
                    .isInstanceOf(SnapshotUnavailableException.class);

            // Then
            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();

            when(assignmentStore.load("bob", null)).thenReturn(new SubjectAssignments(Set.of("viewer"), Set.of(), Set.of()));
            assertThat(service(Duration.ofSeconds(2), Duration.ZERO).getSnapshot("bob").roles()).containsExactly("viewer");
        }

        @Test
        @DisplayName("getSnapshot: a store exception is SnapshotUnavailable with the cause attached")
        void getSnapshot_storeFailure() {
            // Given
            IllegalStateException cause = new IllegalStateException("connection refused");
            when(assignmentStore.load("alice", null)).thenThrow(cause);

            // When / Then
            assertThatThrownBy(() -> service(Duration.ofSeconds(1), Duration.ZERO).getSnapshot("alice"))
                    .isInstanceOf(SnapshotUnavailableException.class)
                    .hasCause(cause);
        }

        @Test
        @DisplayName("getSnapshot: a store returning no data is SnapshotUnavailable")
        void getSnapshot_nullData() {
            when(assignmentStore.load("alice", null)).thenReturn(null);

            assertThatThrownBy(() -> service(Duration.ofSeconds(1), Duration.ZERO).getSnapshot("alice"))
                    .isInstanceOf(SnapshotUnavailableException.class)
                    .hasMessageContaining("no data");
        }

        @Test
        @DisplayName("getSnapshot: a rejected read is SnapshotUnavailable")
        void getSnapshot_rejected() {
            // Given
            AssignmentSnapshotServiceImpl rejecting = new AssignmentSnapshotServiceImpl(assignmentStore,
                    TestCatalogs.provider(), command -> {
                        throw new RejectedExecutionException("pool saturated");
                    }, clock, Duration.ofSeconds(1), new SnapshotCache(Duration.ZERO, 1, clock));

            // When / Then
            assertThatThrownBy(() -> rejecting.getSnapshot("alice"))
                    .isInstanceOf(SnapshotUnavailableException.class)
                    .hasMessageContaining("rejected");
            verify(assignmentStore, never()).load(any(), any());
        }
    }

    @Nested
    @DisplayName("caching")
    class CachingTests {

        @Test
        @DisplayName("getSnapshot: with a TTL the store is read once per window")
        void getSnapshot_cachedWithinTtl() {
            // Given
            when(assignmentStore.load("alice", null)).thenReturn(new SubjectAssignments(
                    Set.of("user"), Set.of("campaigns.create"), Set.of()));
            AssignmentSnapshotServiceImpl service = service(Duration.ofSeconds(1), Duration.ofSeconds(30));

            // When
            AccessSnapshot first = service.getSnapshot("alice");
            AccessSnapshot second = service.getSnapshot("alice");
            clock.advance(Duration.ofSeconds(31));
            service.getSnapshot("alice");

            // Then
            assertThat(second).isSameAs(first);
            verify(assignmentStore, times(2)).load("alice", null);
        }

        @Test
        @DisplayName("invalidate: the next read goes back to the store")
        void invalidate_forcesRebuild() {
            // Given
            when(assignmentStore.load("alice", null))
                    .thenReturn(new SubjectAssignments(Set.of("user"), Set.of(), Set.of()))
                    .thenReturn(new SubjectAssignments(Set.of(), Set.of(), Set.of()));
            AssignmentSnapshotServiceImpl service = service(Duration.ofSeconds(1), Duration.ofMinutes(5));
            service.getSnapshot("alice");

            // When
            service.invalidate("alice");
            AccessSnapshot rebuilt = service.getSnapshot("alice");

            // Then
            assertThat(rebuilt.roles()).isEmpty();
        }

        @Test
        @DisplayName("getSnapshot: failures are never cached")
        void getSnapshot_failureNotCached() {
            // Given
            when(assignmentStore.load("alice", null))
                    .thenThrow(new IllegalStateException("down"))
                    .thenReturn(new SubjectAssignments(Set.of("viewer"), Set.of(), Set.of()));
            AssignmentSnapshotServiceImpl service = service(Duration.ofSeconds(1), Duration.ofMinutes(5));

            // When
            assertThatThrownBy(() -> service.getSnapshot("alice")).isInstanceOf(SnapshotUnavailableException.class);
            AccessSnapshot recovered = service.getSnapshot("alice");

            // Then
            assertThat(recovered.roles()).containsExactly("viewer");
        }
    }
}
