package uk.gegc.gatekeeper.features.snapshot.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.gatekeeper.features.catalog.application.CatalogProvider;
import uk.gegc.gatekeeper.features.catalog.domain.model.Catalog;
import uk.gegc.gatekeeper.features.snapshot.application.AssignmentStore;
import uk.gegc.gatekeeper.features.snapshot.application.SnapshotService;
import uk.gegc.gatekeeper.features.snapshot.domain.AccessSnapshot;
import uk.gegc.gatekeeper.features.snapshot.domain.SubjectAssignments;
import uk.gegc.gatekeeper.shared.config.GatekeeperProperties;
import uk.gegc.gatekeeper.shared.exception.SnapshotUnavailableException;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Builds {@link AccessSnapshot}s from the assignment store. The store read is
 * the only blocking step in a decision; it runs on a dedicated executor and is
 * bounded by {@code gatekeeper.snapshot.timeout}. Every failure surfaces as
 * {@link SnapshotUnavailableException}.
 */
@Service
@Slf4j
public class AssignmentSnapshotServiceImpl implements SnapshotService {

    private final AssignmentStore assignmentStore;
    private final CatalogProvider catalogProvider;
    private final Executor snapshotExecutor;
    private final Clock clock;
    private final Duration timeout;
    private final SnapshotCache cache;

    @Autowired
    public AssignmentSnapshotServiceImpl(AssignmentStore assignmentStore,
                                         CatalogProvider catalogProvider,
                                         @Qualifier("snapshotExecutor") Executor snapshotExecutor,
                                         Clock clock,
                                         GatekeeperProperties properties) {
        this(assignmentStore, catalogProvider, snapshotExecutor, clock,
                properties.getSnapshot().getTimeout(),
                new SnapshotCache(properties.getSnapshot().getCacheTtl(),
                        properties.getSnapshot().getCacheMaxEntries(), clock));
    }

    public AssignmentSnapshotServiceImpl(AssignmentStore assignmentStore,
                                         CatalogProvider catalogProvider,
                                         Executor snapshotExecutor,
                                         Clock clock,
                                         Duration timeout,
                                         SnapshotCache cache) {
        this.assignmentStore = assignmentStore;
        this.catalogProvider = catalogProvider;
        this.snapshotExecutor = snapshotExecutor;
        this.clock = clock;
        this.timeout = timeout;
        this.cache = cache;
    }

    @Override
    public AccessSnapshot getSnapshot(String subjectId) {
        return getSnapshot(subjectId, null);
    }

    @Override
    public AccessSnapshot getSnapshot(String subjectId, String organizationId) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject id must not be blank");
        }
        String orgId = organizationId == null || organizationId.isBlank() ? null : organizationId;

        Optional<AccessSnapshot> cached = cache.get(subjectId, orgId);
        if (cached.isPresent()) {
            return cached.get();
        }

        long generation = cache.generation();
        SubjectAssignments assignments = readStore(subjectId, orgId);
        AccessSnapshot snapshot = toSnapshot(subjectId, orgId, assignments);
        cache.put(snapshot, generation);
        return snapshot;
    }

    @Override
    public void invalidate(String subjectId) {
        cache.invalidate(subjectId);
        log.debug("Invalidated cached snapshots for subject {}", subjectId);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cached snapshots");
    }

    // A FutureTask so that cancel(true) interrupts the worker running a timed-out read.
    private SubjectAssignments readStore(String subjectId, String organizationId) {
        FutureTask<SubjectAssignments> read = new FutureTask<>(() -> assignmentStore.load(subjectId, organizationId));
        try {
            snapshotExecutor.execute(read);
        } catch (RejectedExecutionException e) {
            throw unavailable(subjectId, "Assignment store read rejected", e);
        }

        SubjectAssignments assignments;
        try {
            assignments = read.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            read.cancel(true);
            throw unavailable(subjectId, "Assignment store read timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            read.cancel(true);
            Thread.currentThread().interrupt();
            throw unavailable(subjectId, "Interrupted while reading assignment store", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw unavailable(subjectId, "Assignment store read failed", cause);
        }

        if (assignments == null) {
            throw unavailable(subjectId, "Assignment store returned no data", null);
        }
        return assignments;
    }

    private AccessSnapshot toSnapshot(String subjectId, String organizationId, SubjectAssignments assignments) {
        Catalog catalog = catalogProvider.getCatalog();

        Set<String> roles = keepKnown(assignments.roles(), catalog::containsRole, subjectId, "role");
        Set<String> permissions = keepKnown(assignments.permissions(), catalog::containsPermission, subjectId, "permission");

        return new AccessSnapshot(subjectId, organizationId, roles, permissions, assignments.teamIds(), clock.instant());
    }

    private Set<String> keepKnown(Set<String> names, Predicate<String> known,
                                  String subjectId, String kind) {
        Set<String> kept = names.stream().filter(known).collect(Collectors.toSet());
        if (kept.size() != names.size()) {
            log.warn("Ignoring {} {} name(s) not in the catalog for subject {}",
                    names.size() - kept.size(), kind, subjectId);
        }
        return kept;
    }

    private SnapshotUnavailableException unavailable(String subjectId, String reason, Throwable cause) {
        log.warn("{} for subject {}: {}", reason, subjectId, cause != null ? cause.toString() : "no cause");
        return new SnapshotUnavailableException(subjectId, reason + " for subject " + subjectId, cause);
    }
}
