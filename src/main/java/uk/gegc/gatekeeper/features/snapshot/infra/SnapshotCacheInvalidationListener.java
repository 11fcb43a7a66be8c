package uk.gegc.gatekeeper.features.snapshot.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.gatekeeper.features.assignment.domain.event.RolePermissionsChangedEvent;
import uk.gegc.gatekeeper.features.assignment.domain.event.SubjectAssignmentsChangedEvent;
import uk.gegc.gatekeeper.features.catalog.application.CatalogProvider;
import uk.gegc.gatekeeper.features.catalog.domain.event.CatalogChangedEvent;
import uk.gegc.gatekeeper.features.snapshot.application.SnapshotService;

/**
 * Drops cached snapshots once an assignment or catalog write commits. Runs on
 * the committing thread so the write call returns only after the cache is clean.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotCacheInvalidationListener {

    private final SnapshotService snapshotService;
    private final CatalogProvider catalogProvider;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onSubjectAssignmentsChanged(SubjectAssignmentsChangedEvent event) {
        log.debug("Assignments changed for subject {} ({})", event.getSubjectId(), event.getChangeType());
        snapshotService.invalidate(event.getSubjectId());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRolePermissionsChanged(RolePermissionsChangedEvent event) {
        log.debug("Permissions of role {} changed ({})", event.getRoleName(), event.getPermissionName());
        snapshotService.invalidateAll();
    }

    // Reload before invalidating: a snapshot built after the invalidation must see the new catalog.
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onCatalogChanged(CatalogChangedEvent event) {
        log.info("Reloading access catalog: {}", event.getReason());
        catalogProvider.reload();
        snapshotService.invalidateAll();
    }
}
