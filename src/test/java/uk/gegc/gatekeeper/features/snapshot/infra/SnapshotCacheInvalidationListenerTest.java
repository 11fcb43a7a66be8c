package uk.gegc.gatekeeper.features.snapshot.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import uk.gegc.gatekeeper.BaseUnitTest;
import uk.gegc.gatekeeper.features.assignment.domain.event.RolePermissionsChangedEvent;
import uk.gegc.gatekeeper.features.assignment.domain.event.SubjectAssignmentsChangedEvent;
import uk.gegc.gatekeeper.features.assignment.domain.event.SubjectAssignmentsChangedEvent.ChangeType;
import uk.gegc.gatekeeper.features.catalog.application.CatalogProvider;
import uk.gegc.gatekeeper.features.catalog.domain.event.CatalogChangedEvent;
import uk.gegc.gatekeeper.features.snapshot.application.SnapshotService;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("SnapshotCacheInvalidationListener")
class SnapshotCacheInvalidationListenerTest extends BaseUnitTest {

    @Mock
    private SnapshotService snapshotService;

    @Mock
    private CatalogProvider catalogProvider;

    @InjectMocks
    private SnapshotCacheInvalidationListener listener;

    @Test
    @DisplayName("assignment change drops only that subject's snapshots")
    void subjectChange_invalidatesSubject() {
        listener.onSubjectAssignmentsChanged(new SubjectAssignmentsChangedEvent(this, "alice", ChangeType.ROLE_GRANTED));

        verify(snapshotService).invalidate("alice");
        verifyNoInteractions(catalogProvider);
    }

    @Test
    @DisplayName("role permission change drops every snapshot")
    void rolePermissionChange_invalidatesAll() {
        listener.onRolePermissionsChanged(new RolePermissionsChangedEvent(this, "manager", "budgets.read.team"));

        verify(snapshotService).invalidateAll();
    }

    @Test
    @DisplayName("catalog change reloads the catalog before dropping every snapshot")
    void catalogChange_reloadsThenInvalidates() {
        listener.onCatalogChanged(new CatalogChangedEvent(this, "reconciliation"));

        InOrder order = inOrder(catalogProvider, snapshotService);
        order.verify(catalogProvider).reload();
        order.verify(snapshotService).invalidateAll();
    }
}
