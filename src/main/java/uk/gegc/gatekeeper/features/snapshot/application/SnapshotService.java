package uk.gegc.gatekeeper.features.snapshot.application;

import uk.gegc.gatekeeper.features.snapshot.domain.AccessSnapshot;
import uk.gegc.gatekeeper.shared.exception.SnapshotUnavailableException;

public interface SnapshotService {

    /**
     * Builds the snapshot from the subject's unscoped assignments.
     *
     * @throws SnapshotUnavailableException if the store cannot be read in time
     */
    AccessSnapshot getSnapshot(String subjectId);

    /**
     * Builds the snapshot from unscoped assignments plus those scoped to
     * {@code organizationId}.
     *
     * @throws SnapshotUnavailableException if the store cannot be read in time
     */
    AccessSnapshot getSnapshot(String subjectId, String organizationId);

    void invalidate(String subjectId);

    void invalidateAll();
}
