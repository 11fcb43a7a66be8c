package uk.gegc.gatekeeper.features.admin.application;

import java.util.List;
import java.util.Map;

/**
 * Keeps the provisioned roles and permissions in line with the canonical policy
 * manifest.
 */
public interface PolicyReconciliationService {

    /**
     * Reconcile every role and permission against the manifest:
     * add missing permissions, add missing roles, align role levels and
     * descriptions, and align role-permission mappings. Nothing is deleted
     * from the catalog tables.
     *
     * @return ReconciliationResult containing details of changes made
     */
    ReconciliationResult reconcileAll();

    /**
     * Reconcile a single role and its mappings against the manifest. The role's
     * permissions must already exist.
     */
    ReconciliationResult reconcileRole(String roleName);

    String getManifestVersion();

    boolean isInSync();

    /**
     * Get a detailed diff between database state and manifest.
     */
    PolicyDiff getPolicyDiff();

    record ReconciliationResult(
        boolean success,
        String message,
        int permissionsAdded,
        int rolesAdded,
        int rolesUpdated,
        int rolePermissionMappingsUpdated,
        List<String> errors
    ) {}

    record PolicyDiff(
        List<String> missingPermissions,
        List<String> extraPermissions,
        List<String> missingRoles,
        List<String> extraRoles,
        Map<String, List<String>> rolePermissionMismatches,
        String manifestVersion,
        boolean isInSync
    ) {}
}
