package uk.gegc.gatekeeper.features.assignment.application;

import java.util.Set;

public interface RoleProvisioningService {

    void grantPermission(String roleName, String permissionName);

    void revokePermission(String roleName, String permissionName);

    Set<String> getRolePermissions(String roleName);
}
