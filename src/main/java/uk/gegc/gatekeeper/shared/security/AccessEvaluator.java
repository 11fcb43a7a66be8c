package uk.gegc.gatekeeper.shared.security;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.gatekeeper.features.catalog.application.CatalogProvider;
import uk.gegc.gatekeeper.features.catalog.domain.model.Catalog;
import uk.gegc.gatekeeper.features.catalog.domain.model.PermissionDefinition;
import uk.gegc.gatekeeper.features.catalog.domain.model.RoleDefinition;
import uk.gegc.gatekeeper.features.snapshot.domain.AccessSnapshot;
import uk.gegc.gatekeeper.shared.exception.CatalogMisuseException;

import java.util.Collection;
import java.util.Objects;

/**
 * Decision logic over an {@link AccessSnapshot}. Stateless and read-only: the
 * same snapshot and inputs always produce the same answer, and it is safe to
 * call from any number of threads.
 *
 * <p>Holding the catalog's top role grants every permission. That is the only
 * bypass. Requested names must exist in the catalog; an unknown name throws
 * {@link CatalogMisuseException} instead of producing a decision.
 */
@Component
@RequiredArgsConstructor
public class AccessEvaluator {

    private final CatalogProvider catalogProvider;

    public boolean hasPermission(AccessSnapshot snapshot, String permissionName, ResourceContext context) {
        Catalog catalog = catalogProvider.getCatalog();
        PermissionDefinition permission = catalog.permission(permissionName);
        return check(catalog, snapshot, permission, context);
    }

    public boolean hasPermission(AccessSnapshot snapshot, String permissionName) {
        return hasPermission(snapshot, permissionName, null);
    }

    /**
     * True if at least one of the permissions is granted. An empty collection
     * grants nothing.
     */
    public boolean hasAnyPermission(AccessSnapshot snapshot, Collection<String> permissionNames, ResourceContext context) {
        Catalog catalog = catalogProvider.getCatalog();
        PermissionDefinition[] permissions = resolveAll(catalog, permissionNames);
        for (PermissionDefinition permission : permissions) {
            if (check(catalog, snapshot, permission, context)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if every permission is granted. Vacuously true for an empty collection.
     */
    public boolean hasAllPermissions(AccessSnapshot snapshot, Collection<String> permissionNames, ResourceContext context) {
        Catalog catalog = catalogProvider.getCatalog();
        PermissionDefinition[] permissions = resolveAll(catalog, permissionNames);
        for (PermissionDefinition permission : permissions) {
            if (!check(catalog, snapshot, permission, context)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Exact membership; no hierarchy.
     */
    public boolean hasRole(AccessSnapshot snapshot, String roleName) {
        Catalog catalog = catalogProvider.getCatalog();
        RoleDefinition role = catalog.role(roleName);
        return snapshot != null && snapshot.roles().contains(role.name());
    }

    /**
     * True if the subject's highest role level reaches the level of {@code roleName}.
     * A subject without roles is at level 0.
     */
    public boolean hasMinimumRole(AccessSnapshot snapshot, String roleName) {
        Catalog catalog = catalogProvider.getCatalog();
        RoleDefinition required = catalog.role(roleName);
        return highestLevel(catalog, snapshot) >= required.level();
    }

    /**
     * Looks up the first permission of {@code permissionNames} the snapshot fails,
     * or {@code null} when all pass. Used to report the failing name on denial.
     */
    public String firstDenied(AccessSnapshot snapshot, Collection<String> permissionNames, ResourceContext context) {
        Catalog catalog = catalogProvider.getCatalog();
        for (PermissionDefinition permission : resolveAll(catalog, permissionNames)) {
            if (!check(catalog, snapshot, permission, context)) {
                return permission.name();
            }
        }
        return null;
    }

    private boolean check(Catalog catalog, AccessSnapshot snapshot, PermissionDefinition permission,
                          ResourceContext context) {
        if (snapshot == null) {
            return false;
        }
        if (snapshot.roles().stream().anyMatch(catalog::isTopRole)) {
            return true;
        }
        if (!snapshot.permissions().contains(permission.name())) {
            return false;
        }

        return switch (permission.scope()) {
            case NONE, ALL -> true;
            case OWN -> context != null && context.hasOwner()
                    && context.resourceOwnerId().equals(snapshot.subjectId());
            case TEAM -> context != null && context.hasTeam()
                    && snapshot.teamIds().contains(context.resourceTeamId());
        };
    }

    // Names are validated before any short-circuit so a misspelt name never hides behind an earlier grant.
    private PermissionDefinition[] resolveAll(Catalog catalog, Collection<String> permissionNames) {
        Objects.requireNonNull(permissionNames, "Permission names must not be null");
        return permissionNames.stream()
                .map(catalog::permission)
                .toArray(PermissionDefinition[]::new);
    }

    private int highestLevel(Catalog catalog, AccessSnapshot snapshot) {
        if (snapshot == null) {
            return 0;
        }
        return snapshot.roles().stream()
                .mapToInt(catalog::levelOf)
                .max()
                .orElse(0);
    }
}
