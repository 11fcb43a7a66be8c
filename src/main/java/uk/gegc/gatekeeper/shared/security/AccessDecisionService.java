package uk.gegc.gatekeeper.shared.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.gatekeeper.features.catalog.application.CatalogProvider;
import uk.gegc.gatekeeper.features.catalog.domain.model.Catalog;
import uk.gegc.gatekeeper.features.snapshot.application.SnapshotService;
import uk.gegc.gatekeeper.features.snapshot.domain.AccessSnapshot;
import uk.gegc.gatekeeper.shared.exception.SnapshotUnavailableException;

import java.util.Collection;
import java.util.List;

/**
 * The single decision path behind {@link AccessGuard} and {@link AccessGate}:
 * builds the subject's snapshot, resolves the resource context and asks the
 * {@link AccessEvaluator}. A snapshot that cannot be built yields
 * {@link AccessDecision.Outcome#SNAPSHOT_UNAVAILABLE}, never a grant.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessDecisionService {

    private final SnapshotService snapshotService;
    private final AccessEvaluator accessEvaluator;
    private final CatalogProvider catalogProvider;

    public AccessDecision decidePermission(String subjectId, String permissionName, ResourceContextResolver resolver) {
        return decide(subjectId, null, List.of(permissionName), LogicalOperator.AND, resolver);
    }

    /**
     * Decides a permission requirement.
     *
     * @param subjectId      subject being authorized; blank means anonymous and is denied
     * @param organizationId organization whose scoped role grants apply, or {@code null}
     * @param permissionNames required permissions, at least one
     * @param operator       how {@code permissionNames} combine
     * @param resolver       supplies the resource context; invoked at most once
     */
    public AccessDecision decide(String subjectId,
                                 String organizationId,
                                 Collection<String> permissionNames,
                                 LogicalOperator operator,
                                 ResourceContextResolver resolver) {
        if (permissionNames == null || permissionNames.isEmpty()) {
            throw new IllegalArgumentException("At least one permission is required");
        }
        Catalog catalog = catalogProvider.getCatalog();
        permissionNames.forEach(catalog::permission);

        String requirement = describe(permissionNames, operator);
        if (isAnonymous(subjectId)) {
            return AccessDecision.denied(requirement);
        }

        AccessSnapshot snapshot;
        try {
            snapshot = snapshotService.getSnapshot(subjectId, organizationId);
        } catch (SnapshotUnavailableException e) {
            return AccessDecision.unavailable(requirement, e);
        }

        ResourceContext context = resolver != null ? resolver.resolve() : null;

        if (operator == LogicalOperator.OR) {
            return accessEvaluator.hasAnyPermission(snapshot, permissionNames, context)
                    ? AccessDecision.granted()
                    : AccessDecision.denied(requirement);
        }
        String failed = accessEvaluator.firstDenied(snapshot, permissionNames, context);
        return failed == null ? AccessDecision.granted() : AccessDecision.denied(failed);
    }

    public AccessDecision decideRole(String subjectId, String organizationId, String roleName) {
        catalogProvider.getCatalog().role(roleName);
        if (isAnonymous(subjectId)) {
            return AccessDecision.denied(roleName);
        }
        try {
            AccessSnapshot snapshot = snapshotService.getSnapshot(subjectId, organizationId);
            return accessEvaluator.hasRole(snapshot, roleName)
                    ? AccessDecision.granted()
                    : AccessDecision.denied(roleName);
        } catch (SnapshotUnavailableException e) {
            return AccessDecision.unavailable(roleName, e);
        }
    }

    public AccessDecision decideMinimumRole(String subjectId, String organizationId, String roleName) {
        catalogProvider.getCatalog().role(roleName);
        if (isAnonymous(subjectId)) {
            return AccessDecision.denied(roleName);
        }
        try {
            AccessSnapshot snapshot = snapshotService.getSnapshot(subjectId, organizationId);
            return accessEvaluator.hasMinimumRole(snapshot, roleName)
                    ? AccessDecision.granted()
                    : AccessDecision.denied(roleName);
        } catch (SnapshotUnavailableException e) {
            return AccessDecision.unavailable(roleName, e);
        }
    }

    private boolean isAnonymous(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            log.debug("No subject supplied, denying");
            return true;
        }
        return false;
    }

    private String describe(Collection<String> permissionNames, LogicalOperator operator) {
        if (permissionNames.size() == 1) {
            return permissionNames.iterator().next();
        }
        return String.join(operator == LogicalOperator.OR ? " | " : " & ", permissionNames);
    }
}
