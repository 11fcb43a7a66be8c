package uk.gegc.gatekeeper.shared.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Boolean twin of {@link AccessGuard} for deciding whether to offer an
 * affordance. Never throws for a denial or a store outage; both read as
 * {@code false}. Unknown permission or role names still throw.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessGate {

    private final AccessDecisionService decisionService;

    public boolean isAllowed(String subjectId, String permissionName) {
        return isAllowed(subjectId, permissionName, ResourceContextResolver.NONE);
    }

    public boolean isAllowed(String subjectId, String permissionName, ResourceContext context) {
        return isAllowed(subjectId, permissionName, ResourceContextResolver.of(context));
    }

    public boolean isAllowed(String subjectId, String permissionName, ResourceContextResolver resolver) {
        return check(subjectId, null, List.of(permissionName), LogicalOperator.AND, resolver);
    }

    public boolean isAllowedAny(String subjectId, Collection<String> permissionNames, ResourceContextResolver resolver) {
        return check(subjectId, null, permissionNames, LogicalOperator.OR, resolver);
    }

    public boolean isAllowedAll(String subjectId, Collection<String> permissionNames, ResourceContextResolver resolver) {
        return check(subjectId, null, permissionNames, LogicalOperator.AND, resolver);
    }

    public boolean check(String subjectId,
                         String organizationId,
                         Collection<String> permissionNames,
                         LogicalOperator operator,
                         ResourceContextResolver resolver) {
        AccessDecision decision = decisionService.decide(subjectId, organizationId, permissionNames, operator, resolver);
        log.debug("Gate {} for subject {}: {}", decision.outcome(), subjectId, permissionNames);
        return decision.isGranted();
    }

    public boolean hasRole(String subjectId, String roleName) {
        return decisionService.decideRole(subjectId, null, roleName).isGranted();
    }

    public boolean hasMinimumRole(String subjectId, String roleName) {
        return decisionService.decideMinimumRole(subjectId, null, roleName).isGranted();
    }
}
