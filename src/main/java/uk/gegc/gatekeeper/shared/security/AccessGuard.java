package uk.gegc.gatekeeper.shared.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.gatekeeper.shared.exception.ForbiddenException;

import java.util.Collection;
import java.util.List;

/**
 * Enforcement at the entry of a privileged operation. Returns normally when
 * access is granted and throws {@link ForbiddenException} otherwise, including
 * when the subject's assignments cannot be read.
 *
 * <p>Denials are logged with the subject and the failing permission only;
 * resource owner and team ids are never written to the log.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessGuard {

    private final AccessDecisionService decisionService;
    private final AccessDecisionMetrics metrics;

    public void requirePermission(String subjectId, String permissionName) {
        requirePermission(subjectId, permissionName, ResourceContextResolver.NONE);
    }

    public void requirePermission(String subjectId, String permissionName, ResourceContext context) {
        requirePermission(subjectId, permissionName, ResourceContextResolver.of(context));
    }

    public void requirePermission(String subjectId, String permissionName, ResourceContextResolver resolver) {
        require(subjectId, null, List.of(permissionName), LogicalOperator.AND, resolver);
    }

    public void requireAnyPermission(String subjectId, Collection<String> permissionNames,
                                     ResourceContextResolver resolver) {
        require(subjectId, null, permissionNames, LogicalOperator.OR, resolver);
    }

    public void requireAllPermissions(String subjectId, Collection<String> permissionNames,
                                      ResourceContextResolver resolver) {
        require(subjectId, null, permissionNames, LogicalOperator.AND, resolver);
    }

    public void require(String subjectId,
                        String organizationId,
                        Collection<String> permissionNames,
                        LogicalOperator operator,
                        ResourceContextResolver resolver) {
        AccessDecision decision = decisionService.decide(subjectId, organizationId, permissionNames, operator, resolver);
        enforce(subjectId, decision, operator);
    }

    public void requireRole(String subjectId, String roleName) {
        enforce(subjectId, decisionService.decideRole(subjectId, null, roleName), null);
    }

    public void requireMinimumRole(String subjectId, String roleName) {
        requireMinimumRole(subjectId, null, roleName);
    }

    public void requireMinimumRole(String subjectId, String organizationId, String roleName) {
        enforce(subjectId, decisionService.decideMinimumRole(subjectId, organizationId, roleName), null);
    }

    private void enforce(String subjectId, AccessDecision decision, LogicalOperator operator) {
        metrics.record(decision);
        switch (decision.outcome()) {
            case GRANTED -> log.debug("Access granted to subject {}", subjectId);
            case DENIED -> {
                log.warn("Access denied: subject {} lacks {}{}", subjectId, decision.requirement(),
                        operator == LogicalOperator.OR ? " (any of)" : "");
                throw new ForbiddenException(decision.requirement());
            }
            case SNAPSHOT_UNAVAILABLE -> {
                log.warn("Access denied: assignments unavailable for subject {} while checking {}",
                        subjectId, decision.requirement(), decision.failure());
                throw new ForbiddenException(decision.requirement(), decision.failure());
            }
        }
    }
}
