package uk.gegc.gatekeeper.shared.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import uk.gegc.gatekeeper.features.admin.application.PolicyReconciliationService;
import uk.gegc.gatekeeper.features.admin.application.PolicyReconciliationService.PolicyDiff;
import uk.gegc.gatekeeper.features.admin.application.PolicyReconciliationService.ReconciliationResult;
import uk.gegc.gatekeeper.features.catalog.application.CatalogProvider;

/**
 * Loads the catalog at startup so a broken role ladder stops the application
 * instead of failing the first access decision. Optionally reconciles the
 * provisioned catalog with the policy manifest first.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {

    private final GatekeeperProperties properties;
    private final PolicyReconciliationService policyReconciliationService;
    private final CatalogProvider catalogProvider;

    @Override
    public void run(String... args) {
        log.info("Starting access catalog initialization...");

        if (properties.getPolicy().isReconcileOnStartup()) {
            ReconciliationResult result = policyReconciliationService.reconcileAll();
            if (!result.success()) {
                log.error("Policy reconciliation reported errors: {}", result.errors());
            }
        } else {
            PolicyDiff diff = policyReconciliationService.getPolicyDiff();
            if (!diff.isInSync()) {
                log.warn("Provisioned catalog differs from policy manifest {}: missing permissions {}, missing roles {}, mismatches {}",
                        diff.manifestVersion(), diff.missingPermissions(), diff.missingRoles(),
                        diff.rolePermissionMismatches().keySet());
            }
        }

        log.info("Access catalog ready: {}", catalogProvider.getCatalog());
    }
}
