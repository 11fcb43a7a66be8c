package uk.gegc.gatekeeper.features.catalog.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.gatekeeper.features.catalog.application.CatalogProvider;
import uk.gegc.gatekeeper.features.catalog.domain.model.*;
import uk.gegc.gatekeeper.features.catalog.domain.repository.PermissionRepository;
import uk.gegc.gatekeeper.features.catalog.domain.repository.RoleRepository;

import java.util.List;

/**
 * Loads the catalog from the provisioned {@code roles} and {@code permissions}
 * tables. The loaded value is immutable; {@link #reload()} swaps it wholesale
 * after an administrative migration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RepositoryCatalogProvider implements CatalogProvider {

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;

    private volatile Catalog catalog;

    @Override
    public Catalog getCatalog() {
        Catalog current = catalog;
        if (current == null) {
            synchronized (this) {
                current = catalog;
                if (current == null) {
                    current = load();
                    catalog = current;
                }
            }
        }
        return current;
    }

    @Override
    public synchronized Catalog reload() {
        catalog = load();
        return catalog;
    }

    private Catalog load() {
        List<RoleDefinition> roles = roleRepository.findAllByOrderByLevelAsc().stream()
                .map(role -> new RoleDefinition(role.getName(), role.getLevel()))
                .toList();
        List<PermissionDefinition> permissions = permissionRepository.findAll().stream()
                .map(PermissionDefinition::from)
                .toList();

        Catalog loaded = Catalog.of(roles, permissions);
        verifyLadder(loaded);
        log.info("Loaded access catalog: {} roles, {} permissions, top role {}",
                loaded.roles().size(), loaded.permissions().size(),
                loaded.topRole().map(RoleDefinition::name).orElse("<none>"));
        return loaded;
    }

    private void verifyLadder(Catalog loaded) {
        for (RoleName roleName : RoleName.values()) {
            RoleDefinition definition = loaded.findRole(roleName.getRoleName())
                    .orElseThrow(() -> new IllegalStateException(
                            "Provisioned catalog is missing role " + roleName.getRoleName()));
            if (definition.level() != roleName.getLevel()) {
                throw new IllegalStateException("Role " + roleName.getRoleName() + " is provisioned at level "
                        + definition.level() + ", expected " + roleName.getLevel());
            }
        }
        if (!loaded.isTopRole(RoleName.SUPER_ADMIN.getRoleName())) {
            throw new IllegalStateException("Role " + RoleName.SUPER_ADMIN.getRoleName()
                    + " must hold the highest level in the catalog");
        }
    }
}
