package uk.gegc.gatekeeper.features.assignment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.gatekeeper.features.assignment.application.RoleProvisioningService;
import uk.gegc.gatekeeper.features.assignment.domain.event.RolePermissionsChangedEvent;
import uk.gegc.gatekeeper.features.catalog.domain.model.Permission;
import uk.gegc.gatekeeper.features.catalog.domain.model.Role;
import uk.gegc.gatekeeper.features.catalog.domain.repository.PermissionRepository;
import uk.gegc.gatekeeper.features.catalog.domain.repository.RoleRepository;
import uk.gegc.gatekeeper.shared.exception.ResourceNotFoundException;

import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class RoleProvisioningServiceImpl implements RoleProvisioningService {

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void grantPermission(String roleName, String permissionName) {
        Role role = loadRole(roleName);
        Permission permission = permissionRepository.findByName(permissionName)
                .orElseThrow(() -> new ResourceNotFoundException("Permission not found: " + permissionName));

        if (role.getPermissions() == null) {
            role.setPermissions(new HashSet<>());
        }
        if (!role.getPermissions().add(permission)) {
            log.debug("Role {} already carries permission {}", roleName, permissionName);
            return;
        }

        roleRepository.save(role);
        eventPublisher.publishEvent(new RolePermissionsChangedEvent(this, roleName, permissionName));
        log.info("Granted permission {} to role {}", permissionName, roleName);
    }

    @Override
    public void revokePermission(String roleName, String permissionName) {
        Role role = loadRole(roleName);
        if (!permissionRepository.existsByName(permissionName)) {
            throw new ResourceNotFoundException("Permission not found: " + permissionName);
        }

        boolean removed = role.getPermissions() != null
                && role.getPermissions().removeIf(p -> p.getName().equals(permissionName));
        if (!removed) {
            log.debug("Role {} does not carry permission {}", roleName, permissionName);
            return;
        }

        roleRepository.save(role);
        eventPublisher.publishEvent(new RolePermissionsChangedEvent(this, roleName, permissionName));
        log.info("Revoked permission {} from role {}", permissionName, roleName);
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> getRolePermissions(String roleName) {
        Role role = loadRole(roleName);
        if (role.getPermissions() == null) {
            return Set.of();
        }
        return role.getPermissions().stream()
                .map(Permission::getName)
                .collect(Collectors.toUnmodifiableSet());
    }

    private Role loadRole(String roleName) {
        return roleRepository.findByNameWithPermissions(roleName)
                .orElseThrow(() -> new ResourceNotFoundException("Role not found: " + roleName));
    }
}
