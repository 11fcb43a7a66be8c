package uk.gegc.gatekeeper.features.admin.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.gatekeeper.features.admin.application.PolicyReconciliationService;
import uk.gegc.gatekeeper.features.assignment.domain.event.RolePermissionsChangedEvent;
import uk.gegc.gatekeeper.features.catalog.domain.event.CatalogChangedEvent;
import uk.gegc.gatekeeper.features.catalog.domain.model.Permission;
import uk.gegc.gatekeeper.features.catalog.domain.model.PermissionDefinition;
import uk.gegc.gatekeeper.features.catalog.domain.model.PermissionScope;
import uk.gegc.gatekeeper.features.catalog.domain.model.Role;
import uk.gegc.gatekeeper.features.catalog.domain.repository.PermissionRepository;
import uk.gegc.gatekeeper.features.catalog.domain.repository.RoleRepository;
import uk.gegc.gatekeeper.shared.config.GatekeeperProperties;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class PolicyReconciliationServiceImpl implements PolicyReconciliationService {

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final ObjectMapper objectMapper;
    private final GatekeeperProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    public ReconciliationResult reconcileAll() {
        log.info("Starting full policy reconciliation");
        List<String> errors = new ArrayList<>();
        int rolesAdded = 0;
        int rolesUpdated = 0;
        int rolePermissionMappingsUpdated = 0;

        try {
            JsonNode manifest = loadManifest();

            // Permissions first so role mappings can reference them
            int permissionsAdded = reconcilePermissions(manifest, errors);

            for (JsonNode roleNode : manifest.get("roles")) {
                String roleName = roleNode.get("name").asText();
                RoleChanges changes = reconcileRoleNode(roleName, roleNode, errors);
                rolesAdded += changes.added();
                rolesUpdated += changes.updated();
                rolePermissionMappingsUpdated += changes.mappingsUpdated();
            }

            if (permissionsAdded + rolesAdded + rolesUpdated > 0) {
                eventPublisher.publishEvent(new CatalogChangedEvent(this, "policy reconciliation"));
            }

            boolean success = errors.isEmpty();
            String message = success
                ? "Policy reconciliation completed successfully"
                : "Policy reconciliation completed with " + errors.size() + " errors";

            log.info("Policy reconciliation completed: {} permissions added, {} roles added/updated, {} mappings updated",
                permissionsAdded, rolesAdded + rolesUpdated, rolePermissionMappingsUpdated);

            return new ReconciliationResult(success, message, permissionsAdded,
                rolesAdded, rolesUpdated, rolePermissionMappingsUpdated, errors);

        } catch (IOException | RuntimeException e) {
            log.error("Failed to reconcile policy: {}", e.getMessage(), e);
            errors.add("Failed to reconcile policy: " + e.getMessage());
            return new ReconciliationResult(false, "Policy reconciliation failed", 0, 0, 0, 0, errors);
        }
    }

    @Override
    public ReconciliationResult reconcileRole(String roleName) {
        log.info("Reconciling role: {}", roleName);
        List<String> errors = new ArrayList<>();

        try {
            JsonNode roleNode = loadManifest().get("roles").get(roleName);
            if (roleNode == null) {
                throw new IllegalArgumentException("Role not found in manifest: " + roleName);
            }

            RoleChanges changes = reconcileRoleNode(roleName, roleNode, errors);
            if (changes.added() + changes.updated() > 0) {
                eventPublisher.publishEvent(new CatalogChangedEvent(this, "role " + roleName + " reconciled"));
            }
            return new ReconciliationResult(errors.isEmpty(), "Role reconciliation completed", 0,
                changes.added(), changes.updated(), changes.mappingsUpdated(), errors);

        } catch (IOException | RuntimeException e) {
            log.error("Failed to reconcile role {}: {}", roleName, e.getMessage(), e);
            errors.add("Failed to reconcile role " + roleName + ": " + messageOf(e));
            return new ReconciliationResult(false, "Role reconciliation failed", 0, 0, 0, 0, errors);
        }
    }

    @Override
    public String getManifestVersion() {
        try {
            return loadManifest().get("version").asText();
        } catch (IOException | RuntimeException e) {
            log.error("Failed to get manifest version: {}", e.getMessage());
            return "unknown";
        }
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isInSync() {
        return getPolicyDiff().isInSync();
    }

    @Override
    @Transactional(readOnly = true)
    public PolicyDiff getPolicyDiff() {
        try {
            JsonNode manifest = loadManifest();
            JsonNode rolesNode = manifest.get("roles");

            Set<String> manifestPermissions = new TreeSet<>();
            for (JsonNode permissionNode : manifest.get("permissions")) {
                manifestPermissions.add(permissionNode.get("name").asText());
            }
            Set<String> manifestRoles = new TreeSet<>();
            rolesNode.fieldNames().forEachRemaining(manifestRoles::add);

            List<Role> dbRoles = roleRepository.findAllWithPermissions();
            Set<String> dbPermissionNames = permissionRepository.findAll().stream()
                .map(Permission::getName)
                .collect(Collectors.toCollection(TreeSet::new));
            Set<String> dbRoleNames = dbRoles.stream()
                .map(Role::getName)
                .collect(Collectors.toCollection(TreeSet::new));

            List<String> missingPermissions = difference(manifestPermissions, dbPermissionNames);
            List<String> extraPermissions = difference(dbPermissionNames, manifestPermissions);
            List<String> missingRoles = difference(manifestRoles, dbRoleNames);
            List<String> extraRoles = difference(dbRoleNames, manifestRoles);

            Map<String, List<String>> rolePermissionMismatches = new TreeMap<>();
            for (Role role : dbRoles) {
                JsonNode roleNode = rolesNode.get(role.getName());
                if (roleNode == null) {
                    continue;
                }
                Set<String> expected = permissionNames(roleNode);
                Set<String> actual = currentPermissionNames(role);

                List<String> mismatches = new ArrayList<>();
                List<String> missing = difference(expected, actual);
                List<String> extra = difference(actual, expected);
                if (!missing.isEmpty()) {
                    mismatches.add("Missing: " + missing);
                }
                if (!extra.isEmpty()) {
                    mismatches.add("Extra: " + extra);
                }
                int expectedLevel = roleNode.get("level").asInt();
                if (expectedLevel != role.getLevel()) {
                    mismatches.add("Level: " + role.getLevel() + " (expected " + expectedLevel + ")");
                }
                if (!mismatches.isEmpty()) {
                    rolePermissionMismatches.put(role.getName(), mismatches);
                }
            }

            boolean isInSync = missingPermissions.isEmpty() && extraPermissions.isEmpty()
                && missingRoles.isEmpty() && extraRoles.isEmpty() && rolePermissionMismatches.isEmpty();

            return new PolicyDiff(missingPermissions, extraPermissions, missingRoles, extraRoles,
                rolePermissionMismatches, manifest.get("version").asText(), isInSync);

        } catch (IOException | RuntimeException e) {
            log.error("Failed to get policy diff: {}", e.getMessage(), e);
            return new PolicyDiff(List.of(), List.of(), List.of(), List.of(), Map.of(), "unknown", false);
        }
    }

    private JsonNode loadManifest() throws IOException {
        ClassPathResource resource = new ClassPathResource(properties.getPolicy().getManifestPath());
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readTree(in);
        }
    }

    private int reconcilePermissions(JsonNode manifest, List<String> errors) {
        int permissionsAdded = 0;
        for (JsonNode permissionNode : manifest.get("permissions")) {
            String permissionName = permissionNode.get("name").asText();
            if (permissionRepository.existsByName(permissionName)) {
                continue;
            }
            try {
                PermissionDefinition definition = new PermissionDefinition(
                    permissionName,
                    permissionNode.get("resource").asText(),
                    permissionNode.get("action").asText(),
                    PermissionScope.fromTag(permissionNode.path("scope").asText("none")));

                permissionRepository.save(Permission.builder()
                    .name(definition.name())
                    .resource(definition.resource())
                    .action(definition.action())
                    .scope(definition.scope())
                    .description(permissionNode.path("description").asText(null))
                    .build());
                permissionsAdded++;
                log.info("Added missing permission: {}", permissionName);
            } catch (RuntimeException e) {
                log.error("Failed to create permission {}: {}", permissionName, e.getMessage());
                errors.add("Failed to create permission " + permissionName + ": " + messageOf(e));
            }
        }
        return permissionsAdded;
    }

    private RoleChanges reconcileRoleNode(String roleName, JsonNode roleNode, List<String> errors) {
        int added = 0;
        int updated = 0;
        try {
            Optional<Role> existingRole = roleRepository.findByNameWithPermissions(roleName);
            Role role;
            if (existingRole.isEmpty()) {
                role = roleRepository.save(Role.builder()
                    .name(roleName)
                    .level(roleNode.get("level").asInt())
                    .description(roleNode.path("description").asText(null))
                    .permissions(new HashSet<>())
                    .build());
                added = 1;
                log.info("Created role: {}", roleName);
            } else {
                role = existingRole.get();
                if (updateRoleFromManifest(role, roleNode)) {
                    updated = 1;
                    log.info("Updated existing role: {}", roleName);
                }
            }

            int mappingsUpdated = updateRolePermissions(role, roleNode, errors);
            return new RoleChanges(added, updated, mappingsUpdated);
        } catch (RuntimeException e) {
            log.error("Failed to reconcile role {}: {}", roleName, e.getMessage());
            errors.add("Failed to reconcile role " + roleName + ": " + messageOf(e));
            return new RoleChanges(added, updated, 0);
        }
    }

    private boolean updateRoleFromManifest(Role role, JsonNode roleNode) {
        boolean updated = false;

        String expectedDescription = roleNode.path("description").asText(null);
        int expectedLevel = roleNode.get("level").asInt();

        if (!Objects.equals(expectedDescription, role.getDescription())) {
            role.setDescription(expectedDescription);
            updated = true;
        }
        if (expectedLevel != role.getLevel()) {
            role.setLevel(expectedLevel);
            updated = true;
        }

        if (updated) {
            roleRepository.save(role);
        }
        return updated;
    }

    private int updateRolePermissions(Role role, JsonNode roleNode, List<String> errors) {
        if (role.getPermissions() == null) {
            role.setPermissions(new HashSet<>());
        }
        Set<String> expectedPermissions = permissionNames(roleNode);
        Set<String> currentPermissions = currentPermissionNames(role);
        boolean changed = false;

        for (String permissionName : difference(expectedPermissions, currentPermissions)) {
            Optional<Permission> permission = permissionRepository.findByName(permissionName);
            if (permission.isEmpty()) {
                errors.add("Failed to add permission " + permissionName + " to role " + role.getName()
                    + ": permission not found");
                continue;
            }
            role.getPermissions().add(permission.get());
            changed = true;
            log.info("Added permission {} to role {}", permissionName, role.getName());
        }

        for (String permissionName : difference(currentPermissions, expectedPermissions)) {
            role.getPermissions().removeIf(p -> p.getName().equals(permissionName));
            changed = true;
            log.info("Removed permission {} from role {}", permissionName, role.getName());
        }

        if (!changed) {
            return 0;
        }
        roleRepository.save(role);
        eventPublisher.publishEvent(new RolePermissionsChangedEvent(this, role.getName(), null));
        return 1;
    }

    private Set<String> permissionNames(JsonNode roleNode) {
        Set<String> names = new TreeSet<>();
        for (JsonNode permissionNode : roleNode.get("permissions")) {
            names.add(permissionNode.asText());
        }
        return names;
    }

    private Set<String> currentPermissionNames(Role role) {
        if (role.getPermissions() == null) {
            return new TreeSet<>();
        }
        return role.getPermissions().stream()
            .map(Permission::getName)
            .collect(Collectors.toCollection(TreeSet::new));
    }

    private static List<String> difference(Set<String> left, Set<String> right) {
        return left.stream()
            .filter(name -> !right.contains(name))
            .collect(Collectors.toList());
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : "Unknown error";
    }

    private record RoleChanges(int added, int updated, int mappingsUpdated) {
    }
}
