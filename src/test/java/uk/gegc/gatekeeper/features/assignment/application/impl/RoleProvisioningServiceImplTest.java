package uk.gegc.gatekeeper.features.assignment.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.springframework.context.ApplicationEventPublisher;
import uk.gegc.gatekeeper.BaseUnitTest;
import uk.gegc.gatekeeper.features.assignment.domain.event.RolePermissionsChangedEvent;
import uk.gegc.gatekeeper.features.catalog.domain.model.Permission;
import uk.gegc.gatekeeper.features.catalog.domain.model.PermissionScope;
import uk.gegc.gatekeeper.features.catalog.domain.model.Role;
import uk.gegc.gatekeeper.features.catalog.domain.repository.PermissionRepository;
import uk.gegc.gatekeeper.features.catalog.domain.repository.RoleRepository;
import uk.gegc.gatekeeper.shared.exception.ResourceNotFoundException;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("RoleProvisioningServiceImpl")
class RoleProvisioningServiceImplTest extends BaseUnitTest {

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private PermissionRepository permissionRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private RoleProvisioningServiceImpl provisioningService;

    private final Permission export = Permission.builder().id(1L).name("analytics.export")
            .resource("analytics").action("export").scope(PermissionScope.NONE).build();

    @Test
    @DisplayName("grantPermission: adds the permission and publishes a role change")
    void grantPermission_success() {
        // Given
        Role manager = Role.builder().id(3L).name("manager").level(3).permissions(new HashSet<>()).build();
        when(roleRepository.findByNameWithPermissions("manager")).thenReturn(Optional.of(manager));
        when(permissionRepository.findByName("analytics.export")).thenReturn(Optional.of(export));

        // When
        provisioningService.grantPermission("manager", "analytics.export");

        // Then
        assertThat(manager.getPermissions()).containsExactly(export);
        verify(roleRepository).save(manager);
        verify(eventPublisher).publishEvent(any(RolePermissionsChangedEvent.class));
    }

    @Test
    @DisplayName("grantPermission: permission already carried is a no-op")
    void grantPermission_alreadyCarried() {
        Role manager = Role.builder().id(3L).name("manager").level(3).permissions(new HashSet<>(Set.of(export))).build();
        when(roleRepository.findByNameWithPermissions("manager")).thenReturn(Optional.of(manager));
        when(permissionRepository.findByName("analytics.export")).thenReturn(Optional.of(export));

        provisioningService.grantPermission("manager", "analytics.export");

        verify(roleRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("grantPermission: unknown permission throws ResourceNotFoundException")
    void grantPermission_unknownPermission() {
        Role manager = Role.builder().id(3L).name("manager").level(3).permissions(new HashSet<>()).build();
        when(roleRepository.findByNameWithPermissions("manager")).thenReturn(Optional.of(manager));
        when(permissionRepository.findByName("analytics.typo")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> provisioningService.grantPermission("manager", "analytics.typo"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("revokePermission: removes the permission and publishes a role change")
    void revokePermission_success() {
        Role manager = Role.builder().id(3L).name("manager").level(3).permissions(new HashSet<>(Set.of(export))).build();
        when(roleRepository.findByNameWithPermissions("manager")).thenReturn(Optional.of(manager));
        when(permissionRepository.existsByName("analytics.export")).thenReturn(true);

        provisioningService.revokePermission("manager", "analytics.export");

        assertThat(manager.getPermissions()).isEmpty();
        verify(eventPublisher).publishEvent(any(RolePermissionsChangedEvent.class));
    }

    @Test
    @DisplayName("getRolePermissions: unknown role throws ResourceNotFoundException")
    void getRolePermissions_unknownRole() {
        when(roleRepository.findByNameWithPermissions("owner")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> provisioningService.getRolePermissions("owner"))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
