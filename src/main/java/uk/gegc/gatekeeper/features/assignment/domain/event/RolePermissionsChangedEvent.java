package uk.gegc.gatekeeper.features.assignment.domain.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * The permission set of a role changed; every holder of the role is affected.
 */
@Getter
public class RolePermissionsChangedEvent extends ApplicationEvent {

    private final String roleName;
    private final String permissionName;

    public RolePermissionsChangedEvent(Object source, String roleName, String permissionName) {
        super(source);
        this.roleName = roleName;
        this.permissionName = permissionName;
    }
}
