package com.example.authz.rbac.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Direct permissions of a role and the roles it inherits from.
 *
 * <p>Inherited roles are not expanded in storage. Resolution walks the list once,
 * so only the inherited roles' direct permissions are reachable.
 *
 * @param role           The role this entry describes
 * @param permissions    Permissions granted directly to the role
 * @param inheritedRoles Roles whose direct permissions are also granted
 */
public record RolePermissionSet(
        Role role,
        Set<Permission> permissions,
        List<Role> inheritedRoles
) {
    public RolePermissionSet {
        permissions = permissions == null || permissions.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(permissions));
        inheritedRoles = inheritedRoles == null ? List.of() : List.copyOf(inheritedRoles);
    }

    public static RolePermissionSet of(Role role, Set<Permission> permissions, Role... inheritedRoles) {
        return new RolePermissionSet(role, permissions, List.of(inheritedRoles));
    }

    public boolean grants(Permission permission) {
        return permission != null && permissions.contains(permission);
    }

    /**
     * Copy of this entry with one more direct permission.
     */
    public RolePermissionSet withPermission(Permission permission) {
        EnumSet<Permission> updated = EnumSet.noneOf(Permission.class);
        updated.addAll(permissions);
        updated.add(permission);
        return new RolePermissionSet(role, updated, inheritedRoles);
    }

    /**
     * Copy of this entry without the given direct permission.
     */
    public RolePermissionSet withoutPermission(Permission permission) {
        EnumSet<Permission> updated = EnumSet.noneOf(Permission.class);
        updated.addAll(permissions);
        updated.remove(permission);
        return new RolePermissionSet(role, updated, inheritedRoles);
    }
}
