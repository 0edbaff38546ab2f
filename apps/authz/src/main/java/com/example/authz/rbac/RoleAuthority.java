package com.example.authz.rbac;

import com.example.authz.rbac.model.Permission;
import com.example.authz.rbac.model.Role;
import com.example.authz.rbac.model.RolePermissionSet;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Role-based access control: resolves roles to permissions.
 *
 * <p>Inheritance depth is one: a role carries its own direct permissions plus the
 * direct permissions of each role listed in {@link RolePermissionSet#inheritedRoles()}.
 * Ancestors further up are not followed, so the table lists every ancestor a role
 * needs explicitly.
 *
 * <p>The role table is an immutable snapshot swapped on write. Reads take no lock;
 * {@link #addRolePermission} and {@link #removeRolePermission} are serialized.
 */
@Slf4j
public class RoleAuthority {

    private volatile Map<Role, RolePermissionSet> table;

    public RoleAuthority(Collection<RolePermissionSet> rolePermissions) {
        EnumMap<Role, RolePermissionSet> initial = new EnumMap<>(Role.class);
        for (RolePermissionSet entry : rolePermissions) {
            initial.put(entry.role(), entry);
        }
        this.table = Collections.unmodifiableMap(initial);
        log.info("Role authority initialized with {} roles", initial.size());
    }

    /**
     * Role authority backed by the built-in role table.
     */
    public static RoleAuthority withDefaults() {
        return new RoleAuthority(DefaultRoleTable.entries());
    }

    /**
     * Check if any of the roles carries the permission, directly or through one
     * level of inheritance. Unknown roles carry nothing.
     */
    public boolean hasPermission(Collection<Role> roles, Permission permission) {
        if (roles == null || permission == null) {
            return false;
        }

        Map<Role, RolePermissionSet> snapshot = table;
        for (Role role : roles) {
            RolePermissionSet entry = snapshot.get(role);
            if (entry == null) {
                continue;
            }
            if (entry.grants(permission)) {
                return true;
            }
            for (Role inherited : entry.inheritedRoles()) {
                RolePermissionSet inheritedEntry = snapshot.get(inherited);
                if (inheritedEntry != null && inheritedEntry.grants(permission)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Union of direct and one-hop inherited permissions across all roles.
     */
    public Set<Permission> permissionClosure(Collection<Role> roles) {
        EnumSet<Permission> closure = EnumSet.noneOf(Permission.class);
        if (roles == null) {
            return closure;
        }

        Map<Role, RolePermissionSet> snapshot = table;
        for (Role role : roles) {
            RolePermissionSet entry = snapshot.get(role);
            if (entry == null) {
                continue;
            }
            closure.addAll(entry.permissions());
            for (Role inherited : entry.inheritedRoles()) {
                RolePermissionSet inheritedEntry = snapshot.get(inherited);
                if (inheritedEntry != null) {
                    closure.addAll(inheritedEntry.permissions());
                }
            }
        }
        return closure;
    }

    /**
     * Check access to an action on a resource type, e.g. {@code ("claim", "approve")}.
     * An action that does not name a known permission is denied.
     */
    public boolean canAccess(Collection<Role> roles, String resourceType, String action) {
        Optional<Permission> permission = Permission.of(resourceType, action);
        if (permission.isEmpty()) {
            log.debug("Unknown permission {}:{} - denying", resourceType, action);
            return false;
        }
        return hasPermission(roles, permission.get());
    }

    public Optional<RolePermissionSet> getRolePermissions(Role role) {
        return Optional.ofNullable(table.get(role));
    }

    /**
     * Grant an additional direct permission to a role. A role missing from the
     * table is added with no inherited roles.
     */
    public synchronized void addRolePermission(Role role, Permission permission) {
        if (role == null || permission == null) {
            throw new IllegalArgumentException("role and permission are required");
        }
        EnumMap<Role, RolePermissionSet> updated = new EnumMap<>(Role.class);
        updated.putAll(table);
        RolePermissionSet current = updated.getOrDefault(role, RolePermissionSet.of(role, Set.of()));
        updated.put(role, current.withPermission(permission));
        table = Collections.unmodifiableMap(updated);
        log.info("Granted {} to role {}", permission, role.getValue());
    }

    /**
     * Revoke a direct permission from a role. Inherited grants are unaffected.
     */
    public synchronized void removeRolePermission(Role role, Permission permission) {
        RolePermissionSet current = table.get(role);
        if (current == null || !current.grants(permission)) {
            return;
        }
        EnumMap<Role, RolePermissionSet> updated = new EnumMap<>(Role.class);
        updated.putAll(table);
        updated.put(role, current.withoutPermission(permission));
        table = Collections.unmodifiableMap(updated);
        log.info("Revoked {} from role {}", permission, role.getValue());
    }
}
