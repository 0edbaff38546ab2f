package com.example.authz.rbac;

import com.example.authz.rbac.model.Permission;
import com.example.authz.rbac.model.Role;
import com.example.authz.rbac.model.RolePermissionSet;

import java.util.EnumSet;
import java.util.List;

import static com.example.authz.rbac.model.Permission.*;

/**
 * Built-in role to permission table.
 */
final class DefaultRoleTable {

    private DefaultRoleTable() {}

    static List<RolePermissionSet> entries() {
        return List.of(
                RolePermissionSet.of(Role.SUPER_ADMIN, EnumSet.allOf(Permission.class)),

                RolePermissionSet.of(Role.ADMIN, EnumSet.of(
                        CLAIM_VIEW, CLAIM_CREATE, CLAIM_EDIT, CLAIM_DELETE, CLAIM_APPROVE,
                        MEMBER_VIEW, MEMBER_CREATE, MEMBER_EDIT, MEMBER_DELETE,
                        POLICY_VIEW, POLICY_CREATE, POLICY_EDIT, POLICY_DELETE,
                        ADMIN_VIEW, ADMIN_MANAGE_USERS,
                        ANALYTICS_VIEW, ANALYTICS_EXPORT),
                        Role.USER, Role.VIEWER),

                RolePermissionSet.of(Role.USER, EnumSet.of(
                        CLAIM_VIEW, CLAIM_CREATE, CLAIM_EDIT,
                        MEMBER_VIEW, MEMBER_CREATE, MEMBER_EDIT,
                        POLICY_VIEW,
                        ANALYTICS_VIEW),
                        Role.VIEWER),

                RolePermissionSet.of(Role.VIEWER, EnumSet.of(
                        CLAIM_VIEW, MEMBER_VIEW, POLICY_VIEW)),

                RolePermissionSet.of(Role.AUDITOR, EnumSet.of(
                        CLAIM_VIEW, MEMBER_VIEW, POLICY_VIEW,
                        ADMIN_VIEW_AUDIT,
                        ANALYTICS_VIEW))
        );
    }
}
