package com.example.authz.rbac.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Capabilities scoped to a resource type and verb, serialized as {@code "<resource>:<verb>"}.
 */
public enum Permission {
    // Claims
    CLAIM_VIEW("claim:view"),
    CLAIM_CREATE("claim:create"),
    CLAIM_EDIT("claim:edit"),
    CLAIM_DELETE("claim:delete"),
    CLAIM_APPROVE("claim:approve"),

    // Members
    MEMBER_VIEW("member:view"),
    MEMBER_CREATE("member:create"),
    MEMBER_EDIT("member:edit"),
    MEMBER_DELETE("member:delete"),

    // Policies
    POLICY_VIEW("policy:view"),
    POLICY_CREATE("policy:create"),
    POLICY_EDIT("policy:edit"),
    POLICY_DELETE("policy:delete"),

    // Admin
    ADMIN_VIEW("admin:view"),
    ADMIN_MANAGE_USERS("admin:manage_users"),
    ADMIN_MANAGE_ROLES("admin:manage_roles"),
    ADMIN_VIEW_AUDIT("admin:view_audit"),
    ADMIN_SYSTEM_CONFIG("admin:system_config"),

    // Analytics
    ANALYTICS_VIEW("analytics:view"),
    ANALYTICS_EXPORT("analytics:export");

    private final String value;

    Permission(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parse a {@code "<resource>:<verb>"} string. Matching is exact, so
     * {@code "CLAIM:VIEW"} or a padded value is not a known permission.
     */
    public static Optional<Permission> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Permission permission : values()) {
            if (permission.value.equals(value)) {
                return Optional.of(permission);
            }
        }
        return Optional.empty();
    }

    /**
     * Parse the permission for an action on a resource type, e.g. {@code ("claim", "approve")}.
     * Both parts are lower-cased before lookup.
     */
    public static Optional<Permission> of(String resourceType, String action) {
        if (resourceType == null || action == null) {
            return Optional.empty();
        }
        return fromValue((resourceType + ":" + action).toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return value;
    }
}
