package com.example.authz.rbac.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Identity categories a subject can hold.
 * Serialized values match the role strings carried in subject attributes.
 */
public enum Role {
    SUPER_ADMIN("super_admin"),
    ADMIN("admin"),
    USER("user"),
    VIEWER("viewer"),
    AUDITOR("auditor");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parse a role string. Only the exact serialized value is recognised;
     * constant names such as {@code "SUPER_ADMIN"} yield an empty result.
     */
    public static Optional<Role> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve the {@code roles} subject attribute into known roles.
     * Accepts a collection of {@link Role} or strings, or a single string.
     * Entries that are not recognised are dropped.
     */
    public static List<Role> resolveAll(Object rolesAttribute) {
        if (rolesAttribute instanceof Role role) {
            return List.of(role);
        }
        if (rolesAttribute instanceof String single) {
            return fromValue(single).map(List::of).orElse(List.of());
        }
        if (!(rolesAttribute instanceof Collection<?> collection)) {
            return List.of();
        }

        List<Role> resolved = new ArrayList<>(collection.size());
        for (Object item : collection) {
            if (item instanceof Role role) {
                resolved.add(role);
            } else if (item != null) {
                fromValue(item.toString()).ifPresent(resolved::add);
            }
        }
        return resolved;
    }
}
