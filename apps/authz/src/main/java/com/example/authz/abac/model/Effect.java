package com.example.authz.abac.model;

import java.util.Optional;

/**
 * Outcome a matched policy rule asserts.
 */
public enum Effect {
    ALLOW("allow"),
    DENY("deny");

    private final String value;

    Effect(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<Effect> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        for (Effect effect : values()) {
            if (effect.value.equalsIgnoreCase(normalized)) {
                return Optional.of(effect);
            }
        }
        return Optional.empty();
    }
}
